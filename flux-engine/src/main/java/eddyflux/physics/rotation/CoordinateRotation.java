package eddyflux.physics.rotation;

import eddyflux.config.CorrectionConfig;
import eddyflux.config.RotationMethod;
import eddyflux.domain.flux.RotationQualityFlag;
import eddyflux.domain.series.SonicSeries;
import eddyflux.physics.solver.RotationOutcome;
import eddyflux.physics.solver.RotationSolver;
import eddyflux.physics.solver.WindMeans;
import eddyflux.physics.solver.impl.DoubleRotationSolver;
import eddyflux.physics.solver.impl.PlanarFitRotationSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * Orquestador de la rotación de coordenadas.
 * <p>
 * Responsabilidades:
 * 1. Evaluar el régimen de viento (muy bajo: no se rota; bajo: se rota y se marca).
 * 2. Delegar en el solver del método pedido.
 * 3. Degradar con elegancia: si el solver rechaza los datos se devuelven las series sin rotar
 *    con la bandera del fallo, nunca se aborta el cálculo del flujo.
 */
@Slf4j
public class CoordinateRotation {

    private final double veryLowWindSpeed;
    private final double lowWindSpeed;
    private final Map<RotationMethod, RotationSolver> solvers;

    public CoordinateRotation() {
        this(CorrectionConfig.defaults());
    }

    public CoordinateRotation(CorrectionConfig config) {
        this(config.veryLowWindSpeed(), config.lowWindSpeed(),
                new DoubleRotationSolver(config.maxRotationAngleDegrees()),
                new PlanarFitRotationSolver(config));
    }

    public CoordinateRotation(double veryLowWindSpeed, double lowWindSpeed,
                              RotationSolver doubleRotation, RotationSolver planarFit) {
        this.veryLowWindSpeed = veryLowWindSpeed;
        this.lowWindSpeed = lowWindSpeed;
        this.solvers = new EnumMap<>(RotationMethod.class);
        this.solvers.put(RotationMethod.DOUBLE_ROTATION, doubleRotation);
        this.solvers.put(RotationMethod.PLANAR_FIT, planarFit);
    }

    public RotationCorrection applyCoordinateRotation(SonicSeries series, RotationMethod method) {
        WindMeans means = WindMeans.of(series);
        double horizontalSpeed = means.horizontalSpeed();

        EnumSet<RotationQualityFlag> flags = EnumSet.noneOf(RotationQualityFlag.class);

        if (horizontalSpeed < veryLowWindSpeed) {
            log.warn("Velocidad horizontal {} m/s por debajo de {} m/s. Se omite la rotación.",
                    String.format("%.3f", horizontalSpeed), veryLowWindSpeed);
            flags.add(RotationQualityFlag.LOW_WIND_SPEED);
            return unrotated(series, flags, horizontalSpeed);
        }

        flags.add(RotationQualityFlag.VALID);
        if (horizontalSpeed < lowWindSpeed) {
            flags.add(RotationQualityFlag.LOW_WIND_SPEED);
        }

        RotationSolver solver = solvers.get(method == null ? RotationMethod.DOUBLE_ROTATION : method);
        RotationOutcome outcome = solver.rotate(series, means);

        if (outcome instanceof RotationOutcome.Rotated rotated) {
            log.debug("{}: alpha={}°, beta={}°", solver.getName(),
                    String.format("%.2f", rotated.alphaDegrees()), String.format("%.2f", rotated.betaDegrees()));
            return new RotationCorrection(rotated.u(), rotated.v(), rotated.w(),
                    rotated.alphaDegrees(), rotated.betaDegrees(), flags, horizontalSpeed);
        }

        RotationOutcome.Rejected rejected = (RotationOutcome.Rejected) outcome;
        log.warn("{} rechazada ({}): {}. Se usan las series sin rotar.",
                solver.getName(), rejected.reason(), rejected.detail());
        flags.add(rejected.reason().toFlag());
        return unrotated(series, flags, horizontalSpeed);
    }

    private static RotationCorrection unrotated(SonicSeries series, EnumSet<RotationQualityFlag> flags,
                                                double horizontalSpeed) {
        return new RotationCorrection(series.u(), series.v(), series.w(), 0.0, 0.0, flags, horizontalSpeed);
    }
}
