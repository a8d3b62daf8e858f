package eddyflux.physics.processor;

import eddyflux.config.CorrectionConfig;
import eddyflux.config.FluxOptions;
import eddyflux.domain.exception.FluxValidationException;
import eddyflux.domain.flux.DiagnosticKeys;
import eddyflux.domain.flux.FluxResult;
import eddyflux.domain.flux.QualityFlag;
import eddyflux.domain.series.SonicSeries;
import eddyflux.physics.model.FootprintEstimate;
import eddyflux.physics.model.FootprintModel;
import eddyflux.physics.model.NeutralFootprintModel;
import eddyflux.physics.qc.StationarityResult;
import eddyflux.physics.qc.StationarityTest;
import eddyflux.physics.qc.TurbulenceResult;
import eddyflux.physics.qc.TurbulenceTest;
import eddyflux.physics.rotation.CoordinateRotation;
import eddyflux.physics.rotation.RotationCorrection;
import eddyflux.physics.solver.DespikeResult;
import eddyflux.physics.solver.Despiker;
import eddyflux.physics.solver.impl.VickersMahrtDespiker;
import eddyflux.utils.SeriesStatistics;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Punto de entrada del cálculo del flujo de calor sensible por covarianza turbulenta.
 * <p>
 * Secuencia (sin realimentación entre etapas):
 * <ol>
 * <li>Validación de la entrada (errores fatales, {@link FluxValidationException}).</li>
 * <li>Despiking.</li>
 * <li>Rotación de coordenadas (con fallback a series sin rotar).</li>
 * <li>Test de estacionariedad sobre w rotada y T limpia (aporta la covarianza).</li>
 * <li>Test de turbulencia (ITC) sobre u, v, w rotadas.</li>
 * <li>Huella del flujo, solo si se conoce la altura de medida.</li>
 * <li>Flujo = ρ · cp · cov(w', T') con corrección WPL aproximada.</li>
 * </ol>
 * Los problemas de calidad se comunican con banderas y diagnósticos; nunca abortan la llamada.
 * <p>
 * Stateless y Thread-Safe: una misma instancia puede usarse desde varios hilos.
 */
@Slf4j
public class SensibleHeatFluxProcessor {

    private final CorrectionConfig config;
    private final Despiker despiker;
    private final CoordinateRotation coordinateRotation;
    private final StationarityTest stationarityTest;
    private final TurbulenceTest turbulenceTest;
    private final FootprintModel footprintModel;

    /**
     * Constructor por defecto con las constantes de {@link CorrectionConfig#defaults()}.
     */
    public SensibleHeatFluxProcessor() {
        this(CorrectionConfig.defaults());
    }

    public SensibleHeatFluxProcessor(CorrectionConfig config) {
        this(config,
                new VickersMahrtDespiker(config),
                new CoordinateRotation(config),
                new StationarityTest(config),
                new TurbulenceTest(config),
                new NeutralFootprintModel(config));
    }

    /**
     * Constructor canónico. Permite sustituir cualquier etapa (p. ej. en tests).
     */
    public SensibleHeatFluxProcessor(CorrectionConfig config,
                                     Despiker despiker,
                                     CoordinateRotation coordinateRotation,
                                     StationarityTest stationarityTest,
                                     TurbulenceTest turbulenceTest,
                                     FootprintModel footprintModel) {
        this.config = config;
        this.despiker = despiker;
        this.coordinateRotation = coordinateRotation;
        this.stationarityTest = stationarityTest;
        this.turbulenceTest = turbulenceTest;
        this.footprintModel = footprintModel;
    }

    public FluxResult computeSensibleHeatFlux(double[] u, double[] v, double[] w, double[] temperature,
                                              FluxOptions options) {
        return computeSensibleHeatFlux(new SonicSeries(u, v, w, temperature), options);
    }

    public FluxResult computeSensibleHeatFlux(SonicSeries series, FluxOptions options) {
        final FluxOptions opts = options != null ? options : FluxOptions.builder().build();
        validateInputs(series, opts);

        EnumSet<QualityFlag> qualityFlags = EnumSet.of(QualityFlag.VALID);
        Map<String, Double> diagnostics = new LinkedHashMap<>();

        // 1. Despiking
        DespikeResult despiked = despiker.despike(series);
        if (despiked.hasSpikes()) {
            qualityFlags.add(QualityFlag.SPIKES_DETECTED);
        }
        diagnostics.put(DiagnosticKeys.SPIKE_COUNT, (double) despiked.spikeCount());
        diagnostics.put(DiagnosticKeys.SPIKE_PERCENTAGE, despiked.spikePercentage());

        SonicSeries clean = despiked.cleaned();

        // 2. Rotación de coordenadas
        RotationCorrection rotation = coordinateRotation.applyCoordinateRotation(clean, opts.getRotationMethod());
        if (Math.abs(rotation.betaDegrees()) > config.maxAngleOfAttackDegrees()) {
            qualityFlags.add(QualityFlag.ANGLE_OF_ATTACK_EXCEEDED);
        }
        diagnostics.put(DiagnosticKeys.ROTATION_ANGLE_ALPHA, rotation.alphaDegrees());
        diagnostics.put(DiagnosticKeys.ROTATION_ANGLE_BETA, rotation.betaDegrees());
        diagnostics.put(DiagnosticKeys.ROTATION_QUALITY_FLAGS, (double) rotation.qualityMask());

        // 3. Estacionariedad (w rotada frente a T limpia)
        StationarityResult stationarity = stationarityTest.evaluate(rotation.w(), clean.temperature());
        if (!stationarity.stationary()) {
            qualityFlags.add(QualityFlag.NON_STATIONARY_CONDITIONS);
        }
        diagnostics.put(DiagnosticKeys.COVARIANCE_WT, stationarity.covariance());
        diagnostics.put(DiagnosticKeys.STATIONARITY_RELATIVE_DIFFERENCE, stationarity.relativeDifference());

        // 4. Turbulencia (ITC)
        TurbulenceResult turbulence = turbulenceTest.evaluate(rotation.u(), rotation.v(), rotation.w());
        if (!turbulence.sufficient()) {
            qualityFlags.add(QualityFlag.WEAK_TURBULENCE);
        }
        diagnostics.put(DiagnosticKeys.SIGMA_U_RATIO, turbulence.sigmaURatio());
        diagnostics.put(DiagnosticKeys.SIGMA_V_RATIO, turbulence.sigmaVRatio());
        diagnostics.put(DiagnosticKeys.SIGMA_W_RATIO, turbulence.sigmaWRatio());

        // 5. Huella del flujo (opcional)
        if (opts.hasMeasurementHeight()) {
            FootprintEstimate footprint = footprintModel.estimate(
                    SeriesStatistics.mean(rotation.u()),
                    opts.getMeasurementHeight(),
                    opts.getRoughnessLength());
            diagnostics.put(DiagnosticKeys.FRICTION_VELOCITY, footprint.frictionVelocity());
            diagnostics.put(DiagnosticKeys.FLUX_FOOTPRINT_DISTANCE, footprint.peakDistance());
        }

        // 6. Covarianza -> flujo, con corrección WPL aproximada (sin vapor de agua)
        double flux = calculateFlux(stationarity.covariance()) * config.wplCorrectionFactor();

        FluxResult result = new FluxResult(flux, FluxResult.UNIT_W_PER_M2, qualityFlags, diagnostics);
        log.info("Flujo de calor sensible: {} {} (flags={}, n={})",
                String.format("%.2f", flux), result.unit(), qualityFlags, series.length());
        return result;
    }

    /**
     * Flujo sin corregir: ρ · cp · cov(w', T').
     */
    public double calculateFlux(double covariance) {
        return config.airDensity() * config.specificHeatCapacity() * covariance;
    }

    private void validateInputs(SonicSeries series, FluxOptions options) {
        if (series == null || series.u() == null || series.v() == null
                || series.w() == null || series.temperature() == null) {
            throw new FluxValidationException("Las series u, v, w y T son obligatorias.");
        }
        if (!series.hasConsistentLength()) {
            throw new FluxValidationException("Todas las series deben tener la misma longitud.");
        }

        int minimumAllowed = 2 * config.stationaritySubPeriods();
        if (options.getMinSampleCount() < minimumAllowed) {
            throw new FluxValidationException(String.format(
                    "El mínimo de muestras configurado (%d) debe ser al menos %d.",
                    options.getMinSampleCount(), minimumAllowed));
        }
        if (series.length() < options.getMinSampleCount()) {
            throw new FluxValidationException(String.format(
                    "Se requieren al menos %d muestras (recibidas: %d).",
                    options.getMinSampleCount(), series.length()));
        }

        Double height = options.getMeasurementHeight();
        if (height != null && !(height > 0)) {
            throw new FluxValidationException("La altura de medida debe ser positiva.");
        }

        Double roughness = options.getRoughnessLength();
        if (roughness != null) {
            if (!(roughness > 0)) {
                throw new FluxValidationException("La longitud de rugosidad debe ser positiva.");
            }
            if (height != null && roughness >= height) {
                throw new FluxValidationException("La longitud de rugosidad debe ser menor que la altura de medida.");
            }
        }

        Double frequency = options.getSamplingFrequency();
        if (frequency != null && !(frequency > 0)) {
            throw new FluxValidationException("La frecuencia de muestreo debe ser positiva.");
        }
    }
}
