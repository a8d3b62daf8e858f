package eddyflux.physics.solver.impl;

import eddyflux.config.CorrectionConfig;
import eddyflux.domain.series.SonicSeries;
import eddyflux.physics.solver.RotationFailure;
import eddyflux.physics.solver.RotationOutcome;
import eddyflux.physics.solver.RotationSolver;
import eddyflux.physics.solver.WindMeans;

/**
 * Doble rotación clásica.
 * <ol>
 * <li>Alpha (eje vertical): alinea u con la dirección media del viento, anulando v medio.</li>
 * <li>Beta (eje transversal): inclina (u1, w) para anular w medio. v no cambia.</li>
 * </ol>
 * Rechaza la rotación si |beta| supera el ángulo máximo configurado.
 */
public class DoubleRotationSolver implements RotationSolver {

    private final double maxRotationAngleRadians;

    public DoubleRotationSolver() {
        this(CorrectionConfig.defaults().maxRotationAngleDegrees());
    }

    public DoubleRotationSolver(double maxRotationAngleDegrees) {
        this.maxRotationAngleRadians = Math.toRadians(maxRotationAngleDegrees);
    }

    @Override
    public String getName() {
        return "DoubleRotation";
    }

    @Override
    public RotationOutcome rotate(SonicSeries series, WindMeans means) {
        double alpha = Math.atan2(means.meanV(), means.meanU());
        double beta = Math.atan2(means.meanW(), means.horizontalSpeed());

        if (Math.abs(beta) > maxRotationAngleRadians) {
            return new RotationOutcome.Rejected(RotationFailure.EXTREME_ROTATION_ANGLE,
                    String.format("Ángulo de rotación extremo: beta=%.1f°", Math.toDegrees(beta)));
        }

        final double[] u = series.u();
        final double[] v = series.v();
        final double[] w = series.w();
        final int n = u.length;

        double[] rotatedU = new double[n];
        double[] rotatedV = new double[n];
        double[] rotatedW = new double[n];

        final double cosAlpha = Math.cos(alpha);
        final double sinAlpha = Math.sin(alpha);
        final double cosBeta = Math.cos(beta);
        final double sinBeta = Math.sin(beta);

        for (int i = 0; i < n; i++) {
            // Primera rotación (alpha)
            double u1 = u[i] * cosAlpha + v[i] * sinAlpha;
            double v1 = -u[i] * sinAlpha + v[i] * cosAlpha;

            // Segunda rotación (beta)
            rotatedU[i] = u1 * cosBeta + w[i] * sinBeta;
            rotatedV[i] = v1;
            rotatedW[i] = -u1 * sinBeta + w[i] * cosBeta;
        }

        return new RotationOutcome.Rotated(rotatedU, rotatedV, rotatedW,
                Math.toDegrees(alpha), Math.toDegrees(beta));
    }
}
