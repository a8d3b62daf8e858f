package eddyflux.physics.solver.impl;

import eddyflux.config.CorrectionConfig;
import eddyflux.domain.series.SonicSeries;
import eddyflux.physics.solver.RotationFailure;
import eddyflux.physics.solver.RotationOutcome;
import eddyflux.physics.solver.RotationSolver;
import eddyflux.physics.solver.WindMeans;

/**
 * Rotación por planar fit (Wilczak et al., 2001) sobre un único intervalo.
 * <p>
 * Ajusta por mínimos cuadrados el plano w = b0 + b1·u + b2·v y deriva de sus pendientes
 * los ángulos de la matriz de rotación combinada, que se aplica en una sola pasada
 * a (u, v, w - b0).
 */
public class PlanarFitRotationSolver implements RotationSolver {

    private final double maxRotationAngleRadians;
    private final double singularTolerance;

    public PlanarFitRotationSolver() {
        this(CorrectionConfig.defaults());
    }

    public PlanarFitRotationSolver(CorrectionConfig config) {
        this(config.maxRotationAngleDegrees(), config.singularDeterminantTolerance());
    }

    public PlanarFitRotationSolver(double maxRotationAngleDegrees, double singularTolerance) {
        this.maxRotationAngleRadians = Math.toRadians(maxRotationAngleDegrees);
        this.singularTolerance = singularTolerance;
    }

    @Override
    public String getName() {
        return "PlanarFit";
    }

    /**
     * Coeficientes del plano medio del flujo.
     *
     * @param determinant Determinante del sistema normal 2x2 (sobre desviaciones).
     * @param singular    true si |det| está por debajo de la tolerancia; b0, b1 y b2 son NaN.
     */
    public record PlaneFit(double b0, double b1, double b2, double determinant, boolean singular) {
    }

    public PlaneFit fitPlane(SonicSeries series, WindMeans means) {
        final double[] u = series.u();
        final double[] v = series.v();
        final double[] w = series.w();
        final int n = u.length;

        double sumU2 = 0, sumV2 = 0, sumUV = 0, sumUW = 0, sumVW = 0;
        for (int i = 0; i < n; i++) {
            double uDev = u[i] - means.meanU();
            double vDev = v[i] - means.meanV();
            double wDev = w[i] - means.meanW();

            sumU2 += uDev * uDev;
            sumV2 += vDev * vDev;
            sumUV += uDev * vDev;
            sumUW += uDev * wDev;
            sumVW += vDev * wDev;
        }

        double det = sumU2 * sumV2 - sumUV * sumUV;
        if (Math.abs(det) < singularTolerance) {
            return new PlaneFit(Double.NaN, Double.NaN, Double.NaN, det, true);
        }

        // Regla de Cramer sobre las ecuaciones normales
        double b1 = (sumUW * sumV2 - sumVW * sumUV) / det;
        double b2 = (sumVW * sumU2 - sumUW * sumUV) / det;
        double b0 = means.meanW() - b1 * means.meanU() - b2 * means.meanV();

        return new PlaneFit(b0, b1, b2, det, false);
    }

    @Override
    public RotationOutcome rotate(SonicSeries series, WindMeans means) {
        PlaneFit plane = fitPlane(series, means);
        if (plane.singular()) {
            return new RotationOutcome.Rejected(RotationFailure.SINGULAR_MATRIX,
                    String.format("Matriz singular en el planar fit (det=%.3e)", plane.determinant()));
        }

        double b1 = plane.b1();
        double b2 = plane.b2();
        double beta = Math.atan(b1 / Math.sqrt(1 + b1 * b1 + b2 * b2));
        double alpha = Math.atan(b2 / Math.sqrt(1 + b2 * b2));

        if (Math.abs(beta) > maxRotationAngleRadians || Math.abs(alpha) > maxRotationAngleRadians) {
            return new RotationOutcome.Rejected(RotationFailure.EXTREME_ROTATION_ANGLE,
                    String.format("Ángulos de rotación extremos: alpha=%.1f°, beta=%.1f°",
                            Math.toDegrees(alpha), Math.toDegrees(beta)));
        }

        final double cosBeta = Math.cos(beta);
        final double sinBeta = Math.sin(beta);
        final double cosAlpha = Math.cos(alpha);
        final double sinAlpha = Math.sin(alpha);

        final double[] u = series.u();
        final double[] v = series.v();
        final double[] w = series.w();
        final int n = u.length;
        final double offset = plane.b0();

        double[] rotatedU = new double[n];
        double[] rotatedV = new double[n];
        double[] rotatedW = new double[n];

        for (int i = 0; i < n; i++) {
            double wi = w[i] - offset;
            rotatedU[i] = u[i] * cosAlpha * cosBeta + v[i] * sinAlpha * cosBeta + wi * sinBeta;
            rotatedV[i] = -u[i] * sinAlpha + v[i] * cosAlpha;
            rotatedW[i] = -u[i] * cosAlpha * sinBeta - v[i] * sinAlpha * sinBeta + wi * cosBeta;
        }

        return new RotationOutcome.Rotated(rotatedU, rotatedV, rotatedW,
                Math.toDegrees(alpha), Math.toDegrees(beta));
    }
}
