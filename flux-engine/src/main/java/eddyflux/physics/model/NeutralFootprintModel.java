package eddyflux.physics.model;

import eddyflux.config.CorrectionConfig;

/**
 * Estimación simplificada de la distancia de máxima contribución de la huella del flujo,
 * inspirada en Kljun et al. (2015) para estabilidad neutra.
 * <p>
 * Supuestos: estratificación neutra, perfil logarítmico del viento, superficie homogénea
 * y sin altura de capa límite. Es una aproximación para control de calidad, no un modelo
 * de huella completo:
 * <pre>
 *   u*    = U · κ / ln(z / z0)
 *   x_max = z · 2 · (U / u*) · (1 - exp(-1.5 · z / z0))
 * </pre>
 * Como U / u* = ln(z / z0) / κ, la distancia no depende de U y es finita con viento nulo.
 */
public class NeutralFootprintModel implements FootprintModel {

    private final double vonKarman;
    private final double roughnessHeightRatio;

    public NeutralFootprintModel() {
        this(CorrectionConfig.defaults());
    }

    public NeutralFootprintModel(CorrectionConfig config) {
        this(config.vonKarman(), config.roughnessHeightRatio());
    }

    public NeutralFootprintModel(double vonKarman, double roughnessHeightRatio) {
        this.vonKarman = vonKarman;
        this.roughnessHeightRatio = roughnessHeightRatio;
    }

    public double estimateRoughnessLength(double measurementHeight) {
        return measurementHeight * roughnessHeightRatio;
    }

    @Override
    public FootprintEstimate estimate(double meanWindSpeed, double measurementHeight, Double roughnessLength) {
        double z0 = roughnessLength != null ? roughnessLength : estimateRoughnessLength(measurementHeight);
        if (measurementHeight <= 0 || z0 <= 0 || z0 >= measurementHeight) {
            throw new IllegalArgumentException(String.format(
                    "Se requiere 0 < z0 < z (z0=%.3f m, z=%.3f m).", z0, measurementHeight));
        }

        double logRatio = Math.log(measurementHeight / z0);
        double frictionVelocity = meanWindSpeed * vonKarman / logRatio;
        double windToFriction = logRatio / vonKarman;

        double peakDistance = measurementHeight * 2.0 * windToFriction
                * (1.0 - Math.exp(-1.5 * measurementHeight / z0));

        return new FootprintEstimate(frictionVelocity, peakDistance, z0);
    }
}
