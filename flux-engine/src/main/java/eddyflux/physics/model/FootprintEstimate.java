package eddyflux.physics.model;

/**
 * @param frictionVelocity u* estimada por el perfil logarítmico [m/s].
 * @param peakDistance     Distancia a barlovento del máximo de la huella [m].
 * @param roughnessLength  z0 efectivamente usada [m].
 */
public record FootprintEstimate(
        double frictionVelocity,
        double peakDistance,
        double roughnessLength
) {}
