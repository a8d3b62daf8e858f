package eddyflux.physics.model;

public interface FootprintModel {
    /**
     * @param meanWindSpeed     Velocidad media del viento [m/s].
     * @param measurementHeight Altura de medida [m].
     * @param roughnessLength   z0 [m]; null para estimarla a partir de la altura.
     */
    FootprintEstimate estimate(double meanWindSpeed, double measurementHeight, Double roughnessLength);
}
