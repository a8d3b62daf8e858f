package eddyflux.physics.rotation;

import eddyflux.config.RotationMethod;
import eddyflux.config.TerrainType;

/**
 * Tabla orientativa para elegir el método de rotación según el emplazamiento.
 * No se aplica automáticamente dentro del pipeline.
 */
public final class RotationAdvisor {

    private static final double MAX_FLAT_SLOPE_DEGREES = 5.0;
    private static final double MAX_ROLLING_SLOPE_DEGREES = 10.0;

    private RotationAdvisor() {}

    public static RotationMethod recommend(TerrainType terrain, double averageWindSpeed) {
        return recommend(terrain, averageWindSpeed, 0.0);
    }

    /**
     * @param terrain          Tipo de terreno del emplazamiento.
     * @param averageWindSpeed Velocidad media típica [m/s]. No altera la tabla actual.
     * @param terrainSlope     Pendiente del terreno [°].
     */
    public static RotationMethod recommend(TerrainType terrain, double averageWindSpeed, double terrainSlope) {
        if (terrain == TerrainType.FLAT && terrainSlope < MAX_FLAT_SLOPE_DEGREES) {
            return RotationMethod.DOUBLE_ROTATION;
        }
        if (terrain == TerrainType.ROLLING && terrainSlope < MAX_ROLLING_SLOPE_DEGREES) {
            return RotationMethod.DOUBLE_ROTATION;
        }
        // Complejo, urbano o pendientes fuertes
        return RotationMethod.PLANAR_FIT;
    }
}
