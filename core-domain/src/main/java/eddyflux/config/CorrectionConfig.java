package eddyflux.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con todas las constantes físicas y umbrales de control de calidad
 * usados por el pipeline de correcciones de covarianza turbulenta.
 * <p>
 * Los valores por defecto ({@link #defaults()}) siguen la literatura habitual de flujos.
 *
 * @param despikeWindowSize           Número de vecinos usados para las estadísticas locales (Vickers & Mahrt, 1997).
 * @param despikeThreshold            Desviaciones estándar a partir de las cuales una muestra se considera candidata.
 * @param despikeConsecutivePoints    Longitud máxima de una racha de candidatas que aún se trata como pico.
 *                                    Rachas más largas se consideran un fenómeno físico real.
 * @param veryLowWindSpeed            Por debajo de esta velocidad horizontal [m/s] no se rota.
 * @param lowWindSpeed                Por debajo de esta velocidad [m/s] se rota pero se marca LOW_WIND_SPEED.
 * @param maxRotationAngleDegrees     Ángulo de rotación máximo aceptado [°].
 * @param singularDeterminantTolerance Determinante mínimo del sistema de planar fit.
 * @param stationaritySubPeriods      Número de subperiodos del test de Foken & Wichura (1996).
 * @param stationarityThreshold       Diferencia relativa máxima entre covarianza total y media de subperiodos.
 * @param minSigmaURatio              Límite inferior de σu/U.
 * @param maxSigmaURatio              Límite superior de σu/U.
 * @param minSigmaVRatio              Límite inferior de σv/U.
 * @param maxSigmaVRatio              Límite superior de σv/U.
 * @param minSigmaWRatio              Límite inferior de σw/U.
 * @param maxSigmaWRatio              Límite superior de σw/U.
 * @param maxAngleOfAttackDegrees     Ángulo beta a partir del cual se marca ANGLE_OF_ATTACK_EXCEEDED [°].
 * @param airDensity                  Densidad del aire [kg/m³] (15°C, 1013.25 hPa).
 * @param specificHeatCapacity        Calor específico del aire seco [J/(kg·K)].
 * @param wplCorrectionFactor         Multiplicador aproximado de Webb-Pearman-Leuning.
 * @param vonKarman                   Constante de von Kármán.
 * @param roughnessHeightRatio        z0 estimada como fracción de la altura de medida cuando no se indica.
 */
@Builder
@With
public record CorrectionConfig(
        // --- Despiking ---
        int despikeWindowSize,
        double despikeThreshold,
        int despikeConsecutivePoints,

        // --- Rotación ---
        double veryLowWindSpeed,
        double lowWindSpeed,
        double maxRotationAngleDegrees,
        double singularDeterminantTolerance,

        // --- Estacionariedad ---
        int stationaritySubPeriods,
        double stationarityThreshold,

        // --- Turbulencia (ITC) ---
        double minSigmaURatio,
        double maxSigmaURatio,
        double minSigmaVRatio,
        double maxSigmaVRatio,
        double minSigmaWRatio,
        double maxSigmaWRatio,

        // --- Flujo ---
        double maxAngleOfAttackDegrees,
        double airDensity,
        double specificHeatCapacity,
        double wplCorrectionFactor,

        // --- Huella ---
        double vonKarman,
        double roughnessHeightRatio
) {

    public static CorrectionConfig defaults() {
        return CorrectionConfig.builder()
                .despikeWindowSize(10)
                .despikeThreshold(3.5)
                .despikeConsecutivePoints(3)
                .veryLowWindSpeed(0.05)
                .lowWindSpeed(0.3)
                .maxRotationAngleDegrees(45.0)
                .singularDeterminantTolerance(1e-10)
                .stationaritySubPeriods(6)
                .stationarityThreshold(0.3)
                .minSigmaURatio(0.5)
                .maxSigmaURatio(3.0)
                .minSigmaVRatio(0.5)
                .maxSigmaVRatio(2.5)
                .minSigmaWRatio(0.1)
                .maxSigmaWRatio(1.0)
                .maxAngleOfAttackDegrees(30.0)
                .airDensity(1.225)
                .specificHeatCapacity(1004.0)
                .wplCorrectionFactor(1.07)
                .vonKarman(0.41)
                .roughnessHeightRatio(0.1)
                .build();
    }
}
