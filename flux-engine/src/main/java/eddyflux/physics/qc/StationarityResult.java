package eddyflux.physics.qc;

/**
 * @param stationary              true si la diferencia relativa no supera el umbral.
 * @param covariance              Covarianza w'T' del periodo completo (se reutiliza para el flujo).
 * @param meanSubPeriodCovariance Media de las covarianzas de los subperiodos.
 * @param relativeDifference      |total - mediaSub| / |total|. NaN si la covarianza total es 0.
 */
public record StationarityResult(
        boolean stationary,
        double covariance,
        double meanSubPeriodCovariance,
        double relativeDifference
) {}
