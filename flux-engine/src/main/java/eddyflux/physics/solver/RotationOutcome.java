package eddyflux.physics.solver;

/**
 * Resultado etiquetado de un solver de rotación: o bien las series rotadas, o bien el motivo
 * del rechazo. Los datos degenerados no lanzan excepciones; el orquestador decide el fallback.
 */
public sealed interface RotationOutcome permits RotationOutcome.Rotated, RotationOutcome.Rejected {

    /**
     * @param u             Componente longitudinal rotada (array nuevo).
     * @param v             Componente transversal rotada (array nuevo).
     * @param w             Componente vertical rotada (array nuevo).
     * @param alphaDegrees  Ángulo de yaw aplicado [°].
     * @param betaDegrees   Ángulo de pitch aplicado [°].
     */
    record Rotated(double[] u, double[] v, double[] w, double alphaDegrees, double betaDegrees)
            implements RotationOutcome {
    }

    /**
     * @param reason Categoría del fallo.
     * @param detail Descripción legible para logs.
     */
    record Rejected(RotationFailure reason, String detail) implements RotationOutcome {
    }
}
