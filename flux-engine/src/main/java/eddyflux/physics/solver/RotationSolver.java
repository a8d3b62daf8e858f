package eddyflux.physics.solver;

import eddyflux.domain.series.SonicSeries;

public interface RotationSolver extends SolverComponent {
    /**
     * Rota (u, v, w) al sistema de coordenadas alineado con el flujo medio.
     *
     * @param series Series de entrada (no se modifican). Solo se usan u, v y w.
     * @param means  Medias precalculadas de u, v y w.
     * @return Series rotadas o el motivo del rechazo.
     */
    RotationOutcome rotate(SonicSeries series, WindMeans means);
}
