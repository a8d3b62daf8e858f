package eddyflux.physics.solver;

import eddyflux.domain.series.SonicSeries;

public interface Despiker extends SolverComponent {
    /**
     * Detecta y sustituye picos no físicos en las cuatro series.
     *
     * @param series Series originales (no se modifican).
     * @return Copias corregidas y estadísticas de picos.
     */
    DespikeResult despike(SonicSeries series);
}
