package eddyflux.physics.solver;

import eddyflux.domain.series.SonicSeries;

/**
 * @param cleaned         Copias de las series con los picos interpolados.
 * @param spikeCount      Posiciones marcadas en la máscara común a los cuatro canales.
 * @param spikePercentage Porcentaje de posiciones marcadas respecto al total de muestras.
 */
public record DespikeResult(
        SonicSeries cleaned,
        int spikeCount,
        double spikePercentage
) {
    public boolean hasSpikes() {
        return spikeCount > 0;
    }
}
