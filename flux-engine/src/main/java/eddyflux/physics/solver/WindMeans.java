package eddyflux.physics.solver;

import eddyflux.domain.series.SonicSeries;
import eddyflux.utils.SeriesStatistics;

/**
 * Medias de las tres componentes del viento, calculadas una sola vez por llamada.
 */
public record WindMeans(double meanU, double meanV, double meanW) {

    public static WindMeans of(SonicSeries series) {
        return new WindMeans(
                SeriesStatistics.mean(series.u()),
                SeriesStatistics.mean(series.v()),
                SeriesStatistics.mean(series.w()));
    }

    public double horizontalSpeed() {
        return Math.sqrt(meanU * meanU + meanV * meanV);
    }
}
