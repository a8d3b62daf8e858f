package eddyflux.utils;

/**
 * Estadísticos básicos sobre buffers de doubles.
 * <p>
 * Las variantes con rango {@code [from, to)} evitan copiar subperiodos.
 * Stateless y Thread-Safe.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    public static double mean(double[] data) {
        requireNonEmpty(data);
        return mean(data, 0, data.length);
    }

    public static double mean(double[] data, int from, int to) {
        checkRange(data, from, to);
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += data[i];
        }
        return sum / (to - from);
    }

    /**
     * Desviación estándar muestral (divisor n-1). NaN si hay menos de dos muestras.
     */
    public static double standardDeviation(double[] data) {
        requireNonEmpty(data);
        return standardDeviation(data, mean(data));
    }

    public static double standardDeviation(double[] data, double knownMean) {
        requireNonEmpty(data);
        int n = data.length;
        if (n < 2) return Double.NaN;

        double sumSquaredDiff = 0.0;
        for (double value : data) {
            double diff = value - knownMean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (n - 1));
    }

    /**
     * Covarianza poblacional (divisor n), con desviaciones respecto a la media de cada serie.
     */
    public static double covariance(double[] a, double[] b) {
        requireNonEmpty(a);
        requireNonEmpty(b);
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    String.format("Las series deben tener la misma longitud (%d != %d).", a.length, b.length));
        }
        return covariance(a, b, 0, a.length);
    }

    public static double covariance(double[] a, double[] b, int from, int to) {
        checkRange(a, from, to);
        checkRange(b, from, to);

        double meanA = mean(a, from, to);
        double meanB = mean(b, from, to);

        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += (a[i] - meanA) * (b[i] - meanB);
        }
        return sum / (to - from);
    }

    private static void requireNonEmpty(double[] data) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("La serie no puede ser nula ni vacía.");
        }
    }

    private static void checkRange(double[] data, int from, int to) {
        requireNonEmpty(data);
        if (from < 0 || to > data.length || from >= to) {
            throw new IllegalArgumentException(
                    String.format("Rango inválido [%d, %d) para una serie de %d muestras.", from, to, data.length));
        }
    }
}
