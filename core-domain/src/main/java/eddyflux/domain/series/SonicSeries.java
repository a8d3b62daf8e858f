package eddyflux.domain.series;

/**
 * Serie de alta frecuencia (~10 Hz) de un anemómetro sónico para un intervalo de promediado.
 * <p>
 * Los arrays se reciben prestados: ninguna etapa del pipeline los modifica. Las etapas que
 * corrigen datos (despiking, rotación) devuelven copias nuevas.
 *
 * @param u           Componente longitudinal del viento [m/s].
 * @param v           Componente transversal del viento [m/s].
 * @param w           Componente vertical del viento [m/s].
 * @param temperature Temperatura sónica [°C o K, coherente dentro de la llamada].
 */
public record SonicSeries(
        double[] u,
        double[] v,
        double[] w,
        double[] temperature
) {

    public int length() {
        return u == null ? 0 : u.length;
    }

    /**
     * @return true si las cuatro series existen y tienen la misma longitud.
     */
    public boolean hasConsistentLength() {
        if (u == null || v == null || w == null || temperature == null) return false;
        return u.length == v.length && u.length == w.length && u.length == temperature.length;
    }
}
