package eddyflux.physics.solver.impl;

import eddyflux.config.CorrectionConfig;
import eddyflux.domain.series.SonicSeries;
import eddyflux.physics.solver.DespikeResult;
import eddyflux.physics.solver.Despiker;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Eliminación de picos basada en Vickers & Mahrt (1997).
 * <p>
 * Para cada muestra interior se calculan media y desviación de los {@code windowSize} vecinos
 * (mitad a cada lado, sin la propia muestra). Una muestra que se aleja más de
 * {@code threshold} desviaciones es candidata; una racha de candidatas consecutivas de como mucho
 * {@code consecutivePoints} muestras se confirma como pico. Rachas más largas son señal real.
 * <p>
 * Las posiciones confirmadas de los cuatro canales se unen en una sola máscara y se sustituyen
 * en todos los canales por interpolación lineal entre los vecinos válidos más cercanos.
 */
@Slf4j
public class VickersMahrtDespiker implements Despiker {

    private final int windowSize;
    private final double threshold;
    private final int consecutivePoints;

    public VickersMahrtDespiker() {
        this(CorrectionConfig.defaults());
    }

    public VickersMahrtDespiker(CorrectionConfig config) {
        this(config.despikeWindowSize(), config.despikeThreshold(), config.despikeConsecutivePoints());
    }

    public VickersMahrtDespiker(int windowSize, double threshold, int consecutivePoints) {
        if (windowSize < 2 || windowSize % 2 != 0) {
            throw new IllegalArgumentException("La ventana debe ser par y >= 2: " + windowSize);
        }
        if (threshold <= 0 || consecutivePoints < 1) {
            throw new IllegalArgumentException("Umbral y puntos consecutivos deben ser positivos.");
        }
        this.windowSize = windowSize;
        this.threshold = threshold;
        this.consecutivePoints = consecutivePoints;
    }

    @Override
    public String getName() {
        return "VickersMahrt_w" + windowSize;
    }

    @Override
    public DespikeResult despike(SonicSeries series) {
        if (!series.hasConsistentLength()) {
            throw new IllegalArgumentException("Las cuatro series deben existir y tener la misma longitud.");
        }
        final int n = series.length();

        double[] cleanU = series.u().clone();
        double[] cleanV = series.v().clone();
        double[] cleanW = series.w().clone();
        double[] cleanT = series.temperature().clone();

        // Máscara común: la posee este método y se pasa a cada canal
        boolean[] spikeMask = new boolean[n];
        boolean[] exceedance = new boolean[n];

        detectSpikes(cleanU, spikeMask, exceedance);
        detectSpikes(cleanV, spikeMask, exceedance);
        detectSpikes(cleanW, spikeMask, exceedance);
        detectSpikes(cleanT, spikeMask, exceedance);

        int spikeCount = 0;
        for (int i = 0; i < n; i++) {
            if (!spikeMask[i]) continue;
            spikeCount++;

            int prev = findPreviousValid(spikeMask, i);
            int next = findNextValid(spikeMask, i);

            cleanU[i] = interpolate(cleanU, prev, next, i);
            cleanV[i] = interpolate(cleanV, prev, next, i);
            cleanW[i] = interpolate(cleanW, prev, next, i);
            cleanT[i] = interpolate(cleanT, prev, next, i);
        }

        double percentage = n == 0 ? 0.0 : 100.0 * spikeCount / n;
        if (spikeCount > 0) {
            log.debug("Despiking: {} posiciones sustituidas ({}%).", spikeCount, String.format("%.3f", percentage));
        }

        return new DespikeResult(new SonicSeries(cleanU, cleanV, cleanW, cleanT), spikeCount, percentage);
    }

    /**
     * Marca en {@code spikeMask} los picos confirmados de un canal. Nunca desmarca posiciones
     * puestas por canales anteriores.
     *
     * @param exceedance Buffer de trabajo reutilizado entre canales.
     */
    void detectSpikes(double[] data, boolean[] spikeMask, boolean[] exceedance) {
        final int n = data.length;
        final int half = windowSize / 2;

        Arrays.fill(exceedance, false);

        for (int i = half; i < n - half; i++) {
            // 1. Media de los vecinos (sin la muestra central)
            double sum = 0.0;
            for (int j = i - half; j <= i + half; j++) {
                if (j != i) sum += data[j];
            }
            double mean = sum / windowSize;

            // 2. Desviación poblacional de los vecinos
            double sumSq = 0.0;
            for (int j = i - half; j <= i + half; j++) {
                if (j == i) continue;
                double d = data[j] - mean;
                sumSq += d * d;
            }
            double stdDev = Math.sqrt(sumSq / windowSize);

            double deviation = Math.abs(data[i] - mean);
            exceedance[i] = stdDev > 0 ? deviation >= threshold * stdDev : deviation > 0;
        }

        // 3. Solo las rachas cortas son picos
        int i = 0;
        while (i < n) {
            if (!exceedance[i]) {
                i++;
                continue;
            }
            int runStart = i;
            while (i < n && exceedance[i]) i++;
            int runLength = i - runStart;

            if (runLength <= consecutivePoints) {
                for (int k = runStart; k < i; k++) {
                    spikeMask[k] = true;
                }
            }
        }
    }

    private static int findPreviousValid(boolean[] mask, int index) {
        for (int i = index - 1; i >= 0; i--) {
            if (!mask[i]) return i;
        }
        return -1;
    }

    private static int findNextValid(boolean[] mask, int index) {
        for (int i = index + 1; i < mask.length; i++) {
            if (!mask[i]) return i;
        }
        return -1;
    }

    private static double interpolate(double[] data, int prev, int next, int index) {
        // Sin vecino a un lado se mantiene el valor del otro
        if (prev < 0 && next < 0) return data[index];
        if (prev < 0) return data[next];
        if (next < 0) return data[prev];

        double weight = (index - prev) / (double) (next - prev);
        return data[prev] + (data[next] - data[prev]) * weight;
    }
}
