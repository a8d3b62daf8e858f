package eddyflux.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Opciones de una llamada a {@code computeSensibleHeatFlux}.
 * <p>
 * Los dos perfiles habituales (15 y 30 minutos a 10 Hz) están disponibles como presets.
 */
@Value
@Builder
@With
public class FluxOptions {

    public static final int FIFTEEN_MINUTES_AT_10HZ = 9_000;
    public static final int THIRTY_MINUTES_AT_10HZ = 18_000;

    /**
     * Altura de medida [m]. Opcional, pero sin ella no se calcula la huella del flujo.
     */
    Double measurementHeight;

    /**
     * Longitud de rugosidad z0 [m]. Si es null se estima a partir de la altura.
     */
    Double roughnessLength;

    /**
     * Método de rotación de coordenadas.
     */
    @Builder.Default
    RotationMethod rotationMethod = RotationMethod.DOUBLE_ROTATION;

    /**
     * Número mínimo de muestras por serie.
     */
    @Builder.Default
    int minSampleCount = THIRTY_MINUTES_AT_10HZ;

    /**
     * Frecuencia de muestreo [Hz]. Opcional; solo se valida si se indica.
     */
    Double samplingFrequency;

    public boolean hasMeasurementHeight() {
        return measurementHeight != null;
    }

    /**
     * Perfil de 15 minutos: 9000 muestras, doble rotación.
     */
    public static FluxOptions fifteenMinuteProfile() {
        return FluxOptions.builder()
                .minSampleCount(FIFTEEN_MINUTES_AT_10HZ)
                .rotationMethod(RotationMethod.DOUBLE_ROTATION)
                .samplingFrequency(10.0)
                .build();
    }

    /**
     * Perfil de 30 minutos: 18000 muestras, planar fit.
     */
    public static FluxOptions thirtyMinuteProfile() {
        return FluxOptions.builder()
                .minSampleCount(THIRTY_MINUTES_AT_10HZ)
                .rotationMethod(RotationMethod.PLANAR_FIT)
                .samplingFrequency(10.0)
                .build();
    }

    /**
     * @throws ArithmeticException si el número de muestras no cabe en un int.
     */
    public static int minSamplesFor(double periodMinutes, double frequencyHz) {
        if (periodMinutes <= 0 || frequencyHz <= 0) {
            throw new IllegalArgumentException("El periodo y la frecuencia deben ser positivos.");
        }
        return Math.toIntExact(Math.round(periodMinutes * 60.0 * frequencyHz));
    }
}
