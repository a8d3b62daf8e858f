package eddyflux.domain.exception;

/**
 * Error de precondición en la entrada de un cálculo de flujo (longitudes distintas,
 * pocas muestras, altura no positiva...). El llamador debe corregir la entrada antes de reintentar;
 * no se devuelve resultado parcial.
 */
public class FluxValidationException extends IllegalArgumentException {

    public FluxValidationException(String message) {
        super(message);
    }
}
