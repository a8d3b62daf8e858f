package eddyflux.domain.flux;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Resultado inmutable de un cálculo de flujo de calor sensible.
 *
 * @param value        Flujo de calor sensible [W/m²].
 * @param unit         Etiqueta de unidad (siempre {@link #UNIT_W_PER_M2}).
 * @param qualityFlags Banderas de calidad acumuladas a lo largo del pipeline.
 * @param diagnostics  Métricas auxiliares por clave (ej: spike_percentage, rotation_angle_beta).
 */
@JsonPropertyOrder({"value", "unit", "qualityFlags", "qualityMask", "diagnostics"})
public record FluxResult(
        double value,
        String unit,
        Set<QualityFlag> qualityFlags,
        Map<String, Double> diagnostics
) {

    public static final String UNIT_W_PER_M2 = "W/m²";

    public FluxResult {
        // Copias defensivas: el resultado no cambia una vez construido
        qualityFlags = qualityFlags == null || qualityFlags.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(QualityFlag.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(qualityFlags));
        diagnostics = diagnostics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    }

    @JsonProperty("qualityMask")
    public int qualityMask() {
        return QualityFlag.toMask(qualityFlags);
    }

    public boolean hasFlag(QualityFlag flag) {
        return qualityFlags.contains(flag);
    }

    @JsonIgnore
    public OptionalDouble diagnostic(String key) {
        Double value = diagnostics.get(key);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
