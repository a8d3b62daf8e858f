package eddyflux.domain.flux;

import java.util.EnumSet;
import java.util.Set;

/**
 * Banderas locales de la etapa de rotación de coordenadas.
 * Conjunto independiente de {@link QualityFlag}; el procesador las expone en los diagnósticos.
 */
public enum RotationQualityFlag {
    VALID(1),
    LOW_WIND_SPEED(1 << 1),
    EXTREME_ROTATION_ANGLE(1 << 2),
    SINGULAR_MATRIX(1 << 3),
    /** Reservada para una futura detección de terreno complejo. */
    COMPLEX_TERRAIN(1 << 4);

    private final int bit;

    RotationQualityFlag(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public static int toMask(Set<RotationQualityFlag> flags) {
        int mask = 0;
        for (RotationQualityFlag flag : flags) {
            mask |= flag.bit;
        }
        return mask;
    }

    public static EnumSet<RotationQualityFlag> fromMask(int mask) {
        EnumSet<RotationQualityFlag> flags = EnumSet.noneOf(RotationQualityFlag.class);
        for (RotationQualityFlag flag : values()) {
            if ((mask & flag.bit) != 0) flags.add(flag);
        }
        return flags;
    }
}
