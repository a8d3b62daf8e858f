package eddyflux.domain.flux;

import java.util.EnumSet;
import java.util.Set;

/**
 * Banderas de calidad del flujo final.
 * <p>
 * Cada etapa del pipeline puede añadir banderas, pero nunca elimina una ya activada.
 * Los bits son estables y forman parte del contrato de salida ({@code qualityMask}).
 */
public enum QualityFlag {
    VALID(1),
    SPIKES_DETECTED(1 << 1),
    NON_STATIONARY_CONDITIONS(1 << 2),
    WEAK_TURBULENCE(1 << 3),
    ANGLE_OF_ATTACK_EXCEEDED(1 << 4),
    /** Reservada. Ninguna etapa actual la activa. */
    RAIN_DETECTED(1 << 5),
    /** Reservada. Ninguna etapa actual la activa. */
    OUTSIDE_FLUX_FOOTPRINT(1 << 6);

    private final int bit;

    QualityFlag(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public static int toMask(Set<QualityFlag> flags) {
        int mask = 0;
        for (QualityFlag flag : flags) {
            mask |= flag.bit;
        }
        return mask;
    }

    public static EnumSet<QualityFlag> fromMask(int mask) {
        EnumSet<QualityFlag> flags = EnumSet.noneOf(QualityFlag.class);
        for (QualityFlag flag : values()) {
            if ((mask & flag.bit) != 0) flags.add(flag);
        }
        return flags;
    }
}
