package eddyflux.physics.rotation;

import eddyflux.domain.flux.RotationQualityFlag;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Resultado de la etapa de rotación, ya resuelto el fallback.
 * <p>
 * Si la rotación se omitió o falló, u, v y w son las series de entrada (sin copiar)
 * y ambos ángulos valen 0.
 *
 * @param horizontalWindSpeed Velocidad horizontal media antes de rotar [m/s].
 */
public record RotationCorrection(
        double[] u,
        double[] v,
        double[] w,
        double alphaDegrees,
        double betaDegrees,
        Set<RotationQualityFlag> qualityFlags,
        double horizontalWindSpeed
) {

    public RotationCorrection {
        qualityFlags = qualityFlags.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(RotationQualityFlag.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(qualityFlags));
    }

    public int qualityMask() {
        return RotationQualityFlag.toMask(qualityFlags);
    }

    public boolean hasFlag(RotationQualityFlag flag) {
        return qualityFlags.contains(flag);
    }
}
