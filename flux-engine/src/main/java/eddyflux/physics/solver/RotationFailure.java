package eddyflux.physics.solver;

import eddyflux.domain.flux.RotationQualityFlag;

/**
 * Motivos por los que un solver de rotación rechaza los datos.
 */
public enum RotationFailure {
    EXTREME_ROTATION_ANGLE(RotationQualityFlag.EXTREME_ROTATION_ANGLE),
    SINGULAR_MATRIX(RotationQualityFlag.SINGULAR_MATRIX);

    private final RotationQualityFlag flag;

    RotationFailure(RotationQualityFlag flag) {
        this.flag = flag;
    }

    public RotationQualityFlag toFlag() {
        return flag;
    }
}
