package eddyflux.config;

/**
 * Métodos de rotación de coordenadas soportados.
 */
public enum RotationMethod {
    /** Dos rotaciones planas sucesivas (yaw y pitch) que anulan v y w medios. */
    DOUBLE_ROTATION,
    /** Regresión de un único plano medio del flujo (Wilczak et al., 2001). */
    PLANAR_FIT
}
