package eddyflux.domain.flux;

/**
 * Claves del mapa de diagnósticos de {@link FluxResult}.
 */
public final class DiagnosticKeys {

    public static final String SPIKE_COUNT = "spike_count";
    public static final String SPIKE_PERCENTAGE = "spike_percentage";

    public static final String ROTATION_ANGLE_ALPHA = "rotation_angle_alpha";
    public static final String ROTATION_ANGLE_BETA = "rotation_angle_beta";
    public static final String ROTATION_QUALITY_FLAGS = "rotation_quality_flags";

    public static final String COVARIANCE_WT = "covariance_wt";
    public static final String STATIONARITY_RELATIVE_DIFFERENCE = "stationarity_relative_difference";

    public static final String SIGMA_U_RATIO = "sigma_u_ratio";
    public static final String SIGMA_V_RATIO = "sigma_v_ratio";
    public static final String SIGMA_W_RATIO = "sigma_w_ratio";

    // Solo presentes si se conoce la altura de medida
    public static final String FRICTION_VELOCITY = "friction_velocity";
    public static final String FLUX_FOOTPRINT_DISTANCE = "flux_footprint_distance";

    private DiagnosticKeys() {}
}
