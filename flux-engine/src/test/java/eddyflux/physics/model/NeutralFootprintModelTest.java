package eddyflux.physics.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NeutralFootprintModelTest {

    private final NeutralFootprintModel model = new NeutralFootprintModel();

    @Test
    @DisplayName("Sin z0: se estima como z/10 y se aplica la expresión neutra")
    void estimate_defaultRoughness() {
        FootprintEstimate estimate = model.estimate(5.0, 10.0, null);

        double logRatio = Math.log(10.0);
        double expectedUStar = 5.0 * 0.41 / logRatio;
        double expectedDistance = 10.0 * 2.0 * (5.0 / expectedUStar) * (1.0 - Math.exp(-15.0));

        assertEquals(1.0, estimate.roughnessLength(), 1e-12);
        assertEquals(expectedUStar, estimate.frictionVelocity(), 1e-12);
        assertEquals(expectedDistance, estimate.peakDistance(), 1e-9);
    }

    @Test
    @DisplayName("Superficie más lisa (z0 menor): huella más lejana")
    void estimate_smootherSurface_movesPeakUpwind() {
        FootprintEstimate rough = model.estimate(5.0, 10.0, 1.0);
        FootprintEstimate smooth = model.estimate(5.0, 10.0, 0.1);

        assertTrue(smooth.peakDistance() > rough.peakDistance());
        assertTrue(smooth.frictionVelocity() < rough.frictionVelocity());
    }

    @Test
    @DisplayName("Viento nulo: u* = 0 y la distancia sigue siendo finita")
    void estimate_zeroWind_isFinite() {
        FootprintEstimate estimate = model.estimate(0.0, 3.0, 0.05);

        assertEquals(0.0, estimate.frictionVelocity());
        assertTrue(Double.isFinite(estimate.peakDistance()));
        assertTrue(estimate.peakDistance() > 0);
    }

    @Test
    @DisplayName("z0 >= z o altura no positiva: IllegalArgumentException")
    void estimate_invalidGeometry_throws() {
        assertThrows(IllegalArgumentException.class, () -> model.estimate(5.0, 2.0, 2.0));
        assertThrows(IllegalArgumentException.class, () -> model.estimate(5.0, 0.0, null));
    }
}
