package eddyflux.physics.qc;

import eddyflux.config.CorrectionConfig;
import eddyflux.physics.SyntheticSonicData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TurbulenceTestTest {

    private static final int N = 1_000;
    private static final double MEAN_U = 5.0;

    private final TurbulenceTest test = new TurbulenceTest();

    // Alternar ±σ da una desviación muestral σ·sqrt(n/(n-1)), prácticamente σ
    private TurbulenceResult evaluateRatios(double uRatio, double vRatio, double wRatio) {
        return test.evaluate(
                SyntheticSonicData.alternating(N, MEAN_U, uRatio * MEAN_U),
                SyntheticSonicData.alternating(N, 0.0, vRatio * MEAN_U),
                SyntheticSonicData.alternating(N, 0.0, wRatio * MEAN_U));
    }

    @Test
    @DisplayName("σu/U=2.0, σv/U=1.0, σw/U=0.5: turbulencia suficiente")
    void evaluate_ratiosWithinBounds_passes() {
        TurbulenceResult result = evaluateRatios(2.0, 1.0, 0.5);

        assertTrue(result.sufficient());
        assertEquals(2.0, result.sigmaURatio(), 1e-2);
        assertEquals(1.0, result.sigmaVRatio(), 1e-2);
        assertEquals(0.5, result.sigmaWRatio(), 1e-2);
    }

    @Test
    @DisplayName("σw/U=0.05 (< 0.1): turbulencia débil")
    void evaluate_weakVerticalTurbulence_fails() {
        TurbulenceResult result = evaluateRatios(2.0, 1.0, 0.05);

        assertFalse(result.sufficient());
        assertEquals(0.05, result.sigmaWRatio(), 1e-3);
    }

    @Test
    @DisplayName("Cualquier cociente fuera de rango invalida el test")
    void evaluate_eachBoundIsChecked() {
        assertFalse(evaluateRatios(0.4, 1.0, 0.5).sufficient());
        assertFalse(evaluateRatios(3.5, 1.0, 0.5).sufficient());
        assertFalse(evaluateRatios(2.0, 0.4, 0.5).sufficient());
        assertFalse(evaluateRatios(2.0, 2.6, 0.5).sufficient());
        assertFalse(evaluateRatios(2.0, 1.0, 1.2).sufficient());
    }

    @Test
    @DisplayName("Media de u nula: cocientes no finitos, el test falla")
    void evaluate_zeroMeanWind_fails() {
        TurbulenceResult result = test.evaluate(
                SyntheticSonicData.alternating(N, 0.0, 1.0),
                SyntheticSonicData.alternating(N, 0.0, 1.0),
                SyntheticSonicData.alternating(N, 0.0, 0.2));

        assertFalse(result.sufficient());
        assertFalse(Double.isFinite(result.sigmaURatio()));
    }

    @Test
    @DisplayName("Los límites se toman de la configuración")
    void evaluate_usesConfiguredBounds() {
        TurbulenceTest relaxed = new TurbulenceTest(CorrectionConfig.defaults().withMinSigmaWRatio(0.01));

        assertTrue(relaxed.evaluate(
                SyntheticSonicData.alternating(N, MEAN_U, 2.0 * MEAN_U),
                SyntheticSonicData.alternating(N, 0.0, MEAN_U),
                SyntheticSonicData.alternating(N, 0.0, 0.05 * MEAN_U)).sufficient());
    }
}
