package eddyflux.physics.solver.impl;

import eddyflux.domain.series.SonicSeries;
import eddyflux.physics.SyntheticSonicData;
import eddyflux.physics.solver.RotationFailure;
import eddyflux.physics.solver.RotationOutcome;
import eddyflux.physics.solver.WindMeans;
import eddyflux.utils.SeriesStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DoubleRotationSolverTest {

    private static final int N = 1_000;

    private final DoubleRotationSolver solver = new DoubleRotationSolver();

    @Test
    @DisplayName("Viento ya alineado (v y w medios nulos): ángulos 0 y series idénticas")
    void rotate_alignedWind_isIdentity() {
        double[] u = SyntheticSonicData.alternating(N, 5.0, 1.0);
        double[] v = SyntheticSonicData.alternating(N, 0.0, 0.3);
        double[] w = SyntheticSonicData.alternating(N, 0.0, 0.1);
        SonicSeries series = new SonicSeries(u, v, w, new double[N]);

        RotationOutcome outcome = solver.rotate(series, WindMeans.of(series));

        RotationOutcome.Rotated rotated = assertInstanceOf(RotationOutcome.Rotated.class, outcome);
        assertEquals(0.0, rotated.alphaDegrees(), 1e-12);
        assertEquals(0.0, rotated.betaDegrees(), 1e-12);
        assertArrayEquals(u, rotated.u(), 1e-12);
        assertArrayEquals(v, rotated.v(), 1e-12);
        assertArrayEquals(w, rotated.w(), 1e-12);
        assertNotSame(u, rotated.u(), "La rotación devuelve arrays nuevos");
    }

    @Test
    @DisplayName("Viento oblicuo e inclinado: tras rotar, v y w medios son nulos")
    void rotate_obliqueWind_nullsMeanCrossAndVerticalWind() {
        SonicSeries base = SyntheticSonicData.turbulentSeries(3_000);
        double[] u = base.u().clone();
        double[] v = base.v().clone();
        double[] w = base.w().clone();
        for (int i = 0; i < u.length; i++) {
            v[i] += 3.0;
            w[i] += 0.4;
        }
        SonicSeries series = new SonicSeries(u, v, w, base.temperature());

        RotationOutcome.Rotated rotated =
                assertInstanceOf(RotationOutcome.Rotated.class, solver.rotate(series, WindMeans.of(series)));

        assertEquals(Math.toDegrees(Math.atan2(3.0, 5.0)), rotated.alphaDegrees(), 1e-9);
        assertEquals(0.0, SeriesStatistics.mean(rotated.v()), 1e-9);
        assertEquals(0.0, SeriesStatistics.mean(rotated.w()), 1e-9);
        // u rotada lleva toda la velocidad media
        assertEquals(Math.sqrt(25.0 + 9.0 + 0.16), SeriesStatistics.mean(rotated.u()), 1e-9);
    }

    @Test
    @DisplayName("Beta por encima de 45°: rechazo por ángulo extremo")
    void rotate_steepMeanVerticalWind_isRejected() {
        double[] u = SyntheticSonicData.constant(N, 1.0);
        double[] v = SyntheticSonicData.constant(N, 0.0);
        double[] w = SyntheticSonicData.constant(N, 2.0);
        SonicSeries series = new SonicSeries(u, v, w, new double[N]);

        RotationOutcome outcome = solver.rotate(series, WindMeans.of(series));

        RotationOutcome.Rejected rejected = assertInstanceOf(RotationOutcome.Rejected.class, outcome);
        assertEquals(RotationFailure.EXTREME_ROTATION_ANGLE, rejected.reason());
    }
}
