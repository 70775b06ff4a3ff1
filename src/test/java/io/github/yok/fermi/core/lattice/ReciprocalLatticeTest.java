package io.github.yok.fermi.core.lattice;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.fermi.core.model.LatticeParameters;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReciprocalLatticeTest {

    @Test
    void cubicLatticeOfTwoPiGivesUnitVectors() {
        double a = 2.0 * Math.PI;
        double right = Math.PI / 2.0;
        ReciprocalLattice lattice = ReciprocalLattice
                .fromLatticeParameters(new LatticeParameters(a, a, a, right, right, right));

        assertArrayEquals(new double[] {1, 0, 0}, lattice.vector(0), 1e-12);
        assertArrayEquals(new double[] {0, 1, 0}, lattice.vector(1), 1e-12);
        assertArrayEquals(new double[] {0, 0, 1}, lattice.vector(2), 1e-12);
    }

    @Test
    void hexagonalReciprocalVectorsAreOrthogonalToDirectOnes() {
        double a = 3.0;
        LatticeParameters p = new LatticeParameters(a, a, 5.0, Math.PI / 2, Math.PI / 2,
                2.0 * Math.PI / 3.0);
        ReciprocalLattice lattice = ReciprocalLattice.fromLatticeParameters(p);

        // a2 = (a cosγ, a sinγ, 0) と b1 は直交
        double[] b1 = lattice.vector(0);
        double dot = b1[0] * a * Math.cos(p.getGamma()) + b1[1] * a * Math.sin(p.getGamma());
        assertEquals(0.0, dot, 1e-12);
        // a1 · b1 = 2π
        assertEquals(2.0 * Math.PI, b1[0] * a, 1e-12);
    }

    @Test
    void columnTableIsTransposed() {
        ReciprocalLattice lattice = ReciprocalLattice.fromColumnVectors(List.of(
                new double[] {1.0, 0.0, 0.5}, new double[] {0.0, 2.0, 0.0},
                new double[] {0.0, 0.0, 3.0}));

        assertArrayEquals(new double[] {0.5, 0.0, 3.0}, lattice.vector(2), 1e-12);
        assertArrayEquals(new float[] {1.5f, 2.0f, 3.0f},
                lattice.toCartesian(new float[] {1.0f, 1.0f, 1.0f}), 1e-6f);
    }

    @Test
    void cartesianConversionValidatesLength() {
        ReciprocalLattice lattice = ReciprocalLattice.fromColumnVectors(List.of(
                new double[] {1, 0, 0}, new double[] {0, 1, 0}, new double[] {0, 0, 1}));

        assertEquals(0, lattice.toCartesian(new float[0]).length);
        assertThrows(IllegalArgumentException.class,
                () -> lattice.toCartesian(new float[] {1.0f, 2.0f}));
    }
}
