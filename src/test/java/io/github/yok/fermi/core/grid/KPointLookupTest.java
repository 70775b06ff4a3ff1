package io.github.yok.fermi.core.grid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.fermi.core.model.ExpandedKPoint;
import java.util.List;
import org.junit.jupiter.api.Test;

class KPointLookupTest {

    private static ExpandedKPoint point(double kx, double ky, double kz, int index) {
        return new ExpandedKPoint(kx, ky, kz, List.of((double) index), index);
    }

    @Test
    void indexMapsFractionalCoordinatesOntoMesh() {
        assertEquals(0, KPointLookup.toIndex(-0.5, 4));
        assertEquals(2, KPointLookup.toIndex(0.0, 4));
        assertEquals(3, KPointLookup.toIndex(0.25, 4));
        assertEquals(0, KPointLookup.toIndex(0.5, 4));
        assertEquals(2, KPointLookup.toIndex(0.0000001, 4));
    }

    @Test
    void firstWriterWinsAndLookupIsPeriodic() {
        ExpandedKPoint first = point(0.0, 0.0, 0.0, 0);
        ExpandedKPoint duplicate = point(0.01, 0.0, 0.0, 1);
        ExpandedKPoint corner = point(-0.5, -0.5, -0.5, 2);

        KPointLookup lookup = KPointLookup.build(List.of(first, duplicate, corner), 4);

        assertEquals(2, lookup.size());
        assertSame(first, lookup.get(2, 2, 2));
        assertSame(corner, lookup.get(0, 0, 0));
        assertSame(corner, lookup.get(4, -4, 8));
        assertNull(lookup.get(1, 2, 2));
        assertEquals(4, lookup.getDivision());
    }

    @Test
    void divisionMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> KPointLookup.build(List.of(), 0));
    }
}
