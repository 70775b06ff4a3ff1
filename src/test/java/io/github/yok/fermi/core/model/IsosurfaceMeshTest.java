package io.github.yok.fermi.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class IsosurfaceMeshTest {

    private static IsosurfaceMesh triangle() {
        return new IsosurfaceMesh(new float[] {0, 0, 0, 1, 0, 0, 0, 1, 0},
                new float[] {0, 0, 1, 0, 0, 1, 0, 0, 1}, new int[] {0, 1, 2});
    }

    @Test
    void callersCannotMutateTheMesh() {
        float[] positions = {0, 0, 0, 1, 0, 0, 0, 1, 0};
        IsosurfaceMesh mesh = new IsosurfaceMesh(positions,
                new float[] {0, 0, 1, 0, 0, 1, 0, 0, 1}, new int[] {0, 1, 2});

        positions[3] = 9f;
        mesh.getPositions()[4] = 9f;
        mesh.getNormals()[2] = -1f;
        mesh.getIndices()[0] = 7;

        assertEquals(1f, mesh.getPositions()[3]);
        assertEquals(0f, mesh.getPositions()[4]);
        assertEquals(1f, mesh.getNormals()[2]);
        assertEquals(0, mesh.getIndices()[0]);
        assertEquals(triangle(), mesh);
    }

    @Test
    void countsFollowArrayLengths() {
        IsosurfaceMesh mesh = triangle();

        assertEquals(3, mesh.getVertexCount());
        assertEquals(1, mesh.getTriangleCount());
        assertTrue(IsosurfaceMesh.EMPTY.isEmpty());
    }

    @Test
    void normalsMustMatchPositions() {
        assertThrows(IllegalArgumentException.class,
                () -> new IsosurfaceMesh(new float[3], new float[6], new int[0]));
        assertThrows(IllegalArgumentException.class,
                () -> new IsosurfaceMesh(null, new float[0], new int[0]));
    }
}
