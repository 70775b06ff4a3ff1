package io.github.yok.fermi.core.isosurface;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.fermi.core.model.EnergyGrid;
import io.github.yok.fermi.core.model.IsosurfaceMesh;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class MarchingCubesExtractorTest {

    private final MarchingCubesExtractor extractor = new MarchingCubesExtractor();

    /**
     * 4x4x4 の格子で、(0, 0, 0) だけ -1、他は +1 の格子を返します。
     */
    private static EnergyGrid singleLowNode() {
        double[] values = new double[64];
        Arrays.fill(values, 1.0);
        values[0] = -1.0;
        return new EnergyGrid(4, 4, 4, new double[][] {values}, 0.0);
    }

    @Test
    void singleCornerBelowGivesOneTriangle() {
        double[] values = {-1, 1, 1, 1, 1, 1, 1, 1};
        MarchingCubesExtractor.MeshBuffer buffer = new MarchingCubesExtractor.MeshBuffer();

        int triangles =
                MarchingCubesExtractor.polygonizeCell(values, 0.0, 0, 0, 0, 2, 2, 2, buffer);

        assertEquals(1, triangles);
        assertEquals(3, buffer.vertexCount());
    }

    @Test
    void uniformCellsProduceNothing() {
        MarchingCubesExtractor.MeshBuffer buffer = new MarchingCubesExtractor.MeshBuffer();
        double[] above = new double[8];
        Arrays.fill(above, 1.0);
        double[] below = new double[8];
        Arrays.fill(below, -1.0);

        assertEquals(0,
                MarchingCubesExtractor.polygonizeCell(above, 0.0, 0, 0, 0, 2, 2, 2, buffer));
        assertEquals(0,
                MarchingCubesExtractor.polygonizeCell(below, 0.0, 0, 0, 0, 2, 2, 2, buffer));
        assertEquals(0, buffer.vertexCount());
    }

    @Test
    void edgeParameterHandlesDegenerateAndOutOfRangeCases() {
        assertEquals(0.5, MarchingCubesExtractor.interpolationParameter(1.0, 1.0, 0.0), 0.0);
        assertEquals(0.25, MarchingCubesExtractor.interpolationParameter(-1.0, 3.0, 0.0),
                1e-15);
        assertEquals(1.0, MarchingCubesExtractor.interpolationParameter(1.0, 2.0, 5.0), 0.0);
        assertEquals(0.0, MarchingCubesExtractor.interpolationParameter(1.0, 2.0, -5.0), 0.0);
    }

    @Test
    void singleLowNodeIsWrappedByEightCells() {
        IsosurfaceMesh mesh = extractor.extract(singleLowNode(), 0, 0.0);

        // 周期境界で (0, 0, 0) を共有する 8 セルが 1 三角形ずつ
        assertEquals(24, mesh.getVertexCount());
        assertEquals(8, mesh.getTriangleCount());
        assertEquals(mesh.getPositions().length, mesh.getNormals().length);
        for (int v = 0; v < mesh.getVertexCount(); v++) {
            assertEquals(v, mesh.getIndices()[v]);
            float x = mesh.getNormals()[3 * v];
            float y = mesh.getNormals()[3 * v + 1];
            float z = mesh.getNormals()[3 * v + 2];
            assertEquals(1.0, Math.sqrt(x * x + y * y + z * z), 1e-5);
        }
    }

    @Test
    void verticesLieOnEdgesAndNormalsPointUphill() {
        IsosurfaceMesh mesh = extractor.extract(singleLowNode(), 0, 0.0);

        // 最初のセル (0, 0, 0) の辺 0 上、低いノードから半セルの位置
        float[] p = mesh.getPositions();
        assertEquals(0.125 - 0.5, p[0], 1e-6);
        assertEquals(-0.5, p[1], 1e-6);
        assertEquals(-0.5, p[2], 1e-6);

        float[] n = mesh.getNormals();
        assertEquals(1.0, n[0], 1e-6);
        assertEquals(0.0, n[1], 1e-6);
        assertEquals(0.0, n[2], 1e-6);
    }

    @Test
    void uniformGridYieldsEmptyMesh() {
        double[] values = new double[27];
        Arrays.fill(values, 2.0);
        EnergyGrid grid = new EnergyGrid(3, 3, 3, new double[][] {values}, 0.0);

        IsosurfaceMesh mesh = extractor.extract(grid, 0, 0.0);

        assertTrue(mesh.isEmpty());
        assertSame(IsosurfaceMesh.EMPTY, mesh);
    }

    @Test
    void zeroGradientFallsBackToUpNormal() {
        // 2 点周期の格子では中心差分の両端が同じ点になり勾配が 0
        double[] values = new double[8];
        Arrays.fill(values, 1.0);
        values[0] = -1.0;
        EnergyGrid grid = new EnergyGrid(2, 2, 2, new double[][] {values}, 0.0);

        IsosurfaceMesh mesh = extractor.extract(grid, 0, 0.0);

        assertEquals(24, mesh.getVertexCount());
        float[] n = mesh.getNormals();
        for (int v = 0; v < mesh.getVertexCount(); v++) {
            assertEquals(0.0f, n[3 * v]);
            assertEquals(0.0f, n[3 * v + 1]);
            assertEquals(1.0f, n[3 * v + 2]);
        }
    }

    @Test
    void rejectsBandOutsideGrid() {
        assertThrows(IllegalArgumentException.class,
                () -> extractor.extract(singleLowNode(), 1, 0.0));
    }

    @Test
    void tablesAreConsistent() {
        for (int config = 0; config < 256; config++) {
            int mask = MarchingCubesTables.edgeMask(config);
            int count = MarchingCubesTables.triangleEdgeCount(config);
            assertEquals(0, count % 3);
            for (int i = 0; i < count; i++) {
                int edge = MarchingCubesTables.triangleEdge(config, i);
                assertTrue((mask & (1 << edge)) != 0, "config=" + config + ", edge=" + edge);
            }
            // 辺の両端で内外が異なる辺だけが交差する
            for (int e = 0; e < 12; e++) {
                int c0 = MarchingCubesTables.EDGE_CORNERS[e][0];
                int c1 = MarchingCubesTables.EDGE_CORNERS[e][1];
                boolean crosses = ((config >> c0) & 1) != ((config >> c1) & 1);
                assertEquals(crosses, (mask & (1 << e)) != 0);
            }
        }
    }
}
