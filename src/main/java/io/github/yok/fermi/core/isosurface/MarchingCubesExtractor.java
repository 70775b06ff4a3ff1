package io.github.yok.fermi.core.isosurface;

import io.github.yok.fermi.core.grid.GridSampler;
import io.github.yok.fermi.core.model.EnergyGrid;
import io.github.yok.fermi.core.model.IsosurfaceMesh;
import lombok.extern.slf4j.Slf4j;

/**
 * マーチングキューブ法による等値面抽出の実装です。
 *
 * <p>
 * 格子は周期的に扱い、各軸 n セル（n 個の格子点と折り返した 1 点）を走査します。 頂点座標は分率座標
 * {@code i / n - 0.5} で出力し、三角形ごとに新しい 3 頂点を発行します（頂点の共有はしません）。 法線は
 * {@link GridSampler#gradient} を正規化したもので、勾配が 0 の場合は (0, 0, 1) とします。
 * </p>
 */
@Slf4j
public class MarchingCubesExtractor implements IsosurfaceExtractor {

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException grid が null、または band が範囲外の場合に発生します
     */
    @Override
    public IsosurfaceMesh extract(EnergyGrid grid, int band, double isoValue) {
        if (grid == null) {
            throw new IllegalArgumentException("grid は null 不可です");
        }
        if (band < 0 || band >= grid.getBandCount()) {
            throw new IllegalArgumentException(
                    "band が範囲外です: " + band + " (bandCount=" + grid.getBandCount() + ")");
        }

        long t0 = System.nanoTime();
        MeshBuffer buffer = new MeshBuffer();
        double[] values = new double[8];

        for (int iz = 0; iz < grid.getNz(); iz++) {
            for (int iy = 0; iy < grid.getNy(); iy++) {
                for (int ix = 0; ix < grid.getNx(); ix++) {
                    for (int c = 0; c < 8; c++) {
                        int[] o = MarchingCubesTables.CORNER_OFFSETS[c];
                        values[c] = grid.valueAt(band, ix + o[0], iy + o[1], iz + o[2]);
                    }
                    polygonizeCell(values, isoValue, ix, iy, iz, grid.getNx(), grid.getNy(),
                            grid.getNz(), buffer);
                }
            }
        }

        IsosurfaceMesh mesh = buffer.toMesh(grid, band);
        long ms = (System.nanoTime() - t0) / 1_000_000L;
        log.info("等値面抽出: band={}, iso={}, 頂点数={}, 三角形数={} ({} ms)", band, isoValue,
                mesh.getVertexCount(), mesh.getTriangleCount(), ms);
        return mesh;
    }

    /**
     * 単一セルを三角形化し、頂点座標を buffer に追加します。
     *
     * <p>
     * 頂点値が等値未満の頂点をビットに立てた構成番号で表を引き、交差する辺上の位置を線形補間で求めます。
     * 両端の値が等しい辺では t = 0.5 とし、t は [0, 1] に丸めます。
     * </p>
     *
     * @param values 8 頂点の値（頂点番号順）です
     * @param isoValue 等値です
     * @param ix セル原点の x インデックスです
     * @param iy セル原点の y インデックスです
     * @param iz セル原点の z インデックスです
     * @param nx x 方向の格子点数です
     * @param ny y 方向の格子点数です
     * @param nz z 方向の格子点数です
     * @param buffer 出力先です
     * @return 追加した三角形数です
     */
    static int polygonizeCell(double[] values, double isoValue, int ix, int iy, int iz, int nx,
            int ny, int nz, MeshBuffer buffer) {
        int configuration = 0;
        for (int c = 0; c < 8; c++) {
            if (values[c] < isoValue) {
                configuration |= 1 << c;
            }
        }
        int edgeMask = MarchingCubesTables.edgeMask(configuration);
        if (edgeMask == 0) {
            return 0;
        }

        double[][] edgePoints = new double[12][];
        for (int e = 0; e < 12; e++) {
            if ((edgeMask & (1 << e)) == 0) {
                continue;
            }
            int c0 = MarchingCubesTables.EDGE_CORNERS[e][0];
            int c1 = MarchingCubesTables.EDGE_CORNERS[e][1];
            double t = interpolationParameter(values[c0], values[c1], isoValue);
            int[] o0 = MarchingCubesTables.CORNER_OFFSETS[c0];
            int[] o1 = MarchingCubesTables.CORNER_OFFSETS[c1];
            edgePoints[e] = new double[] {
                    (ix + o0[0] + t * (o1[0] - o0[0])) / nx - 0.5,
                    (iy + o0[1] + t * (o1[1] - o0[1])) / ny - 0.5,
                    (iz + o0[2] + t * (o1[2] - o0[2])) / nz - 0.5};
        }

        int count = MarchingCubesTables.triangleEdgeCount(configuration);
        for (int i = 0; i < count; i++) {
            double[] p = edgePoints[MarchingCubesTables.triangleEdge(configuration, i)];
            buffer.addVertex(p[0], p[1], p[2]);
        }
        return count / 3;
    }

    /**
     * 辺上の補間位置 t を返します。
     *
     * @param v0 始点の値です
     * @param v1 終点の値です
     * @param isoValue 等値です
     * @return [0, 1] の補間位置です
     */
    static double interpolationParameter(double v0, double v1, double isoValue) {
        double denominator = v1 - v0;
        if (denominator == 0.0) {
            return 0.5;
        }
        double t = (isoValue - v0) / denominator;
        return Math.max(0.0, Math.min(1.0, t));
    }

    /**
     * 抽出中の頂点座標を蓄積するバッファです。
     */
    static final class MeshBuffer {

        private float[] positions = new float[3 * 1024];

        private int floatCount;

        /**
         * 頂点を追加します。
         *
         * @param x x 座標です
         * @param y y 座標です
         * @param z z 座標です
         */
        void addVertex(double x, double y, double z) {
            if (floatCount + 3 > positions.length) {
                float[] grown = new float[positions.length * 2];
                System.arraycopy(positions, 0, grown, 0, floatCount);
                positions = grown;
            }
            positions[floatCount++] = (float) x;
            positions[floatCount++] = (float) y;
            positions[floatCount++] = (float) z;
        }

        /**
         * 蓄積した頂点数を返します。
         *
         * @return 頂点数です
         */
        int vertexCount() {
            return floatCount / 3;
        }

        /**
         * 法線と三角形インデックスを付けてメッシュに変換します。
         *
         * @param grid 法線計算に使うエネルギー格子です
         * @param band バンド番号です
         * @return メッシュです
         */
        IsosurfaceMesh toMesh(EnergyGrid grid, int band) {
            if (floatCount == 0) {
                return IsosurfaceMesh.EMPTY;
            }
            float[] pos = new float[floatCount];
            System.arraycopy(positions, 0, pos, 0, floatCount);
            float[] normals = new float[floatCount];
            int[] indices = new int[floatCount / 3];
            for (int v = 0; v < indices.length; v++) {
                indices[v] = v;
                double[] g = GridSampler.gradient(grid, band, pos[3 * v], pos[3 * v + 1],
                        pos[3 * v + 2]);
                double norm = Math.sqrt(g[0] * g[0] + g[1] * g[1] + g[2] * g[2]);
                if (norm > 0.0 && Double.isFinite(norm)) {
                    normals[3 * v] = (float) (g[0] / norm);
                    normals[3 * v + 1] = (float) (g[1] / norm);
                    normals[3 * v + 2] = (float) (g[2] / norm);
                } else {
                    normals[3 * v + 2] = 1.0f;
                }
            }
            return new IsosurfaceMesh(pos, normals, indices);
        }
    }
}
