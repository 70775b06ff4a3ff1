package io.github.yok.fermi.core.grid;

/**
 * 三線形補間の 8 頂点の重みを計算するユーティリティです。
 *
 * <p>
 * 頂点の順序は (dx, dy, dz) = 000, 100, 010, 110, 001, 101, 011, 111 です（x が最も速く変化）。
 * </p>
 */
public final class TrilinearWeights {

    /**
     * 頂点数です。
     */
    public static final int CORNERS = 8;

    private TrilinearWeights() {}

    /**
     * セル内の相対位置から 8 頂点の重みを返します。
     *
     * @param fx x 方向の相対位置（0 以上 1 以下）
     * @param fy y 方向の相対位置（0 以上 1 以下）
     * @param fz z 方向の相対位置（0 以上 1 以下）
     * @return 重み（長さ 8、総和 1）です
     */
    public static double[] of(double fx, double fy, double fz) {
        double gx = 1.0 - fx;
        double gy = 1.0 - fy;
        double gz = 1.0 - fz;
        return new double[] {
                gx * gy * gz,
                fx * gy * gz,
                gx * fy * gz,
                fx * fy * gz,
                gx * gy * fz,
                fx * gy * fz,
                gx * fy * fz,
                fx * fy * fz};
    }

    /**
     * 頂点番号の x オフセット（0 または 1）を返します。
     *
     * @param corner 頂点番号（0..7）です
     * @return x オフセットです
     */
    public static int dx(int corner) {
        return corner & 1;
    }

    /**
     * 頂点番号の y オフセット（0 または 1）を返します。
     *
     * @param corner 頂点番号（0..7）です
     * @return y オフセットです
     */
    public static int dy(int corner) {
        return (corner >> 1) & 1;
    }

    /**
     * 頂点番号の z オフセット（0 または 1）を返します。
     *
     * @param corner 頂点番号（0..7）です
     * @return z オフセットです
     */
    public static int dz(int corner) {
        return (corner >> 2) & 1;
    }
}
