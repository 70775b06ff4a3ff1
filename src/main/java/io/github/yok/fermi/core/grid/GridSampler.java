package io.github.yok.fermi.core.grid;

import io.github.yok.fermi.core.model.EnergyGrid;

/**
 * 組み立て済みのエネルギー格子を任意の分率座標で評価するユーティリティです。
 */
public final class GridSampler {

    private GridSampler() {}

    /**
     * 分率座標 k での値を三線形補間で返します（周期境界）。
     *
     * @param grid エネルギー格子です
     * @param band バンド番号です
     * @param kx kx（分率座標）です
     * @param ky ky（分率座標）です
     * @param kz kz（分率座標）です
     * @return 補間値です
     */
    public static double sample(EnergyGrid grid, int band, double kx, double ky, double kz) {
        double gx = (kx + 0.5) * grid.getNx();
        double gy = (ky + 0.5) * grid.getNy();
        double gz = (kz + 0.5) * grid.getNz();

        int ix0 = (int) Math.floor(gx);
        int iy0 = (int) Math.floor(gy);
        int iz0 = (int) Math.floor(gz);

        double[] w = TrilinearWeights.of(gx - ix0, gy - iy0, gz - iz0);
        double value = 0.0;
        for (int c = 0; c < TrilinearWeights.CORNERS; c++) {
            value += w[c] * grid.valueAt(band, ix0 + TrilinearWeights.dx(c),
                    iy0 + TrilinearWeights.dy(c), iz0 + TrilinearWeights.dz(c));
        }
        return value;
    }

    /**
     * 分率座標 k での勾配を中心差分で返します（刻みは各軸 1 セル）。
     *
     * @param grid エネルギー格子です
     * @param band バンド番号です
     * @param kx kx（分率座標）です
     * @param ky ky（分率座標）です
     * @param kz kz（分率座標）です
     * @return 勾配 (d/dkx, d/dky, d/dkz) です
     */
    public static double[] gradient(EnergyGrid grid, int band, double kx, double ky, double kz) {
        double hx = 1.0 / grid.getNx();
        double hy = 1.0 / grid.getNy();
        double hz = 1.0 / grid.getNz();
        return new double[] {
                (sample(grid, band, kx + hx, ky, kz) - sample(grid, band, kx - hx, ky, kz))
                        / (2.0 * hx),
                (sample(grid, band, kx, ky + hy, kz) - sample(grid, band, kx, ky - hy, kz))
                        / (2.0 * hy),
                (sample(grid, band, kx, ky, kz + hz) - sample(grid, band, kx, ky, kz - hz))
                        / (2.0 * hz)};
    }
}
