package io.github.yok.fermi.core.grid;

import io.github.yok.fermi.core.model.EnergyGrid;
import io.github.yok.fermi.core.model.ExpandedKPoint;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * 展開済み k 点から任意解像度のエネルギー格子を三線形補間で組み立てるクラスです。
 *
 * <p>
 * 出力格子点 (ix, iy, iz) ごとに、元メッシュ上でそれを囲む 8 頂点を {@link KPointLookup} で引き、
 * 存在する頂点だけで {@code Σ(E * w) / Σ(w)} を計算します。 存在する頂点がない（または重みの和が 0 の）場合は、
 * 周期的なユークリッド距離で最も近い k 点の値を使います。
 * </p>
 */
@Slf4j
public final class InterpolatedGridBuilder {

    /**
     * エネルギー格子を組み立てます。
     *
     * @param expanded 展開済み k 点です（null 不可）
     * @param bandCount 格子化するバンド数です（0 以上）
     * @param sourceDivision 元メッシュの分割数です（1 以上）
     * @param gridSize 出力格子の各軸の点数です（1 以上）
     * @param fermiEnergy 格子に持たせるフェルミエネルギー（eV）です
     * @return エネルギー格子です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public EnergyGrid build(List<ExpandedKPoint> expanded, int bandCount, int sourceDivision,
            int gridSize, double fermiEnergy) {
        if (expanded == null) {
            throw new IllegalArgumentException("expanded は null 不可です");
        }
        if (bandCount < 0) {
            throw new IllegalArgumentException("bandCount は 0 以上が必要です: " + bandCount);
        }
        if (gridSize <= 0) {
            throw new IllegalArgumentException("gridSize は 1 以上が必要です: " + gridSize);
        }

        long t0 = System.nanoTime();
        KPointLookup lookup = KPointLookup.build(expanded, sourceDivision);

        int size = gridSize * gridSize * gridSize;
        double[][] data = new double[bandCount][size];
        ExpandedKPoint[] corners = new ExpandedKPoint[TrilinearWeights.CORNERS];
        int fallbackCells = 0;

        for (int iz = 0; iz < gridSize; iz++) {
            for (int iy = 0; iy < gridSize; iy++) {
                for (int ix = 0; ix < gridSize; ix++) {
                    // 出力格子点を元メッシュの格子座標に写す（k = i / gridSize - 0.5）
                    double gx = (double) ix * sourceDivision / gridSize;
                    double gy = (double) iy * sourceDivision / gridSize;
                    double gz = (double) iz * sourceDivision / gridSize;
                    int ix0 = (int) Math.floor(gx);
                    int iy0 = (int) Math.floor(gy);
                    int iz0 = (int) Math.floor(gz);
                    double[] w = TrilinearWeights.of(gx - ix0, gy - iy0, gz - iz0);

                    for (int c = 0; c < TrilinearWeights.CORNERS; c++) {
                        corners[c] = lookup.get(ix0 + TrilinearWeights.dx(c),
                                iy0 + TrilinearWeights.dy(c), iz0 + TrilinearWeights.dz(c));
                    }

                    int index = ix + iy * gridSize + iz * gridSize * gridSize;
                    ExpandedKPoint nearest = null;
                    boolean usedFallback = false;

                    for (int b = 0; b < bandCount; b++) {
                        double sum = 0.0;
                        double totalWeight = 0.0;
                        for (int c = 0; c < TrilinearWeights.CORNERS; c++) {
                            ExpandedKPoint corner = corners[c];
                            if (corner != null && corner.hasBand(b)) {
                                sum += corner.energy(b) * w[c];
                                totalWeight += w[c];
                            }
                        }
                        if (totalWeight > 0.0) {
                            data[b][index] = sum / totalWeight;
                            continue;
                        }

                        if (nearest == null) {
                            nearest = findNearest(expanded, (double) ix / gridSize - 0.5,
                                    (double) iy / gridSize - 0.5, (double) iz / gridSize - 0.5);
                        }
                        usedFallback = true;
                        if (nearest != null && nearest.hasBand(b)) {
                            data[b][index] = nearest.energy(b);
                        }
                    }
                    if (usedFallback) {
                        fallbackCells++;
                    }
                }
            }
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("補間格子を組み立てました。格子={}^3、バンド数={}、元メッシュ分割数={}、参照点={}、最近傍で補完した格子点={}、所要時間={}ms",
                gridSize, bandCount, sourceDivision, lookup.size(), fallbackCells, elapsedMs);
        return new EnergyGrid(gridSize, gridSize, gridSize, data, fermiEnergy);
    }

    /**
     * 周期的なユークリッド距離で最も近い k 点を返します。
     *
     * @param points 候補です
     * @param kx kx です
     * @param ky ky です
     * @param kz kz です
     * @return 最も近い k 点です。候補が空の場合は null です
     */
    static ExpandedKPoint findNearest(List<ExpandedKPoint> points, double kx, double ky,
            double kz) {
        ExpandedKPoint nearest = null;
        double minDist = Double.POSITIVE_INFINITY;
        for (ExpandedKPoint kp : points) {
            double dx = periodicDelta(kp.getKx() - kx);
            double dy = periodicDelta(kp.getKy() - ky);
            double dz = periodicDelta(kp.getKz() - kz);
            double dist = dx * dx + dy * dy + dz * dz;
            if (dist < minDist) {
                minDist = dist;
                nearest = kp;
            }
        }
        return nearest;
    }

    private static double periodicDelta(double d) {
        double a = Math.abs(d);
        return Math.min(a, 1.0 - a);
    }
}
