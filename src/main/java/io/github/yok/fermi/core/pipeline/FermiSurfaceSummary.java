package io.github.yok.fermi.core.pipeline;

import java.util.List;
import lombok.Value;

/**
 * 取り込み結果の概要（表示用のスカラー値）を保持するクラスです。
 */
@Value
public class FermiSurfaceSummary {

    /**
     * ケース名です。
     */
    String caseName;

    /**
     * 入力から読んだフェルミエネルギー（eV）です。格子はこの値だけシフト済みです。
     */
    double fermiEnergy;

    /**
     * 格子化したバンド数です。
     */
    int bandCount;

    /**
     * 既約 k 点数です。
     */
    int irreducibleKPointCount;

    /**
     * 全ブリルアンゾーンの k 点数です（汎用形式では展開後、最適化形式ではメッシュ点数）。
     */
    int fullKPointCount;

    /**
     * フェルミ準位を横切るバンドの番号（昇順）です。
     */
    List<Integer> crossingBands;

    /**
     * x 方向の格子点数です。
     */
    int gridNx;

    /**
     * y 方向の格子点数です。
     */
    int gridNy;

    /**
     * z 方向の格子点数です。
     */
    int gridNz;

    public FermiSurfaceSummary(String caseName, double fermiEnergy, int bandCount,
            int irreducibleKPointCount, int fullKPointCount, List<Integer> crossingBands,
            int gridNx, int gridNy, int gridNz) {
        this.caseName = caseName;
        this.fermiEnergy = fermiEnergy;
        this.bandCount = bandCount;
        this.irreducibleKPointCount = irreducibleKPointCount;
        this.fullKPointCount = fullKPointCount;
        this.crossingBands = List.copyOf(crossingBands);
        this.gridNx = gridNx;
        this.gridNy = gridNy;
        this.gridNz = gridNz;
    }
}
