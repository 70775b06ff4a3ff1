package io.github.yok.fermi.core.model;

import java.util.List;
import lombok.Value;

/**
 * 既約 k 点ごとのバンドエネルギー（eV）を矩形に揃えた表です。
 *
 * <p>
 * 行は output1 に現れた既約 k 点の順、列はバンド番号です。全行の長さは {@link #bandCount} に揃えます。
 * </p>
 */
@Value
public class BandEnergyTable {

    /**
     * 既約 k 点ごとのエネルギー配列です。
     */
    List<double[]> energiesByKPoint;

    /**
     * バンド数です。
     */
    int bandCount;

    /**
     * 既約 k 点数を返します。
     *
     * @return 既約 k 点数です
     */
    public int kPointCount() {
        return energiesByKPoint.size();
    }
}
