package io.github.yok.fermi.core.model;

import java.util.List;
import lombok.Value;

/**
 * 対称操作で全ブリルアンゾーンへ展開した k 点を保持するクラスです。
 *
 * <p>
 * 座標は各軸 [-0.5, 0.5) に折り返し済みで、エネルギーは展開元の既約 k 点からそのまま複製します。
 * </p>
 */
@Value
public class ExpandedKPoint {

    /**
     * kx（分率座標、[-0.5, 0.5)）です。
     */
    double kx;

    /**
     * ky（分率座標、[-0.5, 0.5)）です。
     */
    double ky;

    /**
     * kz（分率座標、[-0.5, 0.5)）です。
     */
    double kz;

    /**
     * バンドごとのエネルギー（eV）です。
     */
    List<Double> energies;

    /**
     * 展開元の既約 k 点インデックスです。
     */
    int originalIndex;

    /**
     * 指定バンドのエネルギーを持つかどうかを返します。
     *
     * @param band バンド番号（0 始まり）です
     * @return エネルギーを持つ場合は true です
     */
    public boolean hasBand(int band) {
        return band >= 0 && band < energies.size();
    }

    /**
     * 指定バンドのエネルギーを返します。
     *
     * @param band バンド番号（0 始まり）です
     * @return エネルギー（eV）です
     */
    public double energy(int band) {
        return energies.get(band);
    }
}
