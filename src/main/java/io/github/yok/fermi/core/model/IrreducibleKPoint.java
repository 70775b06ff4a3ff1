package io.github.yok.fermi.core.model;

import java.util.List;
import lombok.Value;

/**
 * 既約ブリルアンゾーン上の k 点（分率座標）とバンドエネルギーを保持するクラスです。
 *
 * <p>
 * エネルギーは eV 単位で、バンド番号の昇順に並びます。エネルギーが読めなかった k 点は空リストを持ちます。
 * </p>
 */
@Value
public class IrreducibleKPoint {

    /**
     * kx（分率座標）です。
     */
    double kx;

    /**
     * ky（分率座標）です。
     */
    double ky;

    /**
     * kz（分率座標）です。
     */
    double kz;

    /**
     * 重み（多重度）です。
     */
    double weight;

    /**
     * バンドごとのエネルギー（eV）です。
     */
    List<Double> energies;

    /**
     * k 点を生成します。
     *
     * @param kx kx（分率座標）です
     * @param ky ky（分率座標）です
     * @param kz kz（分率座標）です
     * @param weight 重みです
     * @param energies バンドエネルギー（eV）です（null の場合は空として扱います）
     */
    public IrreducibleKPoint(double kx, double ky, double kz, double weight,
            List<Double> energies) {
        this.kx = kx;
        this.ky = ky;
        this.kz = kz;
        this.weight = weight;
        this.energies = energies == null ? List.of() : List.copyOf(energies);
    }

    /**
     * 指定バンドのエネルギーを持つかどうかを返します。
     *
     * @param band バンド番号（0 始まり）です
     * @return エネルギーを持つ場合は true です
     */
    public boolean hasBand(int band) {
        return band >= 0 && band < energies.size();
    }
}
