package io.github.yok.fermi.core.model;

import java.util.List;
import lombok.Value;

/**
 * 汎用経路（klist + energy + scf + struct）から読み込んだデータをまとめたクラスです。
 */
@Value
public class GenericFermiData {

    /**
     * フェルミエネルギー（eV）です。
     */
    double fermiEnergy;

    /**
     * 既約 k 点です（klist の順）。
     */
    List<IrreducibleKPoint> kPoints;

    /**
     * バンド数です（エネルギーを持つ k 点の最小バンド数）。
     */
    int bandCount;

    /**
     * 対称操作です。
     */
    List<SymmetryOperation> symmetryOperations;

    /**
     * 格子定数です。
     */
    LatticeParameters latticeParameters;

    /**
     * 元の k メッシュの分割数（klist の div）です。
     */
    int sourceDivision;

    /**
     * ケース名です。
     */
    String caseName;
}
