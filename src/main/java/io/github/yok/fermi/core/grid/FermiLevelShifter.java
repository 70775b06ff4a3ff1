package io.github.yok.fermi.core.grid;

import io.github.yok.fermi.core.model.EnergyGrid;

/**
 * エネルギー格子の全値からフェルミエネルギーを差し引くクラスです。
 *
 * <p>
 * 結果の格子は {@code fermiEnergy = 0} となり、値 0 の等値面がフェルミ面になります。 1 つの格子に対して 1
 * 回だけ適用します（2 回適用すると二重に差し引かれます）。
 * </p>
 */
public final class FermiLevelShifter {

    /**
     * フェルミ準位基準の新しい格子を返します。
     *
     * @param grid 元の格子です（null 不可、変更しません）
     * @return 差し引き後の格子です
     * @throws IllegalArgumentException grid が null の場合に発生します
     */
    public EnergyGrid shift(EnergyGrid grid) {
        if (grid == null) {
            throw new IllegalArgumentException("grid は null 不可です");
        }
        double ef = grid.getFermiEnergy();
        int size = grid.size();
        double[][] shifted = new double[grid.getBandCount()][];
        for (int b = 0; b < shifted.length; b++) {
            double[] band = new double[size];
            for (int i = 0; i < size; i++) {
                band[i] = grid.valueAt(b, i) - ef;
            }
            shifted[b] = band;
        }
        return new EnergyGrid(grid.getNx(), grid.getNy(), grid.getNz(), shifted, 0.0);
    }
}
