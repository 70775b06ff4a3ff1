package io.github.yok.fermi.core.band;

import io.github.yok.fermi.core.model.BandEnergyTable;
import io.github.yok.fermi.core.model.IrreducibleKPoint;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * フェルミ準位をまたぐバンドを選び出すクラスです。
 *
 * <p>
 * 格子化前の標本（既約 k 点）を走査し、フェルミエネルギーより真に上の値と真に下の値を両方持つバンドだけを 「交差バンド」とします。
 * 全標本が片側にあるバンドには等値面ができないため、等値面抽出の対象外です。
 * </p>
 */
@Slf4j
public final class BandCrossingFilter {

    /**
     * 既約 k 点から交差バンドを求めます。
     *
     * @param kPoints 既約 k 点です（null 不可）
     * @param bandCount 判定するバンド数です
     * @param fermiEnergy フェルミエネルギー（eV）です
     * @return 交差バンドの番号（昇順）です
     * @throws IllegalArgumentException kPoints が null の場合に発生します
     */
    public List<Integer> findCrossingBands(List<IrreducibleKPoint> kPoints, int bandCount,
            double fermiEnergy) {
        if (kPoints == null) {
            throw new IllegalArgumentException("kPoints は null 不可です");
        }
        List<double[]> samples = new ArrayList<>(kPoints.size());
        for (IrreducibleKPoint kp : kPoints) {
            List<Double> e = kp.getEnergies();
            double[] row = new double[e.size()];
            for (int b = 0; b < row.length; b++) {
                row[b] = e.get(b);
            }
            samples.add(row);
        }
        return findCrossingBandsOfSamples(samples, bandCount, fermiEnergy);
    }

    /**
     * エネルギー表から交差バンドを求めます。
     *
     * @param table エネルギー表です（null 不可）
     * @param fermiEnergy フェルミエネルギー（eV）です
     * @return 交差バンドの番号（昇順）です
     * @throws IllegalArgumentException table が null の場合に発生します
     */
    public List<Integer> findCrossingBands(BandEnergyTable table, double fermiEnergy) {
        if (table == null) {
            throw new IllegalArgumentException("table は null 不可です");
        }
        return findCrossingBandsOfSamples(table.getEnergiesByKPoint(), table.getBandCount(),
                fermiEnergy);
    }

    /**
     * 標本から交差バンドを求めます。
     *
     * <p>
     * 標本がそのバンドの値を持たない場合、その標本は判定に使いません。
     * </p>
     *
     * @param samples 標本ごとのエネルギー配列です
     * @param bandCount 判定するバンド数です
     * @param fermiEnergy フェルミエネルギー（eV）です
     * @return 交差バンドの番号（昇順）です
     */
    public List<Integer> findCrossingBandsOfSamples(List<double[]> samples, int bandCount,
            double fermiEnergy) {
        List<Integer> crossing = new ArrayList<>();
        for (int band = 0; band < bandCount; band++) {
            boolean above = false;
            boolean below = false;
            for (double[] sample : samples) {
                if (sample == null || band >= sample.length) {
                    continue;
                }
                double e = sample[band];
                if (e > fermiEnergy) {
                    above = true;
                } else if (e < fermiEnergy) {
                    below = true;
                }
                if (above && below) {
                    break;
                }
            }
            if (above && below) {
                crossing.add(band);
            }
        }
        log.info("フェルミ準位をまたぐバンド: {} / {}（{}）", crossing.size(), bandCount, crossing);
        return crossing;
    }
}
