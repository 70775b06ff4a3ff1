package io.github.yok.fermi.core.parser;

import io.github.yok.fermi.core.model.GenericFermiData;
import io.github.yok.fermi.core.model.IrreducibleKPoint;
import io.github.yok.fermi.core.parser.EnergyFileParser.KPointEnergies;
import io.github.yok.fermi.core.parser.KlistParser.KPointCoordinate;
import io.github.yok.fermi.core.parser.KlistParser.KlistData;
import io.github.yok.fermi.core.parser.StructParser.StructData;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 汎用経路の 4 ファイル（klist, energy, scf, struct）を読み込み、1 つのデータにまとめるクラスです。
 *
 * <p>
 * klist と energy の k 点はファイル中の順序で対応付けます。energy 側に対応する k 点がない場合、その k 点のエネルギーは空です。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class GenericFermiDataReader {

    private final KlistParser klistParser;

    private final EnergyFileParser energyFileParser;

    private final FermiEnergyParser fermiEnergyParser;

    private final StructParser structParser;

    /**
     * 4 ファイルの内容を読み込みます。
     *
     * @param klist case.klist の内容です
     * @param energy case.energy(so) の内容です
     * @param scf case.scf の内容です
     * @param struct case.struct の内容です
     * @param caseName ケース名です
     * @param spinOrbit energy がスピン軌道形式かどうかです
     * @return 読み込み結果です
     * @throws io.github.yok.fermi.core.exception.MissingSectionException struct に対称操作の見出しがない場合に発生します
     */
    public GenericFermiData read(String klist, String energy, String scf, String struct,
            String caseName, boolean spinOrbit) {
        KlistData klistData = klistParser.parse(klist);
        List<KPointEnergies> energies = energyFileParser.parse(energy, spinOrbit);
        double fermiEnergy = fermiEnergyParser.parse(scf);
        StructData structData = structParser.parse(struct);

        List<KPointCoordinate> coordinates = klistData.getKPoints();
        if (coordinates.size() != energies.size()) {
            log.warn("klist と energy の k 点数が一致しません: klist={}、energy={}", coordinates.size(),
                    energies.size());
        }

        List<IrreducibleKPoint> kPoints = new ArrayList<>(coordinates.size());
        for (int i = 0; i < coordinates.size(); i++) {
            KPointCoordinate c = coordinates.get(i);
            List<Double> e = i < energies.size() ? energies.get(i).getEnergies() : List.of();
            kPoints.add(new IrreducibleKPoint(c.getKx(), c.getKy(), c.getKz(), c.getWeight(), e));
        }

        int bandCount = minimumBandCount(kPoints);

        log.info("汎用形式を読み込みました。既約k点={}、バンド数={}、対称操作={}、分割数={}、E_F={} eV", kPoints.size(),
                bandCount, structData.getSymmetryOperations().size(), klistData.getDivision(),
                String.format(java.util.Locale.ROOT, "%.5f", fermiEnergy));

        return new GenericFermiData(fermiEnergy, kPoints, bandCount,
                structData.getSymmetryOperations(), structData.getLatticeParameters(),
                klistData.getDivision(), caseName);
    }

    /**
     * エネルギーを持つ k 点の最小バンド数を返します。
     *
     * <p>
     * 最小値より多いバンドを持つ k 点がある場合は WARN を出力します（上位バンドは格子化されません）。
     * </p>
     *
     * @param kPoints 既約 k 点です
     * @return バンド数です
     */
    static int minimumBandCount(List<IrreducibleKPoint> kPoints) {
        int min = Integer.MAX_VALUE;
        int max = 0;
        int withEnergies = 0;
        for (IrreducibleKPoint kp : kPoints) {
            int n = kp.getEnergies().size();
            if (n == 0) {
                continue;
            }
            withEnergies++;
            min = Math.min(min, n);
            max = Math.max(max, n);
        }
        if (withEnergies == 0) {
            return 0;
        }
        if (max > min) {
            log.warn("バンド数が k 点間で一致しないため最小値 {} に揃えます（最大={}）", min, max);
        }
        if (withEnergies < kPoints.size()) {
            log.warn("エネルギーのない既約 k 点が {} 点あります", kPoints.size() - withEnergies);
        }
        return min;
    }
}
