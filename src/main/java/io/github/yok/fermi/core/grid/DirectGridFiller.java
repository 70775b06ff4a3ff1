package io.github.yok.fermi.core.grid;

import io.github.yok.fermi.core.model.BandEnergyTable;
import io.github.yok.fermi.core.model.EnergyGrid;
import io.github.yok.fermi.core.model.KMeshGeneration;
import io.github.yok.fermi.core.model.KMeshGeneration.MeshEntry;
import io.github.yok.fermi.core.model.RelationTable;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * outputkgen の対応表を使い、既約 k 点のエネルギーを全メッシュ格子へ直接書き込むクラスです。
 *
 * <p>
 * outputkgen は全メッシュ点を列挙しているため補間は行いません。各行の代表点を 2 段引きで求め、 その既約 k
 * 点のエネルギーを {@code (x, y, z)} の格子点へ複製します。
 * </p>
 */
@Slf4j
public final class DirectGridFiller {

    /**
     * エネルギー格子を組み立てます。
     *
     * @param table 既約 k 点のエネルギー表です（null 不可）
     * @param mesh メッシュ生成リストです（null 不可）
     * @param fermiEnergy 格子に持たせるフェルミエネルギー（eV）です
     * @return エネルギー格子です
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public EnergyGrid fill(BandEnergyTable table, KMeshGeneration mesh, double fermiEnergy) {
        if (table == null) {
            throw new IllegalArgumentException("table は null 不可です");
        }
        if (mesh == null) {
            throw new IllegalArgumentException("mesh は null 不可です");
        }

        long t0 = System.nanoTime();
        int nx = mesh.getNx();
        int ny = mesh.getNy();
        int nz = mesh.getNz();
        int total = nx * ny * nz;
        int bandCount = table.getBandCount();
        List<double[]> energies = table.getEnergiesByKPoint();
        List<MeshEntry> entries = mesh.getEntries();

        RelationTable relation = RelationTable.of(entries);
        if (relation.irreducibleCount() != energies.size()) {
            log.warn("対応表の既約点数とエネルギー表の k 点数が一致しません: 対応表={}、エネルギー表={}",
                    relation.irreducibleCount(), energies.size());
        }

        double[][] data = new double[bandCount][total];
        int unresolved = 0;
        int outOfRange = 0;

        for (int row = 0; row < entries.size(); row++) {
            int irreducibleIndex = relation.irreducibleIndexOf(row + 1);
            if (irreducibleIndex < 1 || irreducibleIndex > energies.size()) {
                unresolved++;
                continue;
            }
            MeshEntry entry = entries.get(row);
            if (entry.getX() < 0 || entry.getX() >= nx || entry.getY() < 0 || entry.getY() >= ny
                    || entry.getZ() < 0 || entry.getZ() >= nz) {
                outOfRange++;
                continue;
            }
            int gridIndex = entry.getX() + entry.getY() * nx + entry.getZ() * nx * ny;
            double[] e = energies.get(irreducibleIndex - 1);
            for (int b = 0; b < bandCount; b++) {
                data[b][gridIndex] = e[b];
            }
        }

        if (unresolved > 0) {
            log.warn("代表点のエネルギーが見つからないメッシュ点が {} 点あります（値は 0 のままです）", unresolved);
        }
        if (outOfRange > 0) {
            log.warn("メッシュ座標が範囲外の行を {} 行読み飛ばしました", outOfRange);
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("対応表から格子を組み立てました。格子={}x{}x{}、バンド数={}、既約点={}、所要時間={}ms", nx, ny, nz,
                bandCount, relation.irreducibleCount(), elapsedMs);
        return new EnergyGrid(nx, ny, nz, data, fermiEnergy);
    }
}
