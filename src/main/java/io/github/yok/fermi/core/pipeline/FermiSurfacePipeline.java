package io.github.yok.fermi.core.pipeline;

import io.github.yok.fermi.core.band.BandCrossingFilter;
import io.github.yok.fermi.core.grid.DirectGridFiller;
import io.github.yok.fermi.core.grid.FermiLevelShifter;
import io.github.yok.fermi.core.grid.InterpolatedGridBuilder;
import io.github.yok.fermi.core.isosurface.IsosurfaceExtractor;
import io.github.yok.fermi.core.lattice.ReciprocalLattice;
import io.github.yok.fermi.core.model.BandEnergyTable;
import io.github.yok.fermi.core.model.EnergyGrid;
import io.github.yok.fermi.core.model.ExpandedKPoint;
import io.github.yok.fermi.core.model.GenericFermiData;
import io.github.yok.fermi.core.model.IsosurfaceMesh;
import io.github.yok.fermi.core.model.KMeshGeneration;
import io.github.yok.fermi.core.parser.FermiEnergyParser;
import io.github.yok.fermi.core.parser.GenericFermiDataReader;
import io.github.yok.fermi.core.parser.Output1Parser;
import io.github.yok.fermi.core.parser.OutputkgenParser;
import io.github.yok.fermi.core.symmetry.SymmetryExpander;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * フェルミ面再構成の処理全体（パース → 格子化 → フェルミ準位シフト → 交差判定 → 等値面抽出）をまとめるクラスです。
 *
 * <p>
 * 取り込み（{@code import*}）と等値面抽出（{@link #extractSurfaces}）は分かれており、
 * 表示バンドを変えたときは抽出だけを再実行できます。 各段階の間でスレッドの割り込みを確認し、
 * 割り込まれていれば {@link CancellationException} を送出します。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class FermiSurfacePipeline {

    /**
     * 表示色のパレットです（有効バンドの並び順で循環させます）。
     */
    public static final List<String> PALETTE = List.of("#3b82f6", "#ef4444", "#22c55e",
            "#f59e0b", "#8b5cf6", "#ec4899", "#06b6d4", "#f97316");

    private final GenericFermiDataReader genericReader;

    private final Output1Parser output1Parser;

    private final FermiEnergyParser fermiEnergyParser;

    private final OutputkgenParser outputkgenParser;

    private final SymmetryExpander symmetryExpander;

    private final InterpolatedGridBuilder interpolatedGridBuilder;

    private final DirectGridFiller directGridFiller;

    private final FermiLevelShifter fermiLevelShifter;

    private final BandCrossingFilter bandCrossingFilter;

    private final IsosurfaceExtractor isosurfaceExtractor;

    /**
     * 補間格子の各軸の点数です。
     */
    private final int gridSize;

    /**
     * 汎用形式を取り込みます。
     *
     * @param inputs 入力内容です（null 不可）
     * @return 取り込み結果です
     * @throws IllegalArgumentException inputs が null の場合に発生します
     * @throws CancellationException 処理中に割り込まれた場合に発生します
     */
    public FermiSurfaceResult importGeneric(GenericInputs inputs) {
        if (inputs == null) {
            throw new IllegalArgumentException("inputs は null 不可です");
        }
        long t0 = System.nanoTime();

        GenericFermiData data = genericReader.read(inputs.getKlist(), inputs.getEnergy(),
                inputs.getScf(), inputs.getStruct(), inputs.getCaseName(), inputs.isSpinOrbit());
        checkCancelled("パース");

        List<ExpandedKPoint> expanded =
                symmetryExpander.expand(data.getKPoints(), data.getSymmetryOperations());
        checkCancelled("対称展開");

        EnergyGrid grid = interpolatedGridBuilder.build(expanded, data.getBandCount(),
                data.getSourceDivision(), gridSize, data.getFermiEnergy());
        checkCancelled("格子化");

        EnergyGrid shifted = fermiLevelShifter.shift(grid);
        List<Integer> crossing = bandCrossingFilter.findCrossingBands(data.getKPoints(),
                data.getBandCount(), data.getFermiEnergy());
        checkCancelled("交差判定");

        ReciprocalLattice lattice = null;
        try {
            lattice = ReciprocalLattice.fromLatticeParameters(data.getLatticeParameters());
        } catch (IllegalArgumentException e) {
            log.warn("格子定数から逆格子を求められません: {}", e.getMessage());
        }

        FermiSurfaceSummary summary = new FermiSurfaceSummary(inputs.getCaseName(),
                data.getFermiEnergy(), data.getBandCount(), data.getKPoints().size(),
                expanded.size(), crossing, shifted.getNx(), shifted.getNy(), shifted.getNz());
        logImported("汎用形式", summary, t0);
        return new FermiSurfaceResult(shifted, summary, lattice);
    }

    /**
     * 最適化形式を取り込みます。
     *
     * @param inputs 入力内容です（null 不可）
     * @return 取り込み結果です
     * @throws IllegalArgumentException inputs が null の場合に発生します
     * @throws io.github.yok.fermi.core.exception.MissingSectionException outputkgen に必要な区間がない場合に発生します
     * @throws CancellationException 処理中に割り込まれた場合に発生します
     */
    public FermiSurfaceResult importPrecomputed(PrecomputedInputs inputs) {
        if (inputs == null) {
            throw new IllegalArgumentException("inputs は null 不可です");
        }
        long t0 = System.nanoTime();

        BandEnergyTable table = output1Parser.parse(inputs.getOutput1());
        double fermiEnergy = fermiEnergyParser.parse(inputs.getOutput2());
        KMeshGeneration mesh = outputkgenParser.parse(inputs.getOutputkgen());
        checkCancelled("パース");

        EnergyGrid grid = directGridFiller.fill(table, mesh, fermiEnergy);
        checkCancelled("格子化");

        EnergyGrid shifted = fermiLevelShifter.shift(grid);
        List<Integer> crossing = bandCrossingFilter.findCrossingBands(table, fermiEnergy);
        checkCancelled("交差判定");

        ReciprocalLattice lattice = null;
        if (mesh.getReciprocalVectors().size() == 3) {
            lattice = ReciprocalLattice.fromColumnVectors(mesh.getReciprocalVectors());
        }

        FermiSurfaceSummary summary = new FermiSurfaceSummary(inputs.getCaseName(), fermiEnergy,
                table.getBandCount(), table.kPointCount(), shifted.size(), crossing,
                shifted.getNx(), shifted.getNy(), shifted.getNz());
        logImported("最適化形式", summary, t0);
        return new FermiSurfaceResult(shifted, summary, lattice);
    }

    /**
     * 有効バンドの等値面（E = E_F、シフト済み格子では 0）を抽出します。
     *
     * <p>
     * 表示色は有効バンドの並び順でパレットを循環させて割り当てます。 範囲外のバンドと頂点のないメッシュは結果に含めません。
     * </p>
     *
     * @param result 取り込み結果です（null 不可）
     * @param enabledBands 有効バンドの番号です（null 不可）
     * @return バンドごとのフェルミ面です
     * @throws IllegalArgumentException 引数が null の場合に発生します
     * @throws CancellationException 処理中に割り込まれた場合に発生します
     */
    public List<BandSurface> extractSurfaces(FermiSurfaceResult result,
            List<Integer> enabledBands) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        if (enabledBands == null) {
            throw new IllegalArgumentException("enabledBands は null 不可です");
        }
        EnergyGrid grid = result.getGrid();
        List<BandSurface> surfaces = new ArrayList<>();
        for (int i = 0; i < enabledBands.size(); i++) {
            checkCancelled("等値面抽出");
            Integer band = enabledBands.get(i);
            if (band == null || band < 0 || band >= grid.getBandCount()) {
                log.warn("範囲外のバンドを無視します: band={} (bandCount={})", band,
                        grid.getBandCount());
                continue;
            }
            IsosurfaceMesh mesh = isosurfaceExtractor.extract(grid, band, grid.getFermiEnergy());
            if (mesh.isEmpty()) {
                log.info("band={} はこの解像度でフェルミ準位と交差しません", band);
                continue;
            }
            surfaces.add(new BandSurface(band, PALETTE.get(i % PALETTE.size()), mesh));
        }
        return surfaces;
    }

    /**
     * 既定で有効にするバンド（交差バンドの先頭 count 本）を返します。
     *
     * @param result 取り込み結果です（null 不可）
     * @param count 本数です（0 以上）
     * @return 有効バンドの番号です
     * @throws IllegalArgumentException result が null、または count が負の場合に発生します
     */
    public static List<Integer> defaultEnabledBands(FermiSurfaceResult result, int count) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        if (count < 0) {
            throw new IllegalArgumentException("count は 0 以上が必要です: " + count);
        }
        List<Integer> crossing = result.getCrossingBands();
        return List.copyOf(crossing.subList(0, Math.min(count, crossing.size())));
    }

    /**
     * 割り込みを確認します。
     *
     * @param stage 直前の段階名です
     * @throws CancellationException 割り込まれている場合に発生します
     */
    private static void checkCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException(stage + " の後で処理が中断されました");
        }
    }

    private static void logImported(String variant, FermiSurfaceSummary s, long t0) {
        long ms = (System.nanoTime() - t0) / 1_000_000L;
        log.info("{}の取り込みが完了しました。E_F={} eV、バンド数={}、既約k点={}、全k点={}、交差バンド={}、格子={}x{}x{} ({} ms)",
                variant, String.format(Locale.ROOT, "%.5f", s.getFermiEnergy()),
                s.getBandCount(), s.getIrreducibleKPointCount(), s.getFullKPointCount(),
                s.getCrossingBands(), s.getGridNx(), s.getGridNy(), s.getGridNz(), ms);
    }
}
