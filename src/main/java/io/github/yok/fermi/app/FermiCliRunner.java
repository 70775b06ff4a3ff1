package io.github.yok.fermi.app;

import io.github.yok.fermi.core.pipeline.BandSurface;
import io.github.yok.fermi.core.pipeline.FermiSurfacePipeline;
import io.github.yok.fermi.core.pipeline.FermiSurfaceResult;
import io.github.yok.fermi.core.pipeline.FermiSurfaceSummary;
import io.github.yok.fermi.out.ResultWriter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI でフェルミ面の再構成を実行するクラスです。
 *
 * <p>
 * 入力ディレクトリから Wien2k の出力を読み込み、フェルミ準位で 0 にシフトした格子を作り、 有効バンドの等値面を CSV に出力します。
 * 取り込みと抽出は 1 つのバックグラウンドタスクとして実行し、タイムアウトした場合は割り込みで中断します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class FermiCliRunner implements CommandLineRunner {

    /**
     * fermi-surface の設定値（fermi.*）です。
     */
    private final FermiProperties properties;

    /**
     * 入力ファイルの読み込みロジックです。
     */
    private final InputFileLoader inputFileLoader;

    /**
     * 再構成パイプラインです。
     */
    private final FermiSurfacePipeline pipeline;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     * @throws Exception 再構成に失敗した場合に発生します（原因の例外をそのまま送出します）
     */
    @Override
    public void run(String... args) throws Exception {
        System.out.println("=== fermi-surface start: reconstruct Fermi surfaces ===");
        System.out.print(properties.toMultilineString());

        long timeout = properties.getRun().getTimeoutSeconds();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Reconstruction> future = executor.submit(this::reconstruct);
            Reconstruction r;
            try {
                r = future.get(timeout, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new IllegalStateException("再構成が " + timeout + " 秒以内に終わりませんでした", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }
                throw e;
            }

            resultWriter.write(r.result, r.surfaces);
            printSummary(r);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * 取り込みと等値面抽出を実行します。
     *
     * @return 再構成結果です
     */
    private Reconstruction reconstruct() {
        FermiProperties.Input in = properties.getInput();
        FermiSurfaceResult result;
        if (in.getVariant() == FermiProperties.Input.Variant.PRECOMPUTED) {
            result = pipeline
                    .importPrecomputed(inputFileLoader.loadPrecomputed(in.getCaseName()));
        } else {
            result = pipeline.importGeneric(
                    inputFileLoader.loadGeneric(in.getCaseName(), in.isSpinOrbit()));
        }

        // 有効バンドが未指定なら交差バンドの先頭から
        List<Integer> enabled = properties.getBands().getEnabled();
        if (enabled == null || enabled.isEmpty()) {
            enabled = FermiSurfacePipeline.defaultEnabledBands(result,
                    properties.getBands().getDefaultEnabledCount());
        }
        List<BandSurface> surfaces = pipeline.extractSurfaces(result, enabled);
        return new Reconstruction(result, enabled, surfaces);
    }

    /**
     * 結果の概要を標準出力に表示します。
     *
     * @param r 再構成結果です
     */
    private static void printSummary(Reconstruction r) {
        FermiSurfaceSummary s = r.result.getSummary();
        System.out.println("=== 取り込み結果 ===");
        System.out.println("結果: case=" + s.getCaseName() + ", E_F=" + fmt5(s.getFermiEnergy())
                + " eV, bands=" + s.getBandCount() + ", k(irr)=" + s.getIrreducibleKPointCount()
                + ", k(full)=" + s.getFullKPointCount());
        System.out.println("結果: crossing=" + s.getCrossingBands() + ", enabled=" + r.enabled
                + ", grid=" + s.getGridNx() + "x" + s.getGridNy() + "x" + s.getGridNz());
        for (BandSurface surface : r.surfaces) {
            System.out.println("面: band=" + surface.getBandIndex() + ", color="
                    + surface.getColor() + ", vertices=" + surface.getMesh().getVertexCount()
                    + ", triangles=" + surface.getMesh().getTriangleCount());
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    /**
     * バックグラウンドタスクの結果です。
     */
    private static final class Reconstruction {

        private final FermiSurfaceResult result;

        private final List<Integer> enabled;

        private final List<BandSurface> surfaces;

        private Reconstruction(FermiSurfaceResult result, List<Integer> enabled,
                List<BandSurface> surfaces) {
            this.result = result;
            this.enabled = enabled;
            this.surfaces = surfaces;
        }
    }
}
