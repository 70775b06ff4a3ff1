package io.github.yok.fermi.out;

import io.github.yok.fermi.core.lattice.ReciprocalLattice;
import io.github.yok.fermi.core.model.IsosurfaceMesh;
import io.github.yok.fermi.core.pipeline.BandSurface;
import io.github.yok.fermi.core.pipeline.FermiSurfaceResult;
import io.github.yok.fermi.core.pipeline.FermiSurfaceSummary;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 再構成結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（case はケース名、NN は 2 桁以上のバンド番号）。
 * </p>
 *
 * <ul>
 * <li>{@code fermi_summary_case.csv}（E_F、バンド数、k 点数、交差バンド、格子サイズ、表示色など）</li>
 * <li>{@code fermi_vertices_band=NN_case.csv}（頂点の分率座標と法線、任意でデカルト座標）</li>
 * <li>{@code fermi_triangles_band=NN_case.csv}（三角形の頂点インデックス）</li>
 * </ul>
 */
@Slf4j
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "fermi";

    /**
     * ケース名が空の場合に使う名前です。
     */
    private static final String DEFAULT_CASE = "case";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * デカルト座標も出力するかどうかです。
     */
    private final boolean cartesian;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param cartesian 逆格子が分かる場合にデカルト座標も出力するかどうかです
     * @throws IllegalArgumentException outputDir が null または空の場合に発生します
     */
    public CsvResultWriter(String outputDir, boolean cartesian) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
        this.cartesian = cartesian;
    }

    /**
     * 取り込み結果とフェルミ面を出力します。
     *
     * @param result 取り込み結果です
     * @param surfaces バンドごとのフェルミ面です
     * @throws IllegalArgumentException 引数が null の場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(FermiSurfaceResult result, List<BandSurface> surfaces) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        if (surfaces == null) {
            throw new IllegalArgumentException("surfaces は null 不可です");
        }
        String caseName = result.getSummary().getCaseName();
        if (caseName == null || caseName.isBlank()) {
            caseName = DEFAULT_CASE;
        }
        ReciprocalLattice lattice =
                cartesian ? result.findReciprocalLattice().orElse(null) : null;

        try {
            Files.createDirectories(outputDir);

            writeSummaryCsv(result.getSummary(), surfaces, caseName);

            for (BandSurface surface : surfaces) {
                writeVerticesCsv(surface, lattice, caseName);
                writeTrianglesCsv(surface, caseName);
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
        log.info("CSV を出力しました: dir={}, surfaces={}", outputDir, surfaces.size());
    }

    /**
     * 概要を出力します。
     *
     * @param s 概要です
     * @param surfaces バンドごとのフェルミ面です
     * @param caseName ケース名です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeSummaryCsv(FermiSurfaceSummary s, List<BandSurface> surfaces,
            String caseName) throws IOException {

        Path file = outputDir.resolve(FILE_HEAD + "_summary_" + caseName + ".csv");

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("caseName", caseName);
            pr.printRecord("fermiEnergy.eV", s.getFermiEnergy());
            pr.printRecord("bandCount", s.getBandCount());
            pr.printRecord("kPoints.irreducible", s.getIrreducibleKPointCount());
            pr.printRecord("kPoints.full", s.getFullKPointCount());
            pr.printRecord("crossingBands", joinBands(s.getCrossingBands()));
            pr.printRecord("grid.nx", s.getGridNx());
            pr.printRecord("grid.ny", s.getGridNy());
            pr.printRecord("grid.nz", s.getGridNz());

            List<Integer> shown = new ArrayList<>();
            for (BandSurface surface : surfaces) {
                shown.add(surface.getBandIndex());
                String prefix = "surface." + surface.getBandIndex();
                pr.printRecord(prefix + ".color", surface.getColor());
                pr.printRecord(prefix + ".vertices", surface.getMesh().getVertexCount());
                pr.printRecord(prefix + ".triangles", surface.getMesh().getTriangleCount());
            }
            pr.printRecord("surfaces", joinBands(shown));
        }
    }

    /**
     * 頂点（座標と法線）を出力します。
     *
     * @param surface フェルミ面です
     * @param lattice 逆格子です（null の場合はデカルト座標を出力しません）
     * @param caseName ケース名です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeVerticesCsv(BandSurface surface, ReciprocalLattice lattice,
            String caseName) throws IOException {

        Path file = outputDir
                .resolve(buildFileName("vertices", surface.getBandIndex(), caseName));

        IsosurfaceMesh mesh = surface.getMesh();
        float[] pos = mesh.getPositions();
        float[] nrm = mesh.getNormals();
        float[] cart = lattice != null ? lattice.toCartesian(pos) : null;

        String[] header = cart != null
                ? new String[] {"i", "kx", "ky", "kz", "nx", "ny", "nz", "gx", "gy", "gz"}
                : new String[] {"i", "kx", "ky", "kz", "nx", "ny", "nz"};

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader(header)
                        .build().print(w)) {

            for (int v = 0; v < mesh.getVertexCount(); v++) {
                int o = 3 * v;
                if (cart != null) {
                    pr.printRecord(v, pos[o], pos[o + 1], pos[o + 2], nrm[o], nrm[o + 1],
                            nrm[o + 2], cart[o], cart[o + 1], cart[o + 2]);
                } else {
                    pr.printRecord(v, pos[o], pos[o + 1], pos[o + 2], nrm[o], nrm[o + 1],
                            nrm[o + 2]);
                }
            }
        }
    }

    /**
     * 三角形（頂点インデックス）を出力します。
     *
     * @param surface フェルミ面です
     * @param caseName ケース名です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeTrianglesCsv(BandSurface surface, String caseName) throws IOException {

        Path file = outputDir
                .resolve(buildFileName("triangles", surface.getBandIndex(), caseName));

        int[] indices = surface.getMesh().getIndices();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("t", "v0", "v1", "v2").build().print(w)) {

            for (int t = 0; t < indices.length / 3; t++) {
                pr.printRecord(t, indices[3 * t], indices[3 * t + 1], indices[3 * t + 2]);
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code fermi_vertices_band=07_LaSb.csv}
     * </p>
     *
     * @param kind 種別（vertices/triangles）
     * @param band バンド番号です
     * @param caseName ケース名です
     * @return ファイル名です
     */
    static String buildFileName(String kind, int band, String caseName) {
        return FILE_HEAD + "_" + kind + "_band=" + String.format(Locale.ROOT, "%02d", band) + "_"
                + caseName + ".csv";
    }

    /**
     * バンド番号を空白区切りの文字列にします。
     *
     * @param bands バンド番号です
     * @return 文字列です
     */
    private static String joinBands(List<Integer> bands) {
        return bands.stream().map(String::valueOf).collect(Collectors.joining(" "));
    }
}
