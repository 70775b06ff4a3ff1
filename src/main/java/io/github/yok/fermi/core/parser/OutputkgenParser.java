package io.github.yok.fermi.core.parser;

import io.github.yok.fermi.core.exception.MissingSectionException;
import io.github.yok.fermi.core.model.KMeshGeneration;
import io.github.yok.fermi.core.model.KMeshGeneration.MeshEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * k メッシュ生成リスト（case.outputkgen）を読み込むクラスです。
 *
 * <p>
 * 読み取る内容は次の 3 つです。
 * </p>
 * <ul>
 * <li>{@code G1 G2 G3} 見出しに続く 3 行（逆格子基本ベクトル）</li>
 * <li>{@code DIVISION OF RECIPROCAL LATTICE VECTORS} 行の末尾 3 整数（各 +1 して格子点数 nx, ny, nz）</li>
 * <li>{@code point ... coordinates ... relation} 見出しに続く nx*ny*nz 行
 * （{@code pointIndex x y z relation}）</li>
 * </ul>
 */
@Slf4j
public final class OutputkgenParser {

    /**
     * メッシュ分割数の見出し文字列です。
     */
    public static final String DIVISION_HEADER = "DIVISION OF RECIPROCAL LATTICE VECTORS";

    /**
     * 対応表データ行のセクション名です（エラー表示用）。
     */
    public static final String RELATION_ROWS = "point/coordinates/relation rows";

    private static final Pattern RECIPROCAL_HEADER = Pattern.compile("\\bG1\\b\\s+G2\\s+G3");

    /**
     * 対応表データ行の分類器です。
     */
    private final LineClassifier<MeshEntry> entryClassifier = new LineClassifier<>(
            List.of(line -> line.isBlank() ? Optional.of(ParsedLine.skip()) : Optional.empty(),
                    OutputkgenParser::matchEntry));

    /**
     * outputkgen を読み込みます。
     *
     * @param content ファイル内容です（null は空扱い）
     * @return 読み込み結果です
     * @throws MissingSectionException 分割数の見出し、または必要な数の対応表データ行がない場合に発生します
     */
    public KMeshGeneration parse(String content) {
        List<String> lines = TextLines.split(content);

        List<double[]> reciprocal = parseReciprocalVectors(lines);

        int[] dims = parseDimensions(lines);
        int nx = dims[0];
        int ny = dims[1];
        int nz = dims[2];

        int headerIndex = -1;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.contains("point") && line.contains("coordinates") && line.contains("relation")) {
                headerIndex = i;
                break;
            }
        }
        if (headerIndex < 0) {
            for (int i = 0; i < lines.size(); i++) {
                if (lines.get(i).trim().startsWith("point")) {
                    headerIndex = i;
                    break;
                }
            }
        }

        int cursor = headerIndex >= 0 ? headerIndex + 1 : 0;
        long expected = (long) nx * ny * nz;
        int available = lines.size() - cursor;
        if (expected > available) {
            // 1 行 1 点のため、残り行数を超える点数は読み切れない
            throw new MissingSectionException(RELATION_ROWS,
                    "期待=" + expected + " 行、残り=" + available + " 行");
        }
        int total = (int) expected;
        List<MeshEntry> entries = new ArrayList<>(total);
        while (cursor < lines.size() && entries.size() < total) {
            ParsedLine<MeshEntry> parsed = entryClassifier.classify(lines.get(cursor));
            if (parsed.isRecord()) {
                entries.add(parsed.getValue());
            }
            cursor++;
        }
        if (entries.size() < total) {
            throw new MissingSectionException(RELATION_ROWS,
                    "期待=" + total + " 行、実際=" + entries.size() + " 行");
        }

        log.debug("outputkgen: メッシュ {}x{}x{}、対応表 {} 行を読み込みました", nx, ny, nz, entries.size());
        return new KMeshGeneration(nx, ny, nz, reciprocal, entries);
    }

    /**
     * 逆格子基本ベクトルを読みます。
     *
     * @param lines 行です
     * @return 3 本のベクトルです。読めない場合は空リストです
     */
    private static List<double[]> parseReciprocalVectors(List<String> lines) {
        for (int i = 0; i + 3 < lines.size(); i++) {
            if (!RECIPROCAL_HEADER.matcher(lines.get(i)).find()) {
                continue;
            }
            List<Double> v1 = TextLines.doubles(lines.get(i + 1));
            List<Double> v2 = TextLines.doubles(lines.get(i + 2));
            List<Double> v3 = TextLines.doubles(lines.get(i + 3));
            if (v1.size() == 3 && v2.size() == 3 && v3.size() == 3) {
                return List.of(toArray(v1), toArray(v2), toArray(v3));
            }
        }
        log.debug("outputkgen に G1 G2 G3 ブロックが見つかりません");
        return List.of();
    }

    /**
     * メッシュの格子点数（分割数 + 1）を読みます。
     *
     * @param lines 行です
     * @return {nx, ny, nz} です
     * @throws MissingSectionException 見出しがない、または整数が 3 つない場合に発生します
     */
    private static int[] parseDimensions(List<String> lines) {
        for (String line : lines) {
            if (!line.contains(DIVISION_HEADER)) {
                continue;
            }
            List<Integer> ints = TextLines.integers(line);
            if (ints.size() < 3) {
                break;
            }
            int n = ints.size();
            int nx = ints.get(n - 3) + 1;
            int ny = ints.get(n - 2) + 1;
            int nz = ints.get(n - 1) + 1;
            if (nx > 0 && ny > 0 && nz > 0) {
                return new int[] {nx, ny, nz};
            }
            break;
        }
        throw new MissingSectionException(DIVISION_HEADER, "case.outputkgen");
    }

    /**
     * 対応表データ行（5 個以上の数値）を認識します。
     */
    static Optional<ParsedLine<MeshEntry>> matchEntry(String line) {
        String[] parts = TextLines.tokens(line);
        if (parts.length < 5) {
            return Optional.empty();
        }
        for (String part : parts) {
            if (TextLines.parseDouble(part).isEmpty()) {
                return Optional.empty();
            }
        }
        OptionalInt point = TextLines.parseInt(parts[0]);
        OptionalInt x = TextLines.parseInt(parts[1]);
        OptionalInt y = TextLines.parseInt(parts[2]);
        OptionalInt z = TextLines.parseInt(parts[3]);
        OptionalInt relation = TextLines.parseInt(parts[4]);
        if (point.isEmpty() || x.isEmpty() || y.isEmpty() || z.isEmpty() || relation.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ParsedLine.record(new MeshEntry(point.getAsInt(), x.getAsInt(),
                y.getAsInt(), z.getAsInt(), relation.getAsInt())));
    }

    private static double[] toArray(List<Double> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }
}
