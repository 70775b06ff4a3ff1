package io.github.yok.fermi.core.parser;

import io.github.yok.fermi.core.exception.MissingSectionException;
import io.github.yok.fermi.core.model.LatticeParameters;
import io.github.yok.fermi.core.model.SymmetryOperation;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * 構造ファイル（case.struct）から格子定数と対称操作を読み込むクラスです。
 *
 * <p>
 * 格子定数は 4 行目の {@code a b c alpha beta gamma}（角度は度）です。対称操作は
 * {@code N NUMBER OF SYMMETRY OPERATIONS} 行の後に 1 操作 4 行（回転行列 3 行 + 操作番号 1 行）で並びます。 回転行列の行は
 * Fortran の {@code (3I2,F11.8)} 形式のため、{@code " 0-1 0 0.00000000"} や
 * {@code " 1 0 0-0.50000000"} のように区切りの空白が欠けることがあります。
 * </p>
 */
@Slf4j
public final class StructParser {

    /**
     * 対称操作数の見出し文字列です。
     */
    public static final String SYMMETRY_HEADER = "NUMBER OF SYMMETRY OPERATIONS";

    /**
     * 格子定数の行番号（0 始まり）です。
     */
    static final int LATTICE_LINE = 3;

    /**
     * 1 操作あたりの行数です。
     */
    static final int LINES_PER_OPERATION = 4;

    private static final Pattern SYMMETRY_COUNT =
            Pattern.compile("(\\d+)\\s+" + SYMMETRY_HEADER, Pattern.CASE_INSENSITIVE);

    /**
     * 回転行列の 1 行（符号付き 1 桁整数 3 つ + 並進）です。
     */
    private static final Pattern ROTATION_ROW = Pattern.compile(
            "^\\s*([-+]?\\d)\\s*([-+]?\\d)\\s*([-+]?\\d)(?:\\s*([-+]?\\d*\\.\\d*(?:[EeDd][-+]?\\d+)?))?\\s*$");

    /**
     * 構造ファイルを読み込みます。
     *
     * @param content ファイル内容です（null は空扱い）
     * @return 読み込み結果です
     * @throws MissingSectionException 対称操作数の見出しが見つからない場合に発生します
     */
    public StructData parse(String content) {
        List<String> lines = TextLines.split(content);

        LatticeParameters lattice = LatticeParameters.UNIT_CUBIC;
        if (lines.size() > LATTICE_LINE) {
            lattice = parseLattice(lines.get(LATTICE_LINE)).orElse(LatticeParameters.UNIT_CUBIC);
        }

        int count = -1;
        int start = -1;
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = SYMMETRY_COUNT.matcher(lines.get(i));
            if (m.find()) {
                OptionalInt parsed = TextLines.parseInt(m.group(1));
                if (parsed.isEmpty()) {
                    throw new MissingSectionException(SYMMETRY_HEADER,
                            "対称操作数を読めません: " + m.group(1));
                }
                count = parsed.getAsInt();
                start = i + 1;
                break;
            }
        }
        if (start < 0) {
            throw new MissingSectionException(SYMMETRY_HEADER, "case.struct");
        }

        int fitting = (lines.size() - start) / LINES_PER_OPERATION;
        List<SymmetryOperation> operations = new ArrayList<>(Math.min(count, fitting));
        for (int s = 0; s < count; s++) {
            int base = start + s * LINES_PER_OPERATION;
            if (base + LINES_PER_OPERATION - 1 >= lines.size()) {
                log.warn("対称操作の行が途中で終わっています: 期待={}、読み込み済み={}", count, operations.size());
                break;
            }
            int[][] rotation = new int[3][];
            double[] translation = new double[3];
            boolean ok = true;
            for (int row = 0; row < 3; row++) {
                Optional<RotationRow> parsed = parseRotationRow(lines.get(base + row));
                if (parsed.isEmpty()) {
                    ok = false;
                    break;
                }
                rotation[row] = parsed.get().getRotation();
                translation[row] = parsed.get().getTranslation();
            }
            if (ok) {
                operations.add(new SymmetryOperation(rotation, translation));
            } else {
                log.debug("対称操作 {} の回転行列を解釈できないため読み飛ばします", s + 1);
            }
        }

        log.debug("case.struct: 対称操作 {} / {} 件を読み込みました", operations.size(), count);
        return new StructData(lattice, operations);
    }

    /**
     * 格子定数行を読みます。
     *
     * @param line 行です
     * @return 格子定数です。6 個の数値が読めない場合は空です
     */
    static Optional<LatticeParameters> parseLattice(String line) {
        List<Double> v = TextLines.doubles(line);
        if (v.size() < 6) {
            return Optional.empty();
        }
        return Optional.of(new LatticeParameters(v.get(0), v.get(1), v.get(2),
                Math.toRadians(v.get(3)), Math.toRadians(v.get(4)), Math.toRadians(v.get(5))));
    }

    /**
     * 回転行列の 1 行を読みます（空白区切り・連結・固定幅のいずれにも対応）。
     *
     * @param line 行です
     * @return 回転行列の行と並進成分です。解釈できない場合は空です
     */
    static Optional<RotationRow> parseRotationRow(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher m = ROTATION_ROW.matcher(line);
        if (!m.matches()) {
            return Optional.empty();
        }
        int[] rotation = {Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3))};
        double translation = 0.0;
        if (m.group(4) != null && !m.group(4).isEmpty()) {
            translation = TextLines.parseDouble(m.group(4)).orElse(0.0);
        }
        return Optional.of(new RotationRow(rotation, translation));
    }

    /**
     * 回転行列の 1 行と並進成分です。
     */
    @Value
    static class RotationRow {

        int[] rotation;

        double translation;
    }

    /**
     * 構造ファイルの読み込み結果です。
     */
    @Value
    public static class StructData {

        LatticeParameters latticeParameters;

        List<SymmetryOperation> symmetryOperations;
    }
}
