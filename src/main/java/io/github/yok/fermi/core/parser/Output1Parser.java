package io.github.yok.fermi.core.parser;

import io.github.yok.fermi.core.model.BandEnergyTable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * バンドエネルギーリスト（case.output1）を読み込むクラスです。
 *
 * <p>
 * {@code K=} 行で既約 k 点のブロックが始まり、{@code EIGENVALUES ARE} から {@code EIGENVALUES BELOW}
 * までの間に空白・改行区切りで固有値（Ry）が並びます。
 * </p>
 *
 * <p>
 * 表を矩形に保つため、バンド数は全 k 点の最小値に揃えます。切り詰めが起きた場合は WARN で件数を出力します。
 * </p>
 */
@Slf4j
public final class Output1Parser {

    /**
     * 固有値領域の開始マーカーです。
     */
    public static final String EIGENVALUES_START = "EIGENVALUES ARE";

    /**
     * 固有値領域の終了マーカーです。
     */
    public static final String EIGENVALUES_END = "EIGENVALUES BELOW";

    private static final Pattern BLOCK_START = Pattern.compile("^\\s*K=");

    private static final Pattern FLOAT = Pattern.compile("[-+]?\\d*\\.?\\d+(?:[Ee][-+]?\\d+)?");

    /**
     * 行分類器です（K= → 領域開始 → 領域終了 → 数値行の順に判定）。
     */
    private final LineClassifier<Output1Line> classifier =
            new LineClassifier<>(List.of(Output1Parser::matchBlockStart,
                    line -> matchMarker(line, EIGENVALUES_START, Output1Line.Type.ENERGIES_START),
                    line -> matchMarker(line, EIGENVALUES_END, Output1Line.Type.ENERGIES_END),
                    Output1Parser::matchValues));

    /**
     * output1 を読み込みます。
     *
     * @param content ファイル内容です（null は空扱い）
     * @return バンドエネルギー表（eV）です
     */
    public BandEnergyTable parse(String content) {
        List<List<Double>> blocks = new ArrayList<>();
        List<Double> current = null;
        boolean inEnergies = false;

        for (String line : TextLines.split(content)) {
            ParsedLine<Output1Line> parsed = classifier.classify(line);
            if (parsed.isBoundary()) {
                if (current != null && !current.isEmpty()) {
                    blocks.add(current);
                }
                current = new ArrayList<>();
                inEnergies = false;
                continue;
            }
            if (!parsed.isRecord()) {
                continue;
            }
            Output1Line value = parsed.getValue();
            switch (value.getType()) {
                case ENERGIES_START:
                    inEnergies = true;
                    break;
                case ENERGIES_END:
                    inEnergies = false;
                    break;
                default:
                    if (inEnergies && current != null) {
                        for (double ry : value.getValues()) {
                            current.add(EnergyUnits.rydbergToEv(ry));
                        }
                    }
                    break;
            }
        }
        if (current != null && !current.isEmpty()) {
            blocks.add(current);
        }

        return toRectangularTable(blocks);
    }

    /**
     * ブロックを最小バンド数で切り詰めて矩形の表にします。
     *
     * @param blocks k 点ごとのエネルギーです
     * @return 表です
     */
    private static BandEnergyTable toRectangularTable(List<List<Double>> blocks) {
        if (blocks.isEmpty()) {
            log.warn("output1 に固有値ブロックが見つかりません");
            return new BandEnergyTable(List.of(), 0);
        }
        int bandCount = Integer.MAX_VALUE;
        for (List<Double> block : blocks) {
            bandCount = Math.min(bandCount, block.size());
        }

        int truncated = 0;
        List<double[]> rows = new ArrayList<>(blocks.size());
        for (List<Double> block : blocks) {
            if (block.size() > bandCount) {
                truncated++;
            }
            double[] row = new double[bandCount];
            for (int b = 0; b < bandCount; b++) {
                row[b] = block.get(b);
            }
            rows.add(row);
        }
        if (truncated > 0) {
            log.warn("バンド数が k 点間で一致しないため最小値 {} に切り詰めました（対象 k 点数={} / {}）", bandCount,
                    truncated, blocks.size());
        }
        return new BandEnergyTable(rows, bandCount);
    }

    private static Optional<ParsedLine<Output1Line>> matchBlockStart(String line) {
        return BLOCK_START.matcher(line).find() ? Optional.of(ParsedLine.boundary())
                : Optional.empty();
    }

    private static Optional<ParsedLine<Output1Line>> matchMarker(String line, String marker,
            Output1Line.Type type) {
        return line.contains(marker)
                ? Optional.of(ParsedLine.record(new Output1Line(type, new double[0])))
                : Optional.empty();
    }

    /**
     * 行内の実数をすべて取り出します。
     */
    static Optional<ParsedLine<Output1Line>> matchValues(String line) {
        Matcher m = FLOAT.matcher(line);
        double[] buf = new double[8];
        int count = 0;
        while (m.find()) {
            OptionalDouble v = TextLines.parseDouble(m.group());
            if (v.isPresent()) {
                if (count == buf.length) {
                    buf = Arrays.copyOf(buf, count * 2);
                }
                buf[count++] = v.getAsDouble();
            }
        }
        if (count == 0) {
            return Optional.empty();
        }
        return Optional.of(ParsedLine
                .record(new Output1Line(Output1Line.Type.VALUES, Arrays.copyOf(buf, count))));
    }

    /**
     * output1 の 1 行の分類結果です。
     */
    @Value
    static class Output1Line {

        enum Type {
            ENERGIES_START, ENERGIES_END, VALUES
        }

        Type type;

        double[] values;
    }
}
