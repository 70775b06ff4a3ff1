package io.github.yok.fermi.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * k 点メッシュ（case.klist）を読み込むクラスです。
 *
 * <p>
 * 各レコードは {@code index kx*d ky*d kz*d d weight [...]} の形式で、分率座標は {@code 成分 / d} です。 先頭レコードには
 * {@code 1000 k, div: ( 10 10 10)} のようなメッシュ情報が付くことがあります。 {@code END} 行で読み込みを終了し、
 * 形式に合わないレコードは読み飛ばします。
 * </p>
 */
@Slf4j
public final class KlistParser {

    /**
     * メッシュ分割数の注記です。
     */
    private static final Pattern DIVISION =
            Pattern.compile("div:\\s*\\(\\s*(\\d+)\\s+(\\d+)\\s+(\\d+)\\s*\\)");

    /**
     * k 点総数の注記です。
     */
    private static final Pattern TOTAL = Pattern.compile("(\\d+)\\s+k,");

    /**
     * 分割数が読めない場合の既定値です。
     */
    static final int DEFAULT_DIVISION = 10;

    /**
     * 行分類器です（END → 空行 → k 点レコードの順に判定）。
     */
    private final LineClassifier<KlistRecord> classifier = new LineClassifier<>(
            List.of(KlistParser::matchEnd, KlistParser::matchBlank, KlistParser::matchRecord));

    /**
     * klist を読み込みます。
     *
     * @param content klist の内容です（null は空扱い）
     * @return 読み込み結果です
     */
    public KlistData parse(String content) {
        List<KlistRecord> records = new ArrayList<>();
        int skipped = 0;

        for (String line : TextLines.split(content)) {
            ParsedLine<KlistRecord> parsed = classifier.classify(line);
            if (parsed.isBoundary()) {
                break;
            }
            if (parsed.isRecord()) {
                records.add(parsed.getValue());
            } else if (!line.isBlank()) {
                skipped++;
            }
        }

        int division = 0;
        int total = records.size();
        for (KlistRecord r : records) {
            if (r.getDivisionNote() > 0) {
                division = r.getDivisionNote();
                if (r.getTotalNote() > 0) {
                    total = r.getTotalNote();
                }
                break;
            }
        }
        if (division <= 0) {
            division = records.isEmpty() ? DEFAULT_DIVISION : records.get(0).getDivisor();
            log.debug("klist に div 注記がないため分割数={} を採用します", division);
        }
        if (skipped > 0) {
            log.debug("klist の解釈できない行を {} 行読み飛ばしました", skipped);
        }

        List<KPointCoordinate> kPoints = new ArrayList<>(records.size());
        for (KlistRecord r : records) {
            kPoints.add(r.getCoordinate());
        }
        return new KlistData(kPoints, division, total);
    }

    /**
     * {@code END} 行をセクション境界として認識します。
     */
    private static Optional<ParsedLine<KlistRecord>> matchEnd(String line) {
        return "END".equals(line.trim()) ? Optional.of(ParsedLine.boundary()) : Optional.empty();
    }

    /**
     * 空行を読み飛ばしとして認識します。
     */
    private static Optional<ParsedLine<KlistRecord>> matchBlank(String line) {
        return line.isBlank() ? Optional.of(ParsedLine.skip()) : Optional.empty();
    }

    /**
     * k 点レコードを認識します。
     */
    static Optional<ParsedLine<KlistRecord>> matchRecord(String line) {
        String[] parts = TextLines.tokens(line);
        if (parts.length < 6) {
            return Optional.empty();
        }
        OptionalInt index = TextLines.parseInt(parts[0]);
        OptionalInt kx = TextLines.parseInt(parts[1]);
        OptionalInt ky = TextLines.parseInt(parts[2]);
        OptionalInt kz = TextLines.parseInt(parts[3]);
        OptionalInt div = TextLines.parseInt(parts[4]);
        OptionalDouble weight = TextLines.parseDouble(parts[5]);
        if (index.isEmpty() || kx.isEmpty() || ky.isEmpty() || kz.isEmpty() || div.isEmpty()
                || weight.isEmpty() || div.getAsInt() == 0) {
            return Optional.empty();
        }

        int d = div.getAsInt();
        KPointCoordinate coordinate = new KPointCoordinate((double) kx.getAsInt() / d,
                (double) ky.getAsInt() / d, (double) kz.getAsInt() / d, weight.getAsDouble());

        int divisionNote = 0;
        int totalNote = 0;
        Matcher dm = DIVISION.matcher(line);
        if (dm.find()) {
            divisionNote = Integer.parseInt(dm.group(1));
            Matcher tm = TOTAL.matcher(line);
            if (tm.find()) {
                totalNote = Integer.parseInt(tm.group(1));
            }
        }
        return Optional.of(ParsedLine.record(new KlistRecord(coordinate, d, divisionNote, totalNote)));
    }

    /**
     * klist の 1 レコードです。
     */
    @Value
    static class KlistRecord {

        KPointCoordinate coordinate;

        /**
         * 座標の分母 d です。
         */
        int divisor;

        /**
         * div 注記の分割数です（注記なしは 0）。
         */
        int divisionNote;

        /**
         * k 点総数の注記です（注記なしは 0）。
         */
        int totalNote;
    }

    /**
     * k 点の分率座標と重みです。
     */
    @Value
    public static class KPointCoordinate {

        double kx;

        double ky;

        double kz;

        double weight;
    }

    /**
     * klist の読み込み結果です。
     */
    @Value
    public static class KlistData {

        /**
         * 既約 k 点（ファイル順）です。
         */
        List<KPointCoordinate> kPoints;

        /**
         * メッシュの分割数です。
         */
        int division;

        /**
         * 全メッシュの k 点総数です（注記がなければ既約 k 点数）。
         */
        int totalKPoints;
    }
}
