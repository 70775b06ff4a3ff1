package io.github.yok.fermi.core.parser;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Wien2k の入力ファイル種別です。
 *
 * <p>
 * {@link #detect(String, String)} はまず拡張子で、次に内容で判定します。
 * </p>
 */
public enum Wien2kFileType {
    KLIST, ENERGY, ENERGYSO, SCF, STRUCT, OUTPUT1, OUTPUT2, OUTPUTKGEN, UNKNOWN;

    private static final Pattern SCF_EXT = Pattern.compile(".*\\.scf\\d*$");

    private static final Pattern KLIST_ROW = Pattern.compile("\\d+\\s+\\d+\\s+\\d+\\s+\\d+\\s+\\d+");

    private static final Pattern ENERGY_BAND_ROW =
            Pattern.compile("(?m)\\d+\\s+[-\\d.E+]+\\s*$");

    private static final Pattern ENERGY_HEADER =
            Pattern.compile("[-\\d.E+]+\\s+[-\\d.E+]+\\s+[-\\d.E+]+\\s+\\d+\\s+\\d+\\s+\\d+");

    /**
     * ファイル種別を判定します。
     *
     * @param content ファイル内容です（null は空扱い）
     * @param filename ファイル名です（null は空扱い）
     * @return 種別です
     */
    public static Wien2kFileType detect(String content, String filename) {
        String lower = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        String text = content == null ? "" : content;

        if (lower.endsWith(".klist")) {
            return KLIST;
        }
        if (lower.endsWith(".energyso") || lower.endsWith(".energysodn")
                || lower.endsWith(".energysoup")) {
            return ENERGYSO;
        }
        if (lower.endsWith(".energy") || lower.endsWith(".energyup")
                || lower.endsWith(".energydn")) {
            return ENERGY;
        }
        if (lower.endsWith(".output1")) {
            return OUTPUT1;
        }
        if (lower.endsWith(".output2")) {
            return OUTPUT2;
        }
        if (lower.endsWith(".outputkgen")) {
            return OUTPUTKGEN;
        }
        if (SCF_EXT.matcher(lower).matches() || lower.endsWith(".scfso")) {
            return SCF;
        }
        if (lower.endsWith(".struct") && !lower.contains("_nn") && !lower.contains("_st")) {
            return STRUCT;
        }

        if (text.contains(OutputkgenParser.DIVISION_HEADER)) {
            return OUTPUTKGEN;
        }
        if (text.contains(Output1Parser.EIGENVALUES_START)) {
            return OUTPUT1;
        }
        if (text.contains(":FER")) {
            return SCF;
        }
        if (text.contains(StructParser.SYMMETRY_HEADER)) {
            return STRUCT;
        }
        if (text.contains("END") && KLIST_ROW.matcher(text).find()) {
            return KLIST;
        }
        if (ENERGY_BAND_ROW.matcher(text).find() && ENERGY_HEADER.matcher(text).find()) {
            return ENERGYSO;
        }
        return UNKNOWN;
    }
}
