package io.github.yok.fermi.core.parser;

import java.util.List;
import java.util.Locale;

/**
 * Wien2k のファイル名からケース名を取り出すユーティリティです。
 *
 * <p>
 * 例: {@code LaSb_try3.klist} → {@code LaSb_try3}
 * </p>
 */
public final class CaseNames {

    /**
     * 取り除く拡張子です（長いものを先に判定します）。
     */
    private static final List<String> EXTENSIONS = List.of(".outputkgen", ".output1",
            ".output2", ".energysodn", ".energysoup", ".energyso", ".energyup", ".energydn",
            ".energy", ".klist", ".scfso", ".scf0", ".scf1", ".scf2", ".scfc", ".scfm", ".scfq",
            ".scf", ".struct_ii", ".struct_nn", ".struct_st", ".struct");

    private CaseNames() {}

    /**
     * ファイル名からケース名を返します。
     *
     * @param filename ファイル名です（null 不可）
     * @return ケース名です。既知の拡張子がない場合はファイル名のままです
     * @throws IllegalArgumentException filename が null の場合に発生します
     */
    public static String extractCaseName(String filename) {
        if (filename == null) {
            throw new IllegalArgumentException("filename は null 不可です");
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        for (String ext : EXTENSIONS) {
            if (lower.endsWith(ext)) {
                return filename.substring(0, filename.length() - ext.length());
            }
        }
        return filename;
    }
}
