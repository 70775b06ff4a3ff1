package io.github.yok.fermi.core.parser;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * SCF ログ（case.scf / case.output2）からフェルミエネルギーを読み取るクラスです。
 *
 * <p>
 * {@code :FER  : F E R M I - ENERGY(TETRAH.M.)=   0.4931865487} の形式の行を探し、最後に現れた値（収束値）を eV
 * に換算して返します。
 * </p>
 */
@Slf4j
public final class FermiEnergyParser {

    /**
     * フェルミエネルギー行です。
     */
    private static final Pattern FER =
            Pattern.compile(":FER\\s*:\\s*F\\s*E\\s*R\\s*M\\s*I.*?=\\s*([-+]?[\\d.]+(?:[Ee][-+]?\\d+)?)",
                    Pattern.CASE_INSENSITIVE);

    /**
     * フェルミエネルギー（eV）を読み取ります。
     *
     * <p>
     * タグが見つからない場合はエラーにせず 0.0 を返します。
     * </p>
     *
     * @param content SCF ログの内容です（null は空扱い）
     * @return フェルミエネルギー（eV）です
     */
    public double parse(String content) {
        Double last = null;
        int found = 0;
        for (String line : TextLines.split(content)) {
            Matcher m = FER.matcher(line);
            if (m.find()) {
                OptionalDouble v = TextLines.parseDouble(m.group(1));
                if (v.isPresent()) {
                    last = v.getAsDouble();
                    found++;
                }
            }
        }
        if (last == null) {
            log.warn(":FER 行が見つからないため、フェルミエネルギーを 0.0 eV とします");
            return 0.0;
        }
        log.debug(":FER 行を {} 件検出しました。最後の値 {} Ry を採用します", found, last);
        return EnergyUnits.rydbergToEv(last);
    }
}
