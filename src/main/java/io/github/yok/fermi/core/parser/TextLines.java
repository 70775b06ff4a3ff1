package io.github.yok.fermi.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * 行分割と数値トークンの読み取りをまとめたユーティリティです。
 */
final class TextLines {

    private TextLines() {}

    /**
     * テキストを行に分割します（CRLF/LF 両対応）。
     *
     * @param content テキストです（null は空扱い）
     * @return 行のリストです
     */
    static List<String> split(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        return List.of(content.split("\\r?\\n", -1));
    }

    /**
     * 空白区切りのトークンに分割します。
     *
     * @param line 行です
     * @return トークン配列です（空行は長さ 0）
     */
    static String[] tokens(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return new String[0];
        }
        return trimmed.split("\\s+");
    }

    /**
     * トークンを整数として読みます。
     *
     * @param token トークンです
     * @return 整数です。読めない場合は空です
     */
    static OptionalInt parseInt(String token) {
        try {
            return OptionalInt.of(Integer.parseInt(token));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * トークンを実数として読みます（Fortran の D 指数も受け付けます）。
     *
     * @param token トークンです
     * @return 実数です。読めない、または有限でない場合は空です
     */
    static OptionalDouble parseDouble(String token) {
        try {
            double v = Double.parseDouble(token.replace('D', 'E').replace('d', 'e'));
            return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * 行に含まれる整数トークンを先頭から順に集めます（整数として読めないトークンは無視します）。
     *
     * @param line 行です
     * @return 整数のリストです
     */
    static List<Integer> integers(String line) {
        List<Integer> out = new ArrayList<>();
        for (String token : tokens(line)) {
            OptionalInt v = parseInt(token);
            if (v.isPresent()) {
                out.add(v.getAsInt());
            }
        }
        return out;
    }

    /**
     * 行に含まれる実数トークンを先頭から順に集めます（読めないトークンは無視します）。
     *
     * @param line 行です
     * @return 実数のリストです
     */
    static List<Double> doubles(String line) {
        List<Double> out = new ArrayList<>();
        for (String token : tokens(line)) {
            OptionalDouble v = parseDouble(token);
            if (v.isPresent()) {
                out.add(v.getAsDouble());
            }
        }
        return out;
    }
}
