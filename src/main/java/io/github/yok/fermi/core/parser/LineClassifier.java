package io.github.yok.fermi.core.parser;

import java.util.List;
import java.util.Optional;

/**
 * 複数の {@link LineMatcher} を固定の優先順で試して行を分類するクラスです。
 *
 * <p>
 * 最初に結果を返した matcher の分類を採用し、どれにも該当しない行は読み飛ばしとします。
 * </p>
 *
 * @param <T> レコードの型です
 */
public final class LineClassifier<T> {

    /**
     * 優先順に並べた matcher です。
     */
    private final List<LineMatcher<T>> matchers;

    /**
     * 分類器を生成します。
     *
     * @param matchers 優先順に並べた matcher です（null 不可）
     * @throws IllegalArgumentException matchers が null の場合に発生します
     */
    public LineClassifier(List<LineMatcher<T>> matchers) {
        if (matchers == null) {
            throw new IllegalArgumentException("matchers は null 不可です");
        }
        this.matchers = List.copyOf(matchers);
    }

    /**
     * 行を分類します。
     *
     * @param line 行です（null は読み飛ばし）
     * @return 分類結果です
     */
    public ParsedLine<T> classify(String line) {
        if (line == null) {
            return ParsedLine.skip();
        }
        for (LineMatcher<T> matcher : matchers) {
            Optional<ParsedLine<T>> result = matcher.match(line);
            if (result.isPresent()) {
                return result.get();
            }
        }
        return ParsedLine.skip();
    }
}
