package io.github.yok.fermi.core.parser;

import java.util.Optional;

/**
 * 1 行を認識して分類する matcher です。
 *
 * <p>
 * 認識できない行には空を返し、次の matcher に判断を委ねます。
 * </p>
 *
 * @param <T> レコードの型です
 */
@FunctionalInterface
public interface LineMatcher<T> {

    /**
     * 行を分類します。
     *
     * @param line 行です（null 不可）
     * @return 分類結果です。認識できない場合は空です
     */
    Optional<ParsedLine<T>> match(String line);
}
