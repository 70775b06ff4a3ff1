package io.github.yok.fermi.core.parser;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 1 行を分類した結果（レコード／読み飛ばし／セクション境界）を表すクラスです。
 *
 * @param <T> レコードの型です
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ParsedLine<T> {

    /**
     * 分類の種別です。
     */
    public enum Kind {
        RECORD, SKIP, BOUNDARY
    }

    private static final ParsedLine<?> SKIP = new ParsedLine<>(Kind.SKIP, null);

    private static final ParsedLine<?> BOUNDARY = new ParsedLine<>(Kind.BOUNDARY, null);

    /**
     * 種別です。
     */
    private final Kind kind;

    /**
     * レコード値です（RECORD 以外は null）。
     */
    private final T value;

    /**
     * レコードとして分類した結果を返します。
     *
     * @param <T> レコードの型です
     * @param value レコード値です（null 不可）
     * @return 分類結果です
     */
    public static <T> ParsedLine<T> record(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value は null 不可です");
        }
        return new ParsedLine<>(Kind.RECORD, value);
    }

    /**
     * 読み飛ばしとして分類した結果を返します。
     *
     * @param <T> レコードの型です
     * @return 分類結果です
     */
    @SuppressWarnings("unchecked")
    public static <T> ParsedLine<T> skip() {
        return (ParsedLine<T>) SKIP;
    }

    /**
     * セクション境界として分類した結果を返します。
     *
     * @param <T> レコードの型です
     * @return 分類結果です
     */
    @SuppressWarnings("unchecked")
    public static <T> ParsedLine<T> boundary() {
        return (ParsedLine<T>) BOUNDARY;
    }

    public boolean isRecord() {
        return kind == Kind.RECORD;
    }

    public boolean isBoundary() {
        return kind == Kind.BOUNDARY;
    }
}
