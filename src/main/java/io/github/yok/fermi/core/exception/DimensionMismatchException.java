package io.github.yok.fermi.core.exception;

import lombok.Getter;

/**
 * 配列長やメッシュ次元が期待値と一致しない場合に発生する例外です。
 */
@Getter
public class DimensionMismatchException extends FermiDataException {

    private static final long serialVersionUID = 1L;

    /**
     * 期待した要素数です。
     */
    private final int expected;

    /**
     * 実際の要素数です。
     */
    private final int actual;

    /**
     * 例外を生成します。
     *
     * @param what 対象の説明です
     * @param expected 期待した要素数です
     * @param actual 実際の要素数です
     */
    public DimensionMismatchException(String what, int expected, int actual) {
        super("次元が一致しません: " + what + "（期待=" + expected + "、実際=" + actual + "）");
        this.expected = expected;
        this.actual = actual;
    }
}
