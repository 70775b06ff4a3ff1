package io.github.yok.fermi.core.exception;

/**
 * 入力データからフェルミ面を再構成できない場合に発生する例外の基底クラスです。
 *
 * <p>
 * 呼び出し側が原因ごとに診断メッセージを出し分けられるよう、原因別のサブクラスで送出します。
 * </p>
 */
public abstract class FermiDataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    protected FermiDataException(String message) {
        super(message);
    }

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    protected FermiDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
