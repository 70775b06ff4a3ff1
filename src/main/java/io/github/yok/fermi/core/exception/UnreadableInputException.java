package io.github.yok.fermi.core.exception;

import lombok.Getter;

/**
 * 入力ファイルが存在しない、または読み込めない場合に発生する例外です。
 */
@Getter
public class UnreadableInputException extends FermiDataException {

    private static final long serialVersionUID = 1L;

    /**
     * 読み込めなかった入力の名前（パスなど）です。
     */
    private final String input;

    /**
     * 例外を生成します。
     *
     * @param input 入力の名前です
     * @param cause 原因です
     */
    public UnreadableInputException(String input, Throwable cause) {
        super("入力を読み込めません: " + input, cause);
        this.input = input;
    }

    /**
     * 例外を生成します。
     *
     * @param input 入力の名前です
     * @param detail 補足情報です
     */
    public UnreadableInputException(String input, String detail) {
        super("入力を読み込めません: " + input + "（" + detail + "）");
        this.input = input;
    }
}
