package io.github.yok.fermi.core.exception;

import lombok.Getter;

/**
 * 構造の復元に必須なセクション（見出し行やデータ行）が見つからない場合に発生する例外です。
 */
@Getter
public class MissingSectionException extends FermiDataException {

    private static final long serialVersionUID = 1L;

    /**
     * 見つからなかったセクション名（見出し文字列など）です。
     */
    private final String section;

    /**
     * 例外を生成します。
     *
     * @param section 見つからなかったセクション名です
     * @param detail 補足情報です
     */
    public MissingSectionException(String section, String detail) {
        super("必須セクションが見つかりません: " + section + "（" + detail + "）");
        this.section = section;
    }
}
