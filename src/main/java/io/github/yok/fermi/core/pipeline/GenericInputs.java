package io.github.yok.fermi.core.pipeline;

import lombok.Value;

/**
 * 汎用形式（klist / energy / scf / struct）の入力内容を保持するクラスです。
 */
@Value
public class GenericInputs {

    /**
     * case.klist の内容です。
     */
    String klist;

    /**
     * case.energy または case.energyso の内容です。
     */
    String energy;

    /**
     * case.scf の内容です。
     */
    String scf;

    /**
     * case.struct の内容です。
     */
    String struct;

    /**
     * ケース名です。
     */
    String caseName;

    /**
     * energy がスピン軌道形式（.energyso）かどうかです。
     */
    boolean spinOrbit;
}
