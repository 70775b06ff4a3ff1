package io.github.yok.fermi.core.pipeline;

import lombok.Value;

/**
 * 最適化形式（output1 / output2 / outputkgen）の入力内容を保持するクラスです。
 */
@Value
public class PrecomputedInputs {

    /**
     * case.output1 の内容です。
     */
    String output1;

    /**
     * case.output2 の内容です。
     */
    String output2;

    /**
     * case.outputkgen の内容です。
     */
    String outputkgen;

    /**
     * ケース名です。
     */
    String caseName;
}
