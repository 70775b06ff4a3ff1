package io.github.yok.fermi.core.model;

import lombok.Value;

/**
 * 格子定数（長さは bohr、角度はラジアン）を保持するクラスです。
 */
@Value
public class LatticeParameters {

    /**
     * 格子定数が読めなかった場合の既定値（単位立方格子）です。
     */
    public static final LatticeParameters UNIT_CUBIC =
            new LatticeParameters(1.0, 1.0, 1.0, Math.PI / 2, Math.PI / 2, Math.PI / 2);

    double a;

    double b;

    double c;

    /**
     * b と c のなす角です。
     */
    double alpha;

    /**
     * a と c のなす角です。
     */
    double beta;

    /**
     * a と b のなす角です。
     */
    double gamma;
}
