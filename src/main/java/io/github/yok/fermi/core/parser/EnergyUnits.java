package io.github.yok.fermi.core.parser;

/**
 * エネルギー単位の換算を提供するクラスです。
 */
public final class EnergyUnits {

    /**
     * 1 Ry あたりの eV です。
     */
    public static final double RY_TO_EV = 13.605693122994;

    private EnergyUnits() {}

    /**
     * Ry を eV に換算します。
     *
     * @param rydberg エネルギー（Ry）です
     * @return エネルギー（eV）です
     */
    public static double rydbergToEv(double rydberg) {
        return rydberg * RY_TO_EV;
    }
}
