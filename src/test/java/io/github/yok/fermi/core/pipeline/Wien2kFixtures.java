package io.github.yok.fermi.core.pipeline;

import java.util.Locale;

/**
 * テスト用の小さな Wien2k 入力を組み立てます。
 */
public final class Wien2kFixtures {

    private Wien2kFixtures() {}

    /**
     * div=4 の第 1 象限 27 点。バンド 0 は Γ で 0 Ry、他で 0.2 Ry、バンド 1 は全点 -0.1 Ry です。
     */
    public static GenericInputs cubicInputs() {
        StringBuilder klist = new StringBuilder();
        StringBuilder energy = new StringBuilder();
        int index = 1;
        for (int i = 0; i <= 2; i++) {
            for (int j = 0; j <= 2; j++) {
                for (int k = 0; k <= 2; k++) {
                    klist.append(String.format(Locale.ROOT, "%10d%10d%10d%10d%5d%5.1f", index, i,
                            j, k, 4, 1.0));
                    if (index == 1) {
                        klist.append(" -7.0  1.5     27 k, div: (  4  4  4)");
                    }
                    klist.append('\n');

                    boolean gamma = i == 0 && j == 0 && k == 0;
                    energy.append(String.format(Locale.ROOT, "%19.12E%19.12E%19.12E%10d%6d%6d%5.1f%n",
                            i / 4.0, j / 4.0, k / 4.0, index, 50, 2, 1.0));
                    energy.append(String.format(Locale.ROOT, "%12d%19.12f%n", 1, gamma ? 0.0 : 0.2));
                    energy.append(String.format(Locale.ROOT, "%12d%19.12f%n", 2, -0.1));
                    index++;
                }
            }
        }
        klist.append("END\n");

        StringBuilder struct = new StringBuilder();
        struct.append("cubic\nP   LATTICE,NONEQUIV.ATOMS:  1\nMODE OF CALC=RELA\n");
        struct.append("  6.283185  6.283185  6.283185 90.000000 90.000000 90.000000\n");
        struct.append("   8      NUMBER OF SYMMETRY OPERATIONS\n");
        int op = 1;
        for (int sx = 1; sx >= -1; sx -= 2) {
            for (int sy = 1; sy >= -1; sy -= 2) {
                for (int sz = 1; sz >= -1; sz -= 2) {
                    struct.append(String.format(Locale.ROOT, "%2d%2d%2d%11.8f%n", sx, 0, 0, 0.0));
                    struct.append(String.format(Locale.ROOT, "%2d%2d%2d%11.8f%n", 0, sy, 0, 0.0));
                    struct.append(String.format(Locale.ROOT, "%2d%2d%2d%11.8f%n", 0, 0, sz, 0.0));
                    struct.append(String.format(Locale.ROOT, "%8d%n", op++));
                }
            }
        }
        String scf = ":FER  : F E R M I - ENERGY(TETRAH.M.)=   0.1000000000\n";
        return new GenericInputs(klist.toString(), energy.toString(), scf, struct.toString(),
                "cubic", false);
    }

    public static PrecomputedInputs precomputedInputs() {
        String output1 = String.join("\n",
                "     K=  0.00000  0.00000  0.00000     1",
                "       EIGENVALUES ARE:",
                "   -0.1000000    0.5000000",
                "      EIGENVALUES BELOW THE ENERGY    -9.00000",
                "     K=  0.50000  0.00000  0.00000     2",
                "       EIGENVALUES ARE:",
                "    0.2000000    0.6000000",
                "      EIGENVALUES BELOW THE ENERGY    -9.00000");
        String output2 = ":FER  : F E R M I - ENERGY(TETRAH.M.)=   0.0500000000";
        StringBuilder kgen = new StringBuilder();
        kgen.append("  G1        G2        G3\n");
        kgen.append("   1.0   0.0   0.0\n   0.0   1.0   0.0\n   0.0   0.0   1.0\n");
        kgen.append("  DIVISION OF RECIPROCAL LATTICE VECTORS (INTERNAL):   1   1   1\n");
        kgen.append("  point     coordinates     relation\n");
        int p = 1;
        for (int z = 0; z < 2; z++) {
            for (int y = 0; y < 2; y++) {
                for (int x = 0; x < 2; x++) {
                    kgen.append(String.format(Locale.ROOT, "%6d%4d%4d%4d%6d%n", p, x, y, z,
                            p == 1 ? 1 : 2));
                    p++;
                }
            }
        }
        return new PrecomputedInputs(output1, output2, kgen.toString(), "pre");
    }
}
