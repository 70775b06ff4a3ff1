package io.github.yok.fermi.core.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class EnergyFileParserTest {

    private final EnergyFileParser parser = new EnergyFileParser();

    private static final String TWO_KPOINTS = String.join("\n",
            " 0.000000000000E+00 0.000000000000E+00 0.000000000000E+00         1    50     2  1.0",
            "           1  -0.50000000000000",
            "           2   0.25000000000000",
            " 2.500000000000E-01 0.000000000000E+00 0.000000000000E+00         2    48     2  6.0",
            "           1  -0.40000000000000",
            "           2   0.30000000000000");

    @Test
    void convertsRydbergToElectronVolt() {
        List<EnergyFileParser.KPointEnergies> result = parser.parse(TWO_KPOINTS, false);

        assertEquals(2, result.size());
        assertEquals(List.of(-0.5 * EnergyUnits.RY_TO_EV, 0.25 * EnergyUnits.RY_TO_EV),
                result.get(0).getEnergies());
        assertEquals(0.25, result.get(1).getKx(), 1e-12);
        assertEquals(6.0, result.get(1).getWeight(), 1e-12);
        assertEquals(0.3 * EnergyUnits.RY_TO_EV, result.get(1).getEnergies().get(1), 1e-9);
    }

    @Test
    void negativeCoordinatesWithoutSeparatorKeepRecordOrder() {
        String content = String.join("\n",
                " 0.000000000000E+00 0.000000000000E+00 0.000000000000E+00         1    50     1  1.0",
                "           1  -0.10000000000000",
                " 1.000000000000E-01-1.000000000000E-01-2.500000000000E-01         2    50     1  2.0",
                "           1   0.20000000000000",
                " 2.500000000000E-01 0.000000000000E+00 0.000000000000E+00         3    50     1  1.0",
                "           1   0.30000000000000");

        List<EnergyFileParser.KPointEnergies> result = parser.parse(content, false);

        assertEquals(3, result.size());
        assertEquals(0.1, result.get(1).getKx(), 1e-12);
        assertEquals(-0.1, result.get(1).getKy(), 1e-12);
        assertEquals(-0.25, result.get(1).getKz(), 1e-12);
        assertEquals(0.2 * EnergyUnits.RY_TO_EV, result.get(1).getEnergies().get(0), 1e-9);
        assertEquals(0.3 * EnergyUnits.RY_TO_EV, result.get(2).getEnergies().get(0), 1e-9);
    }

    @Test
    void spinOrbitFilesSkipFourHeaderLines() {
        // 先頭 4 行が k 点見出しに見えても読み飛ばす
        String header = String.join("\n",
                " 9.0E+00 9.0E+00 9.0E+00         1    50     1  1.0",
                "           1   9.00000000000000",
                "  0.30000 0.30000",
                "  0.30000 0.30000");

        List<EnergyFileParser.KPointEnergies> result =
                parser.parse(header + "\n" + TWO_KPOINTS, true);

        assertEquals(2, result.size());
        assertEquals(0.0, result.get(0).getKx(), 1e-12);
    }

    @Test
    void truncatedFileKeepsPartialBands() {
        String content = String.join("\n",
                " 0.0E+00 0.0E+00 0.0E+00         1    50     3  1.0",
                "           1  -0.50000000000000");

        List<EnergyFileParser.KPointEnergies> result = parser.parse(content, false);

        assertEquals(1, result.size());
        assertEquals(1, result.get(0).getEnergies().size());
    }

    @Test
    void emptyContentYieldsNoKPoints() {
        assertTrue(parser.parse("", false).isEmpty());
    }
}
