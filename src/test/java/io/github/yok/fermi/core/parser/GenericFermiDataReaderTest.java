package io.github.yok.fermi.core.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.fermi.core.model.GenericFermiData;
import io.github.yok.fermi.core.model.IrreducibleKPoint;
import java.util.List;
import org.junit.jupiter.api.Test;

class GenericFermiDataReaderTest {

    private final GenericFermiDataReader reader = new GenericFermiDataReader(new KlistParser(),
            new EnergyFileParser(), new FermiEnergyParser(), new StructParser());

    private static final String KLIST = String.join("\n",
            "         1         0         0         0        4  1.0 -7.0  1.5      3 k, div: (  4  4  4)",
            "         2         1         0         0        4  6.0",
            "         3         2         0         0        4  3.0",
            "END");

    private static final String STRUCT = String.join("\n", "title", "P   LATTICE", "MODE",
            "  6.000000  6.000000  6.000000 90.000000 90.000000 90.000000",
            "   1      NUMBER OF SYMMETRY OPERATIONS",
            " 1 0 0 0.00000000",
            " 0 1 0 0.00000000",
            " 0 0 1 0.00000000",
            "       1");

    private static final String SCF = ":FER  : F E R M I - ENERGY(TETRAH.M.)=   0.1000000000";

    @Test
    void joinsKPointsWithEnergiesByOrder() {
        String energy = String.join("\n",
                " 0.0E+00 0.0E+00 0.0E+00         1    50     2  1.0",
                "           1  -0.1",
                "           2   0.3",
                " 2.5E-01 0.0E+00 0.0E+00         2    50     2  6.0",
                "           1   0.0",
                "           2   0.4",
                " 5.0E-01 0.0E+00 0.0E+00         3    50     3  3.0",
                "           1   0.2",
                "           2   0.5",
                "           3   0.9");

        GenericFermiData data = reader.read(KLIST, energy, SCF, STRUCT, "cubic", false);

        assertEquals(3, data.getKPoints().size());
        assertEquals(4, data.getSourceDivision());
        assertEquals(0.1 * EnergyUnits.RY_TO_EV, data.getFermiEnergy(), 1e-12);
        assertEquals(1, data.getSymmetryOperations().size());
        assertEquals("cubic", data.getCaseName());
        // 最小バンド数に揃える
        assertEquals(2, data.getBandCount());
        IrreducibleKPoint last = data.getKPoints().get(2);
        assertEquals(0.5, last.getKx(), 1e-12);
        assertEquals(3, last.getEnergies().size());
    }

    @Test
    void kPointsWithoutEnergiesGetEmptyLists() {
        String energy = String.join("\n",
                " 0.0E+00 0.0E+00 0.0E+00         1    50     1  1.0",
                "           1  -0.1");

        GenericFermiData data = reader.read(KLIST, energy, SCF, STRUCT, "cubic", false);

        assertEquals(3, data.getKPoints().size());
        assertEquals(1, data.getBandCount());
        assertTrue(data.getKPoints().get(1).getEnergies().isEmpty());
        assertTrue(data.getKPoints().get(2).getEnergies().isEmpty());
    }

    @Test
    void minimumBandCountIgnoresEmptyKPoints() {
        List<IrreducibleKPoint> kPoints = List.of(
                new IrreducibleKPoint(0, 0, 0, 1, List.of(1.0, 2.0)),
                new IrreducibleKPoint(0, 0, 0, 1, List.of()),
                new IrreducibleKPoint(0, 0, 0, 1, List.of(1.0, 2.0, 3.0)));

        assertEquals(2, GenericFermiDataReader.minimumBandCount(kPoints));
        assertEquals(0, GenericFermiDataReader.minimumBandCount(List.of()));
    }
}
