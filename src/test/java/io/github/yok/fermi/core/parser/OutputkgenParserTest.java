package io.github.yok.fermi.core.parser;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.fermi.core.exception.MissingSectionException;
import io.github.yok.fermi.core.model.KMeshGeneration;
import org.junit.jupiter.api.Test;

class OutputkgenParserTest {

    private final OutputkgenParser parser = new OutputkgenParser();

    static String outputkgen(boolean withRows) {
        StringBuilder sb = new StringBuilder();
        sb.append("  G1        G2        G3\n");
        sb.append("   1.0000000   0.0000000   0.0000000\n");
        sb.append("   0.0000000   2.0000000   0.0000000\n");
        sb.append("   0.5000000   0.0000000   3.0000000\n");
        sb.append("  DIVISION OF RECIPROCAL LATTICE VECTORS (INTERNAL):   1   1   1\n");
        sb.append("  point     coordinates     relation\n");
        if (withRows) {
            int p = 1;
            for (int z = 0; z < 2; z++) {
                for (int y = 0; y < 2; y++) {
                    for (int x = 0; x < 2; x++) {
                        sb.append(String.format("%6d%4d%4d%4d%6d%n", p, x, y, z, p == 1 ? 1 : 2));
                        p++;
                    }
                }
            }
        }
        return sb.toString();
    }

    @Test
    void readsDivisionVectorsAndRelationRows() {
        KMeshGeneration mesh = parser.parse(outputkgen(true));

        assertEquals(2, mesh.getNx());
        assertEquals(2, mesh.getNy());
        assertEquals(2, mesh.getNz());
        assertEquals(8, mesh.getEntries().size());
        assertEquals(3, mesh.getReciprocalVectors().size());
        assertArrayEquals(new double[] {0.5, 0.0, 3.0}, mesh.getReciprocalVectors().get(2),
                1e-12);

        KMeshGeneration.MeshEntry last = mesh.getEntries().get(7);
        assertEquals(8, last.getPointIndex());
        assertEquals(1, last.getX());
        assertEquals(1, last.getY());
        assertEquals(1, last.getZ());
        assertEquals(2, last.getRelation());
    }

    @Test
    void missingDivisionHeaderIsFatal() {
        String content = outputkgen(true).replace(OutputkgenParser.DIVISION_HEADER, "DIVISION");

        MissingSectionException e =
                assertThrows(MissingSectionException.class, () -> parser.parse(content));
        assertEquals(OutputkgenParser.DIVISION_HEADER, e.getSection());
    }

    @Test
    void insufficientRelationRowsAreFatal() {
        MissingSectionException e = assertThrows(MissingSectionException.class,
                () -> parser.parse(outputkgen(false) + "     1   0   0   0     1\n"));

        assertEquals(OutputkgenParser.RELATION_ROWS, e.getSection());
    }

    @Test
    void oversizedDivisionIsReportedAsMissingRows() {
        String content = outputkgen(true).replace("(INTERNAL):   1   1   1",
                "(INTERNAL): 1999 1999 1999");

        MissingSectionException e =
                assertThrows(MissingSectionException.class, () -> parser.parse(content));
        assertEquals(OutputkgenParser.RELATION_ROWS, e.getSection());
    }

    @Test
    void missingVectorBlockYieldsNoVectors() {
        String content = outputkgen(true).replace("G1        G2        G3", "vectors");

        assertTrue(parser.parse(content).getReciprocalVectors().isEmpty());
    }
}
