package io.github.yok.fermi.core.parser;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.fermi.core.exception.MissingSectionException;
import io.github.yok.fermi.core.model.SymmetryOperation;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class StructParserTest {

    private final StructParser parser = new StructParser();

    @Test
    void readsLatticeAndOperations() {
        String struct = String.join("\n",
                "LaSb",
                "F   LATTICE,NONEQUIV.ATOMS:  2 225_Fm-3m",
                "MODE OF CALC=RELA unit=bohr",
                " 11.600000 11.600000 11.600000 90.000000 90.000000 90.000000",
                "ATOM   1: X=0.00000000 Y=0.00000000 Z=0.00000000",
                "   2      NUMBER OF SYMMETRY OPERATIONS",
                " 1 0 0 0.00000000",
                " 0 1 0 0.00000000",
                " 0 0 1 0.00000000",
                "       1",
                "-1 0 0-0.50000000",
                " 0-1 0 0.00000000",
                " 0 0-1 0.25000000",
                "       2");

        StructParser.StructData data = parser.parse(struct);

        assertEquals(2, data.getSymmetryOperations().size());
        assertEquals(SymmetryOperation.IDENTITY, data.getSymmetryOperations().get(0));
        SymmetryOperation inversion = data.getSymmetryOperations().get(1);
        assertEquals(-1, inversion.rotation(0, 0));
        assertEquals(-1, inversion.rotation(1, 1));
        assertEquals(-1, inversion.rotation(2, 2));
        assertEquals(-0.5, inversion.translation(0), 1e-12);
        assertEquals(0.25, inversion.translation(2), 1e-12);
        assertEquals(11.6, data.getLatticeParameters().getA(), 1e-12);
    }

    @Test
    void rotationRowsAcceptSpacedAndConcatenatedForms() {
        Optional<StructParser.RotationRow> spaced = StructParser.parseRotationRow(" 0 -1 0");
        Optional<StructParser.RotationRow> concatenated =
                StructParser.parseRotationRow(" 0-1 0");
        Optional<StructParser.RotationRow> fixedWidth =
                StructParser.parseRotationRow("-1 0 0-0.50000000");

        assertArrayEquals(new int[] {0, -1, 0}, spaced.get().getRotation());
        assertArrayEquals(new int[] {0, -1, 0}, concatenated.get().getRotation());
        assertArrayEquals(new int[] {-1, 0, 0}, fixedWidth.get().getRotation());
        assertEquals(-0.5, fixedWidth.get().getTranslation(), 1e-12);
        assertTrue(StructParser.parseRotationRow("ATOM   1: X=0.0").isEmpty());
    }

    @Test
    void latticeAnglesAreConvertedToRadians() {
        StructParser.StructData data = parser.parse(String.join("\n", "a", "b", "c",
                "  6.000000  7.000000  8.000000 90.000000 90.000000 60.000000",
                "   0      NUMBER OF SYMMETRY OPERATIONS"));

        assertEquals(Math.PI / 2, data.getLatticeParameters().getAlpha(), 1e-12);
        assertEquals(Math.PI / 3, data.getLatticeParameters().getGamma(), 1e-12);
        assertTrue(data.getSymmetryOperations().isEmpty());
    }

    @Test
    void missingSymmetryHeaderIsFatal() {
        MissingSectionException e = assertThrows(MissingSectionException.class,
                () -> parser.parse("title\nline\nline\n 1 1 1 90 90 90\n"));

        assertEquals(StructParser.SYMMETRY_HEADER, e.getSection());
    }

    @Test
    void unreadableOperationCountIsFatal() {
        String struct = String.join("\n", "t", "l", "m", " 1 1 1 90 90 90",
                "   99999999999      NUMBER OF SYMMETRY OPERATIONS");

        MissingSectionException e =
                assertThrows(MissingSectionException.class, () -> parser.parse(struct));
        assertEquals(StructParser.SYMMETRY_HEADER, e.getSection());
    }

    @Test
    void hugeOperationCountReadsOnlyPresentLines() {
        String struct = String.join("\n", "t", "l", "m", " 1 1 1 90 90 90",
                "   2000000000      NUMBER OF SYMMETRY OPERATIONS",
                " 1 0 0 0.00000000",
                " 0 1 0 0.00000000",
                " 0 0 1 0.00000000",
                "       1");

        assertEquals(1, parser.parse(struct).getSymmetryOperations().size());
    }

    @Test
    void truncatedOperationListKeepsCompleteOperations() {
        String struct = String.join("\n", "t", "l", "m", " 1 1 1 90 90 90",
                "   2      NUMBER OF SYMMETRY OPERATIONS",
                " 1 0 0 0.00000000",
                " 0 1 0 0.00000000",
                " 0 0 1 0.00000000",
                "       1",
                "-1 0 0 0.00000000");

        assertEquals(1, parser.parse(struct).getSymmetryOperations().size());
    }
}
