package io.github.yok.fermi.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.fermi.core.exception.UnreadableInputException;
import io.github.yok.fermi.core.parser.Wien2kFileType;
import io.github.yok.fermi.core.pipeline.GenericInputs;
import io.github.yok.fermi.core.pipeline.PrecomputedInputs;
import io.github.yok.fermi.core.pipeline.Wien2kFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InputFileLoaderTest {

    @TempDir
    Path dir;

    static void writeGeneric(Path dir, String name, String energyExtension) throws IOException {
        GenericInputs in = Wien2kFixtures.cubicInputs();
        Files.writeString(dir.resolve(name + ".klist"), in.getKlist(), StandardCharsets.UTF_8);
        Files.writeString(dir.resolve(name + energyExtension), in.getEnergy(),
                StandardCharsets.UTF_8);
        Files.writeString(dir.resolve(name + ".scf"), in.getScf(), StandardCharsets.UTF_8);
        Files.writeString(dir.resolve(name + ".struct"), in.getStruct(), StandardCharsets.UTF_8);
    }

    static void writePrecomputed(Path dir, String name) throws IOException {
        PrecomputedInputs in = Wien2kFixtures.precomputedInputs();
        Files.writeString(dir.resolve(name + ".output1"), in.getOutput1(),
                StandardCharsets.UTF_8);
        Files.writeString(dir.resolve(name + ".output2"), in.getOutput2(),
                StandardCharsets.UTF_8);
        Files.writeString(dir.resolve(name + ".outputkgen"), in.getOutputkgen(),
                StandardCharsets.UTF_8);
    }

    @Test
    void loadsGenericFilesByCaseName() throws IOException {
        writeGeneric(dir, "LaSb", ".energy");

        GenericInputs in = new InputFileLoader(dir.toString()).loadGeneric("LaSb", false);

        assertEquals("LaSb", in.getCaseName());
        assertFalse(in.isSpinOrbit());
        assertEquals(Wien2kFixtures.cubicInputs().getKlist(), in.getKlist());
    }

    @Test
    void infersCaseNameAndSpinOrbitFile() throws IOException {
        writeGeneric(dir, "Bi2Se3", ".energyso");

        GenericInputs in = new InputFileLoader(dir.toString()).loadGeneric("", false);

        assertEquals("Bi2Se3", in.getCaseName());
        assertTrue(in.isSpinOrbit());
    }

    @Test
    void loadsPrecomputedFiles() throws IOException {
        writePrecomputed(dir, "pre");

        PrecomputedInputs in = new InputFileLoader(dir.toString()).loadPrecomputed(null);

        assertEquals("pre", in.getCaseName());
        assertTrue(in.getOutputkgen().contains("DIVISION OF RECIPROCAL LATTICE VECTORS"));
    }

    @Test
    void missingFileIsUnreadable() throws IOException {
        writeGeneric(dir, "LaSb", ".energy");
        Files.delete(dir.resolve("LaSb.struct"));

        UnreadableInputException e = assertThrows(UnreadableInputException.class,
                () -> new InputFileLoader(dir.toString()).loadGeneric("LaSb", false));
        assertTrue(e.getInput().endsWith("LaSb.struct"));
    }

    @Test
    void emptyDirectoryCannotNameTheCase() {
        assertThrows(UnreadableInputException.class,
                () -> new InputFileLoader(dir.toString()).loadPrecomputed(""));
    }

    @Test
    void contentTypesThatLookAlikeAreCompatible() {
        assertTrue(InputFileLoader.isCompatible(Wien2kFileType.ENERGY, Wien2kFileType.ENERGYSO));
        assertTrue(InputFileLoader.isCompatible(Wien2kFileType.OUTPUT2, Wien2kFileType.SCF));
        assertTrue(InputFileLoader.isCompatible(Wien2kFileType.KLIST, Wien2kFileType.UNKNOWN));
        assertFalse(InputFileLoader.isCompatible(Wien2kFileType.STRUCT, Wien2kFileType.SCF));
    }
}
