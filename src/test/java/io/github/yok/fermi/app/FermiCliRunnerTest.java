package io.github.yok.fermi.app;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.fermi.core.exception.UnreadableInputException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FermiCliRunnerTest {

    @TempDir
    Path dir;

    private static FermiCliRunner runner(FermiProperties p) {
        FermiSurfaceConfiguration c = new FermiSurfaceConfiguration(p);
        return new FermiCliRunner(p, c.inputFileLoader(),
                c.fermiSurfacePipeline(c.genericFermiDataReader(), c.fermiEnergyParser(),
                        c.symmetryExpander(), c.isosurfaceExtractor()),
                c.resultWriter());
    }

    private FermiProperties properties(FermiProperties.Input.Variant variant) {
        FermiProperties p = new FermiProperties();
        p.getInput().setVariant(variant);
        p.getInput().setDir(dir.resolve("in").toString());
        p.getOutput().setDir(dir.resolve("out").toString());
        p.getGrid().setSize(8);
        return p;
    }

    @Test
    void genericRunWritesSurfacesOfDefaultBands() throws Exception {
        Files.createDirectories(dir.resolve("in"));
        InputFileLoaderTest.writeGeneric(dir.resolve("in"), "cubic", ".energy");

        runner(properties(FermiProperties.Input.Variant.GENERIC)).run();

        assertTrue(Files.exists(dir.resolve("out").resolve("fermi_summary_cubic.csv")));
        assertTrue(Files.exists(dir.resolve("out").resolve("fermi_vertices_band=00_cubic.csv")));
        assertTrue(
                Files.exists(dir.resolve("out").resolve("fermi_triangles_band=00_cubic.csv")));
    }

    @Test
    void precomputedRunHonoursEnabledBands() throws Exception {
        Files.createDirectories(dir.resolve("in"));
        InputFileLoaderTest.writePrecomputed(dir.resolve("in"), "pre");
        FermiProperties p = properties(FermiProperties.Input.Variant.PRECOMPUTED);
        p.getBands().getEnabled().add(1);

        runner(p).run();

        assertTrue(Files.exists(dir.resolve("out").resolve("fermi_summary_pre.csv")));
        // バンド 1 はフェルミ準位と交差しないため面を出力しない
        assertTrue(
                Files.notExists(dir.resolve("out").resolve("fermi_vertices_band=01_pre.csv")));
    }

    @Test
    void inputErrorsPropagateFromTheBackgroundTask() {
        FermiProperties p = properties(FermiProperties.Input.Variant.GENERIC);
        p.getInput().setCaseName("missing");

        assertThrows(UnreadableInputException.class, () -> runner(p).run());
    }
}
