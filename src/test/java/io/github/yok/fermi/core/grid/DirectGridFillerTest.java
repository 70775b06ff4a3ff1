package io.github.yok.fermi.core.grid;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.yok.fermi.core.model.BandEnergyTable;
import io.github.yok.fermi.core.model.EnergyGrid;
import io.github.yok.fermi.core.model.KMeshGeneration;
import io.github.yok.fermi.core.model.KMeshGeneration.MeshEntry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DirectGridFillerTest {

    private final DirectGridFiller filler = new DirectGridFiller();

    @Test
    void fillsEveryMeshPointFromItsRepresentative() {
        // 点 1 と 2 が既約、3..8 は 2 を経由して 2 に帰着
        List<MeshEntry> entries = new ArrayList<>();
        int p = 1;
        for (int z = 0; z < 2; z++) {
            for (int y = 0; y < 2; y++) {
                for (int x = 0; x < 2; x++) {
                    entries.add(new MeshEntry(p, x, y, z, p == 1 ? 1 : 2));
                    p++;
                }
            }
        }
        KMeshGeneration mesh = new KMeshGeneration(2, 2, 2, List.of(), entries);
        BandEnergyTable table = new BandEnergyTable(
                List.of(new double[] {-1.0, 5.0}, new double[] {2.0, 6.0}), 2);

        EnergyGrid grid = filler.fill(table, mesh, 0.5);

        assertEquals(2, grid.getBandCount());
        assertEquals(0.5, grid.getFermiEnergy(), 0.0);
        assertEquals(-1.0, grid.valueAt(0, 0, 0, 0), 0.0);
        assertEquals(5.0, grid.valueAt(1, 0, 0, 0), 0.0);
        assertEquals(2.0, grid.valueAt(0, 1, 0, 0), 0.0);
        assertEquals(6.0, grid.valueAt(1, 1, 1, 1), 0.0);
    }

    @Test
    void unresolvedRepresentativesStayZero() {
        List<MeshEntry> entries = List.of(new MeshEntry(1, 0, 0, 0, 1),
                new MeshEntry(2, 1, 0, 0, 2));
        KMeshGeneration mesh = new KMeshGeneration(2, 1, 1, List.of(), entries);
        BandEnergyTable table = new BandEnergyTable(List.of(new double[] {3.0}), 1);

        EnergyGrid grid = filler.fill(table, mesh, 0.0);

        assertEquals(3.0, grid.valueAt(0, 0, 0, 0), 0.0);
        assertEquals(0.0, grid.valueAt(0, 1, 0, 0), 0.0);
    }
}
