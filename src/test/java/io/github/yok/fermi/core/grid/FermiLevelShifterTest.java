package io.github.yok.fermi.core.grid;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.yok.fermi.core.model.EnergyGrid;
import org.junit.jupiter.api.Test;

class FermiLevelShifterTest {

    private final FermiLevelShifter shifter = new FermiLevelShifter();

    @Test
    void subtractsFermiEnergyAndResetsIt() {
        double[][] data = {{1.0, 2.0}, {-1.0, 3.5}};
        EnergyGrid grid = new EnergyGrid(2, 1, 1, data, 1.5);

        EnergyGrid shifted = shifter.shift(grid);

        assertEquals(0.0, shifted.getFermiEnergy(), 0.0);
        assertEquals(-0.5, shifted.valueAt(0, 0), 1e-15);
        assertEquals(0.5, shifted.valueAt(0, 1), 1e-15);
        assertEquals(2.0, shifted.valueAt(1, 1), 1e-15);
        // 元の格子は変更しない
        assertEquals(1.0, grid.valueAt(0, 0), 0.0);
    }

    @Test
    void shiftingTwiceIsNotGuarded() {
        EnergyGrid grid = new EnergyGrid(1, 1, 1, new double[][] {{4.0}}, 1.0);

        EnergyGrid twice = shifter.shift(shifter.shift(grid));

        // 2 回目は E_F = 0 のため値は変わらない
        assertEquals(3.0, twice.valueAt(0, 0), 0.0);
    }
}
