package dhcore.engine;

import static org.junit.jupiter.api.Assertions.*;

import dhcore.model.TemperatureBin;
import org.junit.jupiter.api.Test;

class BinnerTest {

    @Test
    void heatingRangeBoundaries() {
        BinScheme s = Binner.build(-29.2, 12.8, 2.8);
        double[] b = s.boundaries();

        assertEquals(18, b.length);
        assertEquals(-100.0, b[0]);
        assertEquals(-29.2, b[1]);
        assertEquals(-26.4, b[2]);
        assertEquals(10.0, b[15]);
        assertEquals(12.8, b[16]);
        assertEquals(100.0, b[17]);
        assertEquals(17, s.binCount());
    }

    @Test
    void outOfRangeTemperaturesLandInOverflowBins() {
        BinScheme s = Binner.build(-29.2, 12.8, 2.8);

        TemperatureBin low = s.bin(s.indexOf(-150.0));
        assertEquals(0, low.getIndex());
        assertEquals(-100.0, low.getLower());
        assertEquals(-29.2, low.getUpper());
        assertTrue(low.isOverflow());

        assertEquals(16, s.indexOf(150.0));
        assertEquals(16, s.indexOf(12.81));
        assertTrue(s.bin(16).isOverflow());
        assertEquals("(12.8, 100.0]", s.bin(16).label());
    }

    @Test
    void intervalsAreClosedOnTheRight() {
        BinScheme s = Binner.build(-29.2, 12.8, 2.8);

        assertEquals(0, s.indexOf(-29.2));
        assertEquals(1, s.indexOf(-29.19));
        assertEquals(1, s.indexOf(-26.4));
        assertEquals(15, s.indexOf(12.8));
        assertEquals("(-29.2, -26.4]", s.bin(1).label());
        assertFalse(s.bin(1).isOverflow());
    }

    @Test
    void hotRange() {
        BinScheme s = Binner.build(23.6, 43.2, 2.8);

        assertEquals(9, s.binCount());
        assertEquals(3, s.indexOf(30.0));
        assertEquals("(29.2, 32.0]", s.bin(3).label());
        assertEquals(0, s.indexOf(-5.0));
    }

    @Test
    void widthWiderThanRangeKeepsOnlyLowerBound() {
        BinScheme s = Binner.build(0.0, 1.0, 5.0);

        assertArrayEquals(new double[]{-100.0, 0.0, 100.0}, s.boundaries());
        assertEquals(0, s.indexOf(0.0));
        assertEquals(1, s.indexOf(0.5));
    }

    @Test
    void missingTemperatureHasNoBin() {
        assertEquals(-1, Binner.build(-29.2, 12.8, 2.8).indexOf(Double.NaN));
    }
}
