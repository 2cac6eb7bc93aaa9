package dhcore.engine;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class BlockAveragerTest {

    private static double[] ramp(int n) {
        double[] v = new double[n];
        for (int i = 0; i < n; i++) v[i] = i;
        return v;
    }

    @Test
    void fixedBlocksShareOneValue() {
        double[] values = ramp(168);

        double[] daily = BlockAverager.dailyMeans(values);
        double[] weekly = BlockAverager.weeklyMeans(values);

        for (int i = 0; i < 24; i++) {
            assertEquals(11.5, daily[i]);
        }
        assertEquals(35.5, daily[24]);
        for (int i = 0; i < 168; i++) {
            assertEquals(83.5, weekly[i]);
        }
    }

    @Test
    void lastBlockMayBeShorter() {
        double[] values = ramp(30);

        double[] daily = BlockAverager.dailyMeans(values);

        assertEquals(11.5, daily[23]);
        for (int i = 24; i < 30; i++) {
            assertEquals(26.5, daily[i]);
        }
        assertEquals(2, BlockAverager.perBlockMeans(values, 24).length);
        assertEquals(53, BlockAverager.perBlockMeans(new double[8760], 168).length);
    }

    @Test
    void missingValuesAreLeftOutOfTheMean() {
        double[] values = {Double.NaN, 2.0, 4.0, Double.NaN, Double.NaN, Double.NaN};

        double[] means = BlockAverager.blockMeans(values, 3);

        assertEquals(3.0, means[0]);
        assertEquals(3.0, means[2]);
        assertTrue(Double.isNaN(means[3]));
        assertTrue(Double.isNaN(means[5]));
    }

    @Test
    void rejectsNonPositiveBlock() {
        assertThrows(IllegalArgumentException.class, () -> BlockAverager.perBlockMeans(new double[3], 0));
    }
}
