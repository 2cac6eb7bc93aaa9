package dhcore.engine.gate;

import static org.junit.jupiter.api.Assertions.*;

import dhcore.SeriesFixtures;
import dhcore.config.DegreeType;
import dhcore.engine.DegreeHourCalculator;
import dhcore.engine.DerivedSeries;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

class CddOrGateTest {

    private static final double BASE = 19.44;

    @Test
    void dailyDegreeDays() {
        double[] cdd = CddOrGate.cddDaily(new double[]{25.0, 10.0, Double.NaN}, BASE);

        assertEquals(5.56, cdd[0], 1e-9);
        assertEquals(0.0, cdd[1]);
        assertEquals(0.0, cdd[2]);
    }

    @Test
    void weekWindowIsTruncatedAtTheStart() {
        double[] week = CddOrGate.cddWeek(new double[]{5.56, 0.0, 0.0});

        assertEquals(5.56, week[0], 1e-9);
        assertEquals(2.78, week[1], 1e-9);
        assertEquals(1.8533333333, week[2], 1e-9);
    }

    @Test
    void weekWindowSpansSevenDays() {
        double[] week = CddOrGate.cddWeek(new double[]{7.0, 0, 0, 0, 0, 0, 0, 0});

        assertEquals(1.0, week[6], 1e-12);
        assertEquals(0.0, week[7]);
    }

    @Test
    void decisionCoversTheWholeDay() {
        double[] temps = SeriesFixtures.constant(8760, 20.0);
        Arrays.fill(temps, 0, 24, 25.0);

        // сутки 1: CDD_week = (5.56 + 0.56) / 2 = 3.06
        boolean[] loose = new CddOrGate(22.8, 3.0, BASE).evaluate(seriesOf(temps));
        boolean[] strict = new CddOrGate(22.8, 3.5, BASE).evaluate(seriesOf(temps));

        for (int i = 0; i < 24; i++) {
            assertTrue(loose[i]);
            assertTrue(strict[i]);
        }
        for (int i = 24; i < 48; i++) {
            assertTrue(loose[i], "hour " + i);
            assertFalse(strict[i], "hour " + i);
        }
    }

    @Test
    void rejectedDayIsZeroedEvenInHotHours() {
        double[] temps = SeriesFixtures.constant(8760, 10.0);
        Arrays.fill(temps, 0, 12, 30.0);
        Arrays.fill(temps, 12, 24, 10.0);
        DerivedSeries s = seriesOf(temps);
        double[] dh = DegreeHourCalculator.compute(DegreeType.COOLING, 22.8, s.temperature);
        System.arraycopy(dh, 0, s.degreeHour, 0, s.size);

        int zeroed = new CddOrGate(22.8, 3.0, BASE).apply(s);

        assertEquals(12, zeroed);
        for (int i = 0; i < s.size; i++) {
            assertEquals(0.0, s.degreeHour[i]);
        }
        assertEquals(0.56, s.cddDaily[5], 1e-9);
        assertEquals(0.56, s.cddWeek[23], 1e-9);
        assertEquals(0.0, s.cddDaily[24]);
    }

    private static DerivedSeries seriesOf(double[] temps) {
        return new DerivedSeries(SeriesFixtures.series(temps));
    }
}
