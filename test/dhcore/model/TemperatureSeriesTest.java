package dhcore.model;

import static org.junit.jupiter.api.Assertions.*;

import dhcore.SeriesFixtures;
import dhcore.error.InputShapeException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TemperatureSeriesTest {

    @Test
    void acceptsCommonAndLeapYear() {
        assertEquals(8760, SeriesFixtures.series(SeriesFixtures.constant(8760, 1.0)).size());
        assertEquals(8784, SeriesFixtures.series(SeriesFixtures.constant(8784, 1.0)).size());
    }

    @Test
    void rejectsOtherLengths() {
        assertThrows(InputShapeException.class,
                () -> TemperatureSeries.of(SeriesFixtures.records(SeriesFixtures.constant(8759, 1.0))));
        assertThrows(InputShapeException.class,
                () -> TemperatureSeries.of(SeriesFixtures.records(SeriesFixtures.constant(24, 1.0))));
        assertThrows(InputShapeException.class, () -> TemperatureSeries.of(null));
    }

    @Test
    void rejectsNullRecord() {
        List<HourlyRecord> recs = new ArrayList<>(SeriesFixtures.records(SeriesFixtures.constant(8760, 1.0)));
        recs.set(100, null);
        assertThrows(InputShapeException.class, () -> TemperatureSeries.of(recs));
    }

    @Test
    void isImmutableCopy() {
        List<HourlyRecord> recs = new ArrayList<>(SeriesFixtures.records(SeriesFixtures.constant(8760, 1.0)));
        TemperatureSeries s = TemperatureSeries.of(recs);
        recs.set(0, new HourlyRecord(1, 1, 0, 50.0));

        assertEquals(1.0, s.get(0).getAirTemperature());
        assertThrows(UnsupportedOperationException.class, () -> s.records().remove(0));
    }

    @Test
    void temperaturesAreADetachedCopy() {
        double[] temps = SeriesFixtures.constant(8760, 1.0);
        temps[7] = Double.NaN;
        TemperatureSeries s = SeriesFixtures.series(temps);

        double[] t = s.temperatures();
        assertEquals(8760, t.length);
        assertTrue(Double.isNaN(t[7]));
        t[0] = 99.0;
        assertEquals(1.0, s.temperatures()[0]);
    }

    @Test
    void recordValidatesFields() {
        assertThrows(InputShapeException.class, () -> new HourlyRecord(13, 1, 0, 1.0));
        assertThrows(InputShapeException.class, () -> new HourlyRecord(2, 30, 0, 1.0));
        assertThrows(InputShapeException.class, () -> new HourlyRecord(1, 1, 24, 1.0));
        assertThrows(InputShapeException.class, () -> new HourlyRecord(1, 1, -1, 1.0));
        assertTrue(new HourlyRecord(2, 29, 23, Double.NaN).isTemperatureMissing());
    }
}
