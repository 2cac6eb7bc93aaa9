package dhcore.engine;

import static org.junit.jupiter.api.Assertions.*;

import dhcore.SeriesFixtures;
import dhcore.model.AggregateRow;
import dhcore.model.Season;
import dhcore.model.SiteMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

class AggregatorTest {

    // границы [-100, 0, 5, 10, 100]: 4 бина
    private final BinScheme scheme = Binner.build(0.0, 10.0, 5.0);

    private List<AggregateRow> aggregate(double[] temps, double[] degreeHours, SiteMetadata site) {
        DerivedSeries s = new DerivedSeries(SeriesFixtures.series(temps));
        System.arraycopy(degreeHours, 0, s.degreeHour, 0, s.size);
        for (int i = 0; i < s.size; i++) {
            s.season[i] = SeasonClassifier.classify(s.month[i], s.day[i]);
        }
        System.arraycopy(Binner.assign(scheme, s.temperature), 0, s.binIndex, 0, s.size);
        return Aggregator.aggregate(s, scheme, site);
    }

    @Test
    void groupsByHourAndBin() {
        double[] temps = SeriesFixtures.constant(8760, Double.NaN);
        double[] dh = new double[8760];
        temps[0] = 7.0;        // 1 января, 00 ч
        dh[0] = 0.5;
        temps[24] = 9.0;       // 2 января, 00 ч, без градусо-часов
        temps[24 * 180] = 6.0; // 30 июня, 00 ч
        dh[24 * 180] = 0.25;

        List<AggregateRow> rows = aggregate(temps, dh, SiteMetadata.named("Toronto", "ON"));

        assertEquals(24 * 4, rows.size());
        AggregateRow r = rows.get(2);
        assertEquals(0, r.hourOfDay);
        assertEquals("(5.0, 10.0]", r.bin.label());
        assertEquals(0.75, r.sumDegreeHour, 1e-12);
        assertEquals(22.0 / 3, r.meanTemperature, 1e-12);
        assertEquals(2, r.countActiveHours);
        assertEquals(1, r.countWinter);
        assertEquals(1, r.countSummer);
        assertEquals(0, r.countSpring);
        assertEquals(0, r.countFall);
        assertEquals(1, r.countFor(Season.SUMMER));
        assertEquals("Toronto", r.city);
        assertEquals("ON", r.stateProvince);
    }

    @Test
    void emptyGroupsReportZeros() {
        List<AggregateRow> rows = aggregate(SeriesFixtures.constant(8760, Double.NaN), new double[8760], null);

        for (AggregateRow r : rows) {
            assertEquals(0.0, r.sumDegreeHour);
            assertEquals(0.0, r.meanTemperature);
            assertEquals(0, r.countActiveHours);
            assertEquals("", r.city);
        }
    }

    @Test
    void rowsOrderedByHourThenBin() {
        List<AggregateRow> rows = aggregate(SeriesFixtures.constant(8760, 3.0), new double[8760], null);

        for (int k = 0; k < rows.size(); k++) {
            assertEquals(k / 4, rows.get(k).hourOfDay);
            assertEquals(k % 4, rows.get(k).bin.getIndex());
        }
        // есть часы, но нет активных: средняя всё равно считается
        AggregateRow r = rows.get(4 * 13 + 1);
        assertEquals(3.0, r.meanTemperature, 1e-12);
        assertEquals(0, r.countActiveHours);
    }
}
