package dhcore.model;

import dhcore.config.DegreeHourConstants;
import dhcore.error.InputShapeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Почасовой ряд одной площадки за один год (immutable).
 * Длина строго 8760 или 8784, порядок записей = индекс времени.
 */
public final class TemperatureSeries {

    private final List<HourlyRecord> records;

    private TemperatureSeries(List<HourlyRecord> records) {
        this.records = records;
    }

    public static TemperatureSeries of(List<HourlyRecord> records) {
        if (records == null) {
            throw new InputShapeException("Ряд не задан");
        }
        int n = records.size();
        if (n != DegreeHourConstants.HOURS_PER_YEAR && n != DegreeHourConstants.HOURS_PER_LEAP_YEAR) {
            throw new InputShapeException("Ожидалось " + DegreeHourConstants.HOURS_PER_YEAR
                    + " или " + DegreeHourConstants.HOURS_PER_LEAP_YEAR + " записей, получено " + n);
        }
        List<HourlyRecord> copy = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            HourlyRecord r = records.get(i);
            if (r == null) {
                throw new InputShapeException("Пустая запись в позиции " + i);
            }
            copy.add(r);
        }
        return new TemperatureSeries(Collections.unmodifiableList(copy));
    }

    public int size() {
        return records.size();
    }

    public HourlyRecord get(int timeIndex) {
        return records.get(timeIndex);
    }

    public List<HourlyRecord> records() {
        return records;
    }

    /**
     * Копия температур (NaN для пропусков).
     */
    public double[] temperatures() {
        double[] t = new double[records.size()];
        for (int i = 0; i < t.length; i++) {
            t[i] = records.get(i).getAirTemperature();
        }
        return t;
    }
}
