package dhcore.engine;

import dhcore.model.HourlyRecord;
import dhcore.model.Season;
import dhcore.model.TemperatureSeries;

/**
 * Расчётные поля по каждому часу для одной пары (площадка, сценарий).
 * Создаётся заново на каждый прогон и после агрегации выбрасывается;
 * между сценариями не разделяется.
 * <p>
 * Это plain data holder: заполняется стадиями ScenarioRunner по порядку.
 */
public final class DerivedSeries {

    public final int size;

    public final int[] month;
    public final int[] day;
    public final int[] hour;

    /** Сырая температура часа, NaN при пропуске. */
    public final double[] temperature;

    public final double[] degreeHour;
    public final double[] dailyMean;
    public final double[] weeklyMean;

    /** Заполняются только CDD-фильтром, иначе null. */
    public double[] cddDaily;
    public double[] cddWeek;

    public final Season[] season;

    /** Индекс бина в BinScheme, -1 для часа без температуры. */
    public final int[] binIndex;

    public DerivedSeries(TemperatureSeries series) {
        this.size = series.size();
        this.month = new int[size];
        this.day = new int[size];
        this.hour = new int[size];
        this.temperature = series.temperatures();
        for (int i = 0; i < size; i++) {
            HourlyRecord r = series.get(i);
            month[i] = r.getMonth();
            day[i] = r.getDay();
            hour[i] = r.getHour();
        }
        this.degreeHour = new double[size];
        this.dailyMean = new double[size];
        this.weeklyMean = new double[size];
        this.season = new Season[size];
        this.binIndex = new int[size];
    }
}
