package dhcore.engine.gate;

import dhcore.config.DegreeHourConstants;
import dhcore.config.ScenarioConfig;
import dhcore.engine.BlockAverager;
import dhcore.engine.DerivedSeries;

/**
 * Фильтр охлаждения по CDD: решение принимается один раз на сутки
 * и действует на все часы этих суток.
 * <p>
 * CDD_daily[d] = max(tСр[d] - база, 0);
 * CDD_week[d]  = среднее CDD_daily за сутки max(0, d-6)..d (делитель - число имеющихся суток);
 * сутки остаются, если tСр[d] > суточного порога ИЛИ CDD_week[d] > порога CDD.
 * Сутки - те же 24-часовые блоки от индекса 0, что и у суточной средней.
 */
public final class CddOrGate implements GateEvaluator {

    private final double dailyThreshold;
    private final double cddTrigger;
    private final double baseTemperature;

    public CddOrGate(ScenarioConfig cfg) {
        this(cfg.getDailyThreshold(),
                cfg.getCddTrigger(),
                cfg.getCddBaseTemperature() != null
                        ? cfg.getCddBaseTemperature()
                        : DegreeHourConstants.DEFAULT_CDD_BASE_TEMPERATURE);
    }

    public CddOrGate(double dailyThreshold, double cddTrigger, double baseTemperature) {
        this.dailyThreshold = dailyThreshold;
        this.cddTrigger = cddTrigger;
        this.baseTemperature = baseTemperature;
    }

    @Override
    public boolean[] evaluate(DerivedSeries series) {
        int hoursPerDay = DegreeHourConstants.HOURS_PER_DAY;

        double[] dayMeans = BlockAverager.perBlockMeans(series.temperature, hoursPerDay);
        double[] cddDaily = cddDaily(dayMeans, baseTemperature);
        double[] cddWeek = cddWeek(cddDaily);

        boolean[] keep = new boolean[series.size];
        series.cddDaily = new double[series.size];
        series.cddWeek = new double[series.size];

        for (int d = 0; d < dayMeans.length; d++) {
            boolean keepDay = dayMeans[d] > dailyThreshold || cddWeek[d] > cddTrigger;

            int from = d * hoursPerDay;
            int to = Math.min(from + hoursPerDay, series.size);
            for (int i = from; i < to; i++) {
                keep[i] = keepDay;
                series.cddDaily[i] = cddDaily[d];
                series.cddWeek[i] = cddWeek[d];
            }
        }
        return keep;
    }

    /**
     * Градусо-сутки охлаждения по суточным средним; сутки без данных дают 0.
     */
    public static double[] cddDaily(double[] dayMeans, double baseTemperature) {
        double[] out = new double[dayMeans.length];
        for (int d = 0; d < dayMeans.length; d++) {
            double m = dayMeans[d];
            out[d] = Double.isNaN(m) ? 0.0 : Math.max(m - baseTemperature, 0.0);
        }
        return out;
    }

    /**
     * Скользящее назад среднее за 7 суток. Для первых шести суток
     * усредняем только по имеющимся (без дополнения нулями).
     */
    public static double[] cddWeek(double[] cddDaily) {
        int window = DegreeHourConstants.CDD_WEEK_DAYS;
        double[] out = new double[cddDaily.length];
        for (int d = 0; d < cddDaily.length; d++) {
            int from = Math.max(0, d - window + 1);
            // окно суммируется заново на каждые сутки
            double sum = 0.0;
            for (int j = from; j <= d; j++) {
                sum += cddDaily[j];
            }
            out[d] = sum / (d - from + 1);
        }
        return out;
    }
}
