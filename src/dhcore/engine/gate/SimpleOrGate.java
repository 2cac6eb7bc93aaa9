package dhcore.engine.gate;

import dhcore.config.DegreeType;
import dhcore.config.ScenarioConfig;
import dhcore.engine.DerivedSeries;

/**
 * Почасовой фильтр по суточной (и, при включении, недельной) средней.
 * <p>
 * Охлаждение: условие выполнено, если средняя выше порога; отопление - если ниже.
 * При включённой неделе час обнуляется только тогда, когда НЕ прошло ни одно
 * из двух условий (оставить = суточное ИЛИ недельное).
 */
public final class SimpleOrGate implements GateEvaluator {

    private final DegreeType degreeType;
    private final double dailyThreshold;
    private final double weeklyThreshold;
    private final boolean weeklyEnabled;

    public SimpleOrGate(ScenarioConfig cfg) {
        this(cfg.getDegreeType(), cfg.getDailyThreshold(), cfg.getWeeklyThreshold(), cfg.isWeeklyGateEnabled());
    }

    public SimpleOrGate(DegreeType degreeType,
                        double dailyThreshold,
                        double weeklyThreshold,
                        boolean weeklyEnabled) {
        this.degreeType = degreeType;
        this.dailyThreshold = dailyThreshold;
        this.weeklyThreshold = weeklyThreshold;
        this.weeklyEnabled = weeklyEnabled;
    }

    @Override
    public boolean[] evaluate(DerivedSeries series) {
        boolean[] keep = new boolean[series.size];
        for (int i = 0; i < series.size; i++) {
            keep[i] = keep(series.dailyMean[i], series.weeklyMean[i]);
        }
        return keep;
    }

    /**
     * Решение для одного часа по его суточной и недельной средним.
     */
    public boolean keep(double dailyMean, double weeklyMean) {
        boolean dailyOk = passes(dailyMean, dailyThreshold);
        if (!weeklyEnabled) {
            return dailyOk;
        }
        return dailyOk || passes(weeklyMean, weeklyThreshold);
    }

    // NaN не проходит ни одно сравнение
    private boolean passes(double mean, double threshold) {
        return (degreeType == DegreeType.COOLING) ? mean > threshold : mean < threshold;
    }
}
