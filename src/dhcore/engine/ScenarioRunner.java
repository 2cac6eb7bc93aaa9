package dhcore.engine;

import dhcore.config.ScenarioConfig;
import dhcore.engine.gate.GateEvaluator;
import dhcore.engine.gate.GateEvaluators;
import dhcore.error.InputShapeException;
import dhcore.error.ScenarioConfigException;
import dhcore.model.SiteMetadata;
import dhcore.model.TemperatureSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Прогон одного сценария для одной площадки.
 * <p>
 * ВАЖНО:
 * - стадии идут строго последовательно: блочные средние и CDD требуют весь ряд;
 * - на каждый вызов строится свой DerivedSeries, общего изменяемого состояния нет;
 * - результат либо полный, либо исключение (InputShapeException / ScenarioConfigException).
 */
public final class ScenarioRunner {

    public ScenarioResult run(TemperatureSeries series, SiteMetadata site, ScenarioConfig cfg) {
        if (series == null) {
            throw new InputShapeException("Ряд не задан");
        }
        if (cfg == null) {
            throw new ScenarioConfigException("Сценарий не задан");
        }

        DerivedSeries s = new DerivedSeries(series);
        List<DataQualityWarning> warnings = new ArrayList<>();

        // 1) блочные средние
        double[] daily = BlockAverager.dailyMeans(s.temperature);
        double[] weekly = BlockAverager.weeklyMeans(s.temperature);
        System.arraycopy(daily, 0, s.dailyMean, 0, s.size);
        System.arraycopy(weekly, 0, s.weeklyMean, 0, s.size);

        // 2) градусо-часы по сырой температуре
        for (int i = 0; i < s.size; i++) {
            double t = s.temperature[i];
            if (Double.isNaN(t)) {
                warnings.add(new DataQualityWarning(i, s.month[i], s.day[i], s.hour[i],
                        "нет температуры: 0 градусо-часов, час исключён из средних и бинов"));
            }
            s.degreeHour[i] = DegreeHourCalculator.degreeHour(cfg.getDegreeType(), cfg.getDailyThreshold(), t);
        }

        // 3) фильтр сценария
        GateEvaluator gate = GateEvaluators.forConfig(cfg);
        gate.apply(s);

        // 4) сезоны
        for (int i = 0; i < s.size; i++) {
            s.season[i] = SeasonClassifier.classify(s.month[i], s.day[i]);
        }

        // 5) бины
        BinScheme scheme = Binner.build(cfg);
        int[] bins = Binner.assign(scheme, s.temperature);
        System.arraycopy(bins, 0, s.binIndex, 0, s.size);

        // 6) агрегация
        return new ScenarioResult(cfg.getName(), site, Aggregator.aggregate(s, scheme, site), warnings);
    }
}
