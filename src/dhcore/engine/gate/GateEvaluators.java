package dhcore.engine.gate;

import dhcore.config.ScenarioConfig;

/**
 * Выбор реализации фильтра по типу, выведенному из конфигурации сценария.
 */
public final class GateEvaluators {

    private GateEvaluators() {}

    public static GateEvaluator forConfig(ScenarioConfig cfg) {
        return switch (cfg.getGateType()) {
            case DAILY, DAILY_OR_WEEKLY -> new SimpleOrGate(cfg);
            case DAILY_OR_CDD_WEEK -> new CddOrGate(cfg);
        };
    }
}
