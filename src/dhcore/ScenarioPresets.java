package dhcore;

import dhcore.config.DegreeHourConstants;
import dhcore.config.DegreeType;
import dhcore.config.ScenarioConfig;
import dhcore.config.ScenarioConfigBuilder;
import dhcore.error.ScenarioConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Стандартные расчётные сценарии и фабрика CDD-вариантов.
 */
public final class ScenarioPresets {

    private static final double BIN_WIDTH = 2.8;

    private static final Map<String, ScenarioConfig> PRESETS = buildPresets();

    private ScenarioPresets() {}

    private static Map<String, ScenarioConfig> buildPresets() {
        Map<String, ScenarioConfig> m = new LinkedHashMap<>();

        // ----- отопление -----
        put(m, heating("hdh_sc1", 18.3).build());
        put(m, heating("hdh_sc2", 14.9).build());
        put(m, heating("hdh_sc3", 14.9)
                .setWeeklyThreshold(17.1)
                .setWeeklyGateEnabled(true)
                .build());

        // ----- охлаждение -----
        // sc1/sc2 бинуются в "отопительном" диапазоне, sc3 - в диапазоне жары
        put(m, cooling("cdh_sc1", 18.3, -29.2, 12.8).build());
        put(m, cooling("cdh_sc2", 22.8, -29.2, 12.8).build());
        put(m, cooling("cdh_sc3", 22.8, 23.6, 43.2)
                .setWeeklyThreshold(19.5)
                .setWeeklyGateEnabled(true)
                .build());

        return Collections.unmodifiableMap(m);
    }

    private static ScenarioConfigBuilder heating(String name, double dailyThreshold) {
        return new ScenarioConfigBuilder()
                .setName(name)
                .setDegreeType(DegreeType.HEATING)
                .setDailyThreshold(dailyThreshold)
                .setWeeklyThreshold(18.3)   // не используется, пока недельный фильтр выключен
                .setTemperatureRange(-29.2, 12.8)
                .setBinWidth(BIN_WIDTH)
                .setDailyGateEnabled(true)
                .setWeeklyGateEnabled(false);
    }

    private static ScenarioConfigBuilder cooling(String name, double dailyThreshold, double lo, double hi) {
        return new ScenarioConfigBuilder()
                .setName(name)
                .setDegreeType(DegreeType.COOLING)
                .setDailyThreshold(dailyThreshold)
                .setWeeklyThreshold(18.3)
                .setTemperatureRange(lo, hi)
                .setBinWidth(BIN_WIDTH)
                .setDailyGateEnabled(true)
                .setWeeklyGateEnabled(false);
    }

    private static void put(Map<String, ScenarioConfig> m, ScenarioConfig cfg) {
        m.put(cfg.getName(), cfg);
    }

    public static List<ScenarioConfig> all() {
        return new ArrayList<>(PRESETS.values());
    }

    public static List<String> names() {
        return new ArrayList<>(PRESETS.keySet());
    }

    public static ScenarioConfig byName(String name) {
        ScenarioConfig cfg = PRESETS.get(name);
        if (cfg == null) {
            throw new ScenarioConfigException("Неизвестный сценарий: " + name + ", доступны: " + PRESETS.keySet());
        }
        return cfg;
    }

    /**
     * Сценарий охлаждения с CDD-фильтром: сутки остаются, если суточная средняя выше
     * dailyThreshold ИЛИ CDD_week выше cddTrigger.
     */
    public static ScenarioConfig cddVariant(String name,
                                            double dailyThreshold,
                                            double cddTrigger,
                                            double lo,
                                            double hi,
                                            double binWidth) {
        return cddVariant(name, dailyThreshold, cddTrigger,
                DegreeHourConstants.DEFAULT_CDD_BASE_TEMPERATURE, lo, hi, binWidth);
    }

    public static ScenarioConfig cddVariant(String name,
                                            double dailyThreshold,
                                            double cddTrigger,
                                            double cddBaseTemperature,
                                            double lo,
                                            double hi,
                                            double binWidth) {
        return new ScenarioConfigBuilder()
                .setName(name)
                .setDegreeType(DegreeType.COOLING)
                .setDailyThreshold(dailyThreshold)
                .setCddTrigger(cddTrigger)
                .setCddBaseTemperature(cddBaseTemperature)
                .setTemperatureRange(lo, hi)
                .setBinWidth(binWidth)
                .setDailyGateEnabled(true)
                .setWeeklyGateEnabled(true)
                .build();
    }
}
