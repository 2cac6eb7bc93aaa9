package dhcore.config;

import dhcore.error.ScenarioConfigException;

/**
 * Параметры одного расчётного сценария градусо-часов (immutable).
 * Все инварианты проверяются в конструкторе: невалидный сценарий не создаётся.
 */
public class ScenarioConfig {

    /** Имя сценария, например "hdh_sc1". */
    private final String name;

    /** Отопление или охлаждение. */
    private final DegreeType degreeType;

    /** Порог для часовой формулы и суточной средней, °C. */
    private final double dailyThreshold;

    /**
     * Порог недельной средней, °C.
     * Для CDD-фильтра это порог срабатывания CDD_week (градусо-сутки).
     */
    private final double weeklyThreshold;

    /** Нижняя граница рабочего диапазона бинов, °C. */
    private final double minTemperature;

    /** Верхняя граница рабочего диапазона бинов, °C. */
    private final double maxTemperature;

    /** Шаг бина, °C. */
    private final double binWidth;

    /** Проверять суточную среднюю. */
    private final boolean dailyGateEnabled;

    /** Проверять недельное условие (среднюю или CDD_week). */
    private final boolean weeklyGateEnabled;

    /** База CDD, °C; null - обычный недельный фильтр по средней. */
    private final Double cddBaseTemperature;

    private final GateType gateType;

    public ScenarioConfig(String name,
                          DegreeType degreeType,
                          double dailyThreshold,
                          double weeklyThreshold,
                          double minTemperature,
                          double maxTemperature,
                          double binWidth,
                          boolean dailyGateEnabled,
                          boolean weeklyGateEnabled,
                          Double cddBaseTemperature) {
        this.name = name;
        this.degreeType = degreeType;
        this.dailyThreshold = dailyThreshold;
        this.weeklyThreshold = weeklyThreshold;
        this.minTemperature = minTemperature;
        this.maxTemperature = maxTemperature;
        this.binWidth = binWidth;
        this.dailyGateEnabled = dailyGateEnabled;
        this.weeklyGateEnabled = weeklyGateEnabled;
        this.cddBaseTemperature = cddBaseTemperature;

        validate();
        this.gateType = resolveGateType();
    }

    private void validate() {
        if (name == null || name.isBlank()) {
            throw new ScenarioConfigException("Имя сценария не задано");
        }
        if (degreeType == null) {
            throw new ScenarioConfigException("Не задан тип градусо-часов: " + name);
        }
        if (!Double.isFinite(dailyThreshold) || !Double.isFinite(weeklyThreshold)) {
            throw new ScenarioConfigException("Пороги должны быть конечными числами: " + name);
        }
        if (!Double.isFinite(binWidth) || binWidth <= 0.0) {
            throw new ScenarioConfigException("Ширина бина должна быть > 0: " + binWidth + " (" + name + ")");
        }
        if (!Double.isFinite(minTemperature) || !Double.isFinite(maxTemperature)
                || minTemperature >= maxTemperature) {
            throw new ScenarioConfigException(
                    "Недопустимый диапазон температур: (" + minTemperature + ", " + maxTemperature + ") (" + name + ")");
        }
        if (minTemperature <= DegreeHourConstants.TEMP_OVERFLOW_MIN
                || maxTemperature >= DegreeHourConstants.TEMP_OVERFLOW_MAX) {
            throw new ScenarioConfigException(
                    "Диапазон должен лежать внутри границ переполнения ("
                            + DegreeHourConstants.TEMP_OVERFLOW_MIN + ", "
                            + DegreeHourConstants.TEMP_OVERFLOW_MAX + "): " + name);
        }
        if (cddBaseTemperature != null && !Double.isFinite(cddBaseTemperature)) {
            throw new ScenarioConfigException("База CDD должна быть конечным числом: " + name);
        }
    }

    private GateType resolveGateType() {
        if (!dailyGateEnabled) {
            // без суточного условия фильтр не определён (ни "только неделя", ни "без фильтра")
            throw new ScenarioConfigException("Суточный фильтр выключен, вариант фильтра не определён: " + name);
        }
        if (cddBaseTemperature != null) {
            if (!weeklyGateEnabled) {
                throw new ScenarioConfigException("База CDD задана, но недельный фильтр выключен: " + name);
            }
            if (degreeType != DegreeType.COOLING) {
                throw new ScenarioConfigException("CDD-фильтр допустим только для охлаждения: " + name);
            }
            return GateType.DAILY_OR_CDD_WEEK;
        }
        return weeklyGateEnabled ? GateType.DAILY_OR_WEEKLY : GateType.DAILY;
    }

    public String getName() {
        return name;
    }

    public DegreeType getDegreeType() {
        return degreeType;
    }

    public double getDailyThreshold() {
        return dailyThreshold;
    }

    public double getWeeklyThreshold() {
        return weeklyThreshold;
    }

    /** Порог CDD_week; то же поле, что и недельный порог. */
    public double getCddTrigger() {
        return weeklyThreshold;
    }

    public double getMinTemperature() {
        return minTemperature;
    }

    public double getMaxTemperature() {
        return maxTemperature;
    }

    public double getBinWidth() {
        return binWidth;
    }

    public boolean isDailyGateEnabled() {
        return dailyGateEnabled;
    }

    public boolean isWeeklyGateEnabled() {
        return weeklyGateEnabled;
    }

    public Double getCddBaseTemperature() {
        return cddBaseTemperature;
    }

    public GateType getGateType() {
        return gateType;
    }

    @Override
    public String toString() {
        return name + "[" + degreeType + ", " + gateType
                + ", daily=" + dailyThreshold + ", weekly=" + weeklyThreshold
                + ", range=(" + minTemperature + ", " + maxTemperature + "), bin=" + binWidth
                + (cddBaseTemperature != null ? ", cddBase=" + cddBaseTemperature : "")
                + "]";
    }
}
