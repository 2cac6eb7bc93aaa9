package dhcore.config;

/**
 * Builder для ScenarioConfig.
 */
public class ScenarioConfigBuilder {

    private String name;
    private DegreeType degreeType;

    private double dailyThreshold;
    private double weeklyThreshold;

    private double minTemperature;
    private double maxTemperature;
    private double binWidth;

    private boolean dailyGateEnabled = true;
    private boolean weeklyGateEnabled;
    private Double cddBaseTemperature;

    public ScenarioConfigBuilder() {
    }

    /**
     * Создать builder на основе уже существующего сценария.
     */
    public static ScenarioConfigBuilder from(ScenarioConfig base) {
        ScenarioConfigBuilder b = new ScenarioConfigBuilder();
        b.name = base.getName();
        b.degreeType = base.getDegreeType();
        b.dailyThreshold = base.getDailyThreshold();
        b.weeklyThreshold = base.getWeeklyThreshold();
        b.minTemperature = base.getMinTemperature();
        b.maxTemperature = base.getMaxTemperature();
        b.binWidth = base.getBinWidth();
        b.dailyGateEnabled = base.isDailyGateEnabled();
        b.weeklyGateEnabled = base.isWeeklyGateEnabled();
        b.cddBaseTemperature = base.getCddBaseTemperature();
        return b;
    }

    public ScenarioConfig build() {
        return new ScenarioConfig(
                name,
                degreeType,
                dailyThreshold,
                weeklyThreshold,
                minTemperature,
                maxTemperature,
                binWidth,
                dailyGateEnabled,
                weeklyGateEnabled,
                cddBaseTemperature
        );
    }

    // --------- сеттеры ---------

    public ScenarioConfigBuilder setName(String name) {
        this.name = name;
        return this;
    }

    public ScenarioConfigBuilder setDegreeType(DegreeType degreeType) {
        this.degreeType = degreeType;
        return this;
    }

    public ScenarioConfigBuilder setDailyThreshold(double dailyThreshold) {
        this.dailyThreshold = dailyThreshold;
        return this;
    }

    public ScenarioConfigBuilder setWeeklyThreshold(double weeklyThreshold) {
        this.weeklyThreshold = weeklyThreshold;
        return this;
    }

    /** Порог CDD_week хранится в том же поле, что и недельный порог. */
    public ScenarioConfigBuilder setCddTrigger(double cddTrigger) {
        this.weeklyThreshold = cddTrigger;
        return this;
    }

    public ScenarioConfigBuilder setTemperatureRange(double minTemperature, double maxTemperature) {
        this.minTemperature = minTemperature;
        this.maxTemperature = maxTemperature;
        return this;
    }

    public ScenarioConfigBuilder setBinWidth(double binWidth) {
        this.binWidth = binWidth;
        return this;
    }

    public ScenarioConfigBuilder setDailyGateEnabled(boolean dailyGateEnabled) {
        this.dailyGateEnabled = dailyGateEnabled;
        return this;
    }

    public ScenarioConfigBuilder setWeeklyGateEnabled(boolean weeklyGateEnabled) {
        this.weeklyGateEnabled = weeklyGateEnabled;
        return this;
    }

    public ScenarioConfigBuilder setCddBaseTemperature(Double cddBaseTemperature) {
        this.cddBaseTemperature = cddBaseTemperature;
        return this;
    }
}
