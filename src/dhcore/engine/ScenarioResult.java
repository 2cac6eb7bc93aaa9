package dhcore.engine;

import dhcore.model.AggregateRow;
import dhcore.model.SiteMetadata;

import java.util.List;

/**
 * Итог одного прогона (площадка, сценарий): полная таблица строк и замечания по данным.
 */
public final class ScenarioResult {

    private final String scenarioName;
    private final SiteMetadata site;
    private final List<AggregateRow> rows;
    private final List<DataQualityWarning> warnings;

    public ScenarioResult(String scenarioName,
                          SiteMetadata site,
                          List<AggregateRow> rows,
                          List<DataQualityWarning> warnings) {
        this.scenarioName = scenarioName;
        this.site = site;
        this.rows = List.copyOf(rows);
        this.warnings = List.copyOf(warnings);
    }

    public String getScenarioName() {
        return scenarioName;
    }

    public SiteMetadata getSite() {
        return site;
    }

    public List<AggregateRow> getRows() {
        return rows;
    }

    public List<DataQualityWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
