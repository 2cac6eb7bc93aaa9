package dhcore.engine;

import dhcore.model.AggregateRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Итог сценария по всем площадкам: строки склеены в порядке подачи файлов.
 */
public final class BatchResult {

    public final String scenarioName;
    public final List<ScenarioResult> siteResults;
    public final List<SiteFailure> failures;

    public BatchResult(String scenarioName, List<ScenarioResult> siteResults, List<SiteFailure> failures) {
        this.scenarioName = scenarioName;
        this.siteResults = List.copyOf(siteResults);
        this.failures = List.copyOf(failures);
    }

    public List<AggregateRow> rows() {
        List<AggregateRow> out = new ArrayList<>();
        for (ScenarioResult r : siteResults) {
            out.addAll(r.getRows());
        }
        return out;
    }

    public int warningCount() {
        int n = 0;
        for (ScenarioResult r : siteResults) {
            n += r.getWarnings().size();
        }
        return n;
    }
}
