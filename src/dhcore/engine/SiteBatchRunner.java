// File: dhcore/engine/SiteBatchRunner.java
package dhcore.engine;

import dhcore.config.ScenarioConfig;
import dhcore.error.DegreeHourException;
import dhcore.io.EpwReader;
import dhcore.io.WeatherFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Параллельный прогон сценариев по площадкам.
 * <p>
 * Одна задача на файл: задача сама читает файл и владеет своими массивами,
 * общего изменяемого состояния между задачами нет. Результаты собираются через
 * Future.get() в порядке подачи файлов. Ошибка одной площадки пишется в лог
 * и в failures, остальные площадки считаются как обычно.
 */
public final class SiteBatchRunner {

    private static final Logger log = LoggerFactory.getLogger(SiteBatchRunner.class);

    private final ExecutorService executor;
    private final EpwReader reader;
    private final ScenarioRunner scenarioRunner;

    public SiteBatchRunner(ExecutorService executor, EpwReader reader, ScenarioRunner scenarioRunner) {
        this.executor = executor;
        this.reader = reader;
        this.scenarioRunner = scenarioRunner;
    }

    public BatchResult run(List<Path> files, ScenarioConfig scenario) throws InterruptedException {
        return run(files, List.of(scenario)).get(scenario.getName());
    }

    /**
     * Все сценарии по всем файлам; каждый файл читается один раз.
     *
     * @return итог по каждому сценарию, в порядке списка сценариев
     */
    public Map<String, BatchResult> run(List<Path> files, List<ScenarioConfig> scenarios)
            throws InterruptedException {

        if (scenarios.isEmpty()) {
            throw new IllegalArgumentException("scenarios must not be empty");
        }

        Map<String, List<ScenarioResult>> bySc = new LinkedHashMap<>();
        for (ScenarioConfig sc : scenarios) {
            if (bySc.put(sc.getName(), new ArrayList<>()) != null) {
                throw new IllegalArgumentException("duplicate scenario name: " + sc.getName());
            }
        }

        long start = System.nanoTime();
        log.info("Обработка {} файлов, сценарии: {}", files.size(), names(scenarios));

        List<Future<List<ScenarioResult>>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            futures.add(executor.submit(() -> runSite(file, scenarios)));
        }

        List<SiteFailure> failures = new ArrayList<>();

        for (int k = 0; k < futures.size(); k++) {
            Path file = files.get(k);
            try {
                for (ScenarioResult r : futures.get(k).get()) {
                    bySc.get(r.getScenarioName()).add(r);
                }
            } catch (ExecutionException e) {
                Throwable cause = (e.getCause() != null) ? e.getCause() : e;
                if (cause instanceof Error err) {
                    throw err;
                }
                if (cause instanceof IOException || cause instanceof DegreeHourException) {
                    log.warn("Пропуск {}: {}", file.getFileName(), cause.getMessage());
                } else {
                    log.error("Пропуск {}: непредвиденная ошибка", file.getFileName(), cause);
                }
                failures.add(new SiteFailure(file.toString(), String.valueOf(cause.getMessage())));
            }
        }

        Map<String, BatchResult> out = new LinkedHashMap<>();
        for (ScenarioConfig sc : scenarios) {
            out.put(sc.getName(), new BatchResult(sc.getName(), bySc.get(sc.getName()), failures));
        }

        double elapsed = (System.nanoTime() - start) / 1e9;
        log.info("Обработано {}/{} файлов за {} c", files.size() - failures.size(), files.size(),
                String.format(Locale.ROOT, "%.2f", elapsed));
        return out;
    }

    private List<ScenarioResult> runSite(Path file, List<ScenarioConfig> scenarios) throws IOException {
        long start = System.nanoTime();
        WeatherFile wf = reader.read(file);

        List<ScenarioResult> results = new ArrayList<>(scenarios.size());
        for (ScenarioConfig sc : scenarios) {
            ScenarioResult r = scenarioRunner.run(wf.series(), wf.site(), sc);
            if (r.hasWarnings()) {
                log.warn("{} ({}) / {}: {} часов без температуры",
                        file.getFileName(), r.getSite().city(), sc.getName(), r.getWarnings().size());
            }
            results.add(r);
        }

        log.debug("{} обработан за {} мс", file.getFileName(), (System.nanoTime() - start) / 1_000_000);
        return results;
    }

    private static List<String> names(List<ScenarioConfig> scenarios) {
        List<String> out = new ArrayList<>(scenarios.size());
        for (ScenarioConfig sc : scenarios) {
            out.add(sc.getName());
        }
        return out;
    }
}
