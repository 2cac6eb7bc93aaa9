package dhcore;

import dhcore.config.ScenarioConfig;
import dhcore.engine.BatchResult;
import dhcore.engine.ScenarioRunner;
import dhcore.engine.SiteBatchRunner;
import dhcore.error.DegreeHourException;
import dhcore.io.AggregateCsvWriter;
import dhcore.io.AggregateExcelWriter;
import dhcore.io.EpwReader;
import dhcore.model.AggregateRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static final String XLSX_NAME = "degree_hours.xlsx";

    public static void main(String[] args) {
        RunOptions opts;
        try {
            opts = RunOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(RunOptions.usage());
            System.exit(2);
            return;
        }

        try {
            int failed = run(opts);
            if (failed > 0) {
                System.exit(1);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Прервано");
            System.exit(1);
        } catch (IOException | DegreeHourException e) {
            log.error("Ошибка: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Полный прогон: файлы из weather-папки, CSV (и XLSX) в results-папку.
     *
     * @return число сценариев без единой посчитанной площадки
     */
    public static int run(RunOptions opts) throws IOException, InterruptedException {
        // 1) сценарии (неизвестное имя - ошибка до начала расчёта)
        List<ScenarioConfig> scenarios = new ArrayList<>(opts.getScenarios().size());
        for (String name : opts.getScenarios()) {
            scenarios.add(ScenarioPresets.byName(name));
        }

        // 2) входные файлы
        List<Path> files = listWeatherFiles(opts.getWeatherFolder());
        if (files.isEmpty()) {
            log.warn("Нет .zip/.epw файлов в {}", opts.getWeatherFolder());
            return scenarios.size();
        }
        Files.createDirectories(opts.getResultsFolder());

        // 3) общий пул
        int threads = Math.min(opts.getThreads(), files.size());
        ExecutorService ex = Executors.newFixedThreadPool(threads);
        Map<String, BatchResult> results;
        try {
            SiteBatchRunner batch = new SiteBatchRunner(ex, new EpwReader(), new ScenarioRunner());
            results = batch.run(files, scenarios);
        } finally {
            ex.shutdown();
        }

        // 4) запись
        int failedScenarios = 0;
        Map<String, List<AggregateRow>> forXlsx = new LinkedHashMap<>();
        for (BatchResult r : results.values()) {
            if (r.siteResults.isEmpty()) {
                log.error("Сценарий {}: нет результатов", r.scenarioName);
                failedScenarios++;
                continue;
            }
            List<AggregateRow> rows = r.rows();
            Path csv = opts.getResultsFolder().resolve(r.scenarioName + ".csv");
            AggregateCsvWriter.write(csv, rows);
            forXlsx.put(r.scenarioName, rows);
            log.info("Сценарий {}: {} площадок, {} строк, {} замечаний по данным -> {}",
                    r.scenarioName, r.siteResults.size(), rows.size(), r.warningCount(), csv);
        }

        if (opts.isWriteXlsx() && !forXlsx.isEmpty()) {
            Path xlsx = opts.getResultsFolder().resolve(XLSX_NAME);
            AggregateExcelWriter.writeXlsx(xlsx, forXlsx);
            log.info("Saved: {}", xlsx);
        }
        return failedScenarios;
    }

    static List<Path> listWeatherFiles(Path folder) throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(folder)) {
            return files;
        }
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(folder, "*.{zip,epw,ZIP,EPW}")) {
            for (Path p : ds) {
                if (Files.isRegularFile(p)) files.add(p);
            }
        }
        // порядок каталога не гарантирован
        Collections.sort(files);
        return files;
    }
}
