package dhcore;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Параметры запуска из командной строки.
 */
public final class RunOptions {

    public static final String DEFAULT_WEATHER_FOLDER = "data/weather";
    public static final String DEFAULT_RESULTS_FOLDER = "results";

    private final Path weatherFolder;
    private final Path resultsFolder;
    private final List<String> scenarios;
    private final int threads;
    private final boolean writeXlsx;

    public RunOptions(Path weatherFolder, Path resultsFolder, List<String> scenarios, int threads, boolean writeXlsx) {
        this.weatherFolder = weatherFolder;
        this.resultsFolder = resultsFolder;
        this.scenarios = List.copyOf(scenarios);
        this.threads = threads;
        this.writeXlsx = writeXlsx;
    }

    /**
     * --weather-folder DIR, --results-folder DIR, --scenario NAME (можно несколько раз),
     * --threads N, --xlsx. Без --scenario считаются все стандартные сценарии.
     */
    public static RunOptions parse(String[] args) {
        Path weather = Paths.get(DEFAULT_WEATHER_FOLDER);
        Path results = Paths.get(DEFAULT_RESULTS_FOLDER);
        List<String> scenarios = new ArrayList<>();
        int threads = Runtime.getRuntime().availableProcessors();
        boolean xlsx = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--weather-folder" -> weather = Paths.get(value(args, ++i, a));
                case "--results-folder" -> results = Paths.get(value(args, ++i, a));
                case "--scenario" -> {
                    String name = value(args, ++i, a);
                    if (scenarios.contains(name)) {
                        throw new IllegalArgumentException("--scenario given twice: " + name);
                    }
                    scenarios.add(name);
                }
                case "--threads" -> {
                    String v = value(args, ++i, a);
                    try {
                        threads = Integer.parseInt(v);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--threads: not a number: " + v, e);
                    }
                    if (threads <= 0) {
                        throw new IllegalArgumentException("--threads must be > 0");
                    }
                }
                case "--xlsx" -> xlsx = true;
                default -> throw new IllegalArgumentException("Unknown option: " + a);
            }
        }

        if (scenarios.isEmpty()) {
            scenarios.addAll(ScenarioPresets.names());
        }
        return new RunOptions(weather, results, scenarios, threads, xlsx);
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[i];
    }

    public static String usage() {
        return "Usage: dhcore [--weather-folder DIR] [--results-folder DIR] [--scenario NAME]... [--threads N] [--xlsx]\n"
                + "  scenarios: " + ScenarioPresets.names();
    }

    public Path getWeatherFolder() {
        return weatherFolder;
    }

    public Path getResultsFolder() {
        return resultsFolder;
    }

    public List<String> getScenarios() {
        return scenarios;
    }

    public int getThreads() {
        return threads;
    }

    public boolean isWriteXlsx() {
        return writeXlsx;
    }
}
