package dhcore.io;

import dhcore.model.AggregateRow;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Запись итоговых строк сценария в CSV (одна таблица на сценарий, все площадки подряд).
 */
public final class AggregateCsvWriter {

    static final String HEADER = "hour,bin,degree_hour,temp_mean,count_hours_in_bin,"
            + "count_hour_spring,count_hour_summer,count_hour_fall,count_hour_winter,city,state-prov";

    private AggregateCsvWriter() {}

    public static void write(Path path, List<AggregateRow> rows) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(w, rows);
        }
    }

    public static void write(Writer out, List<AggregateRow> rows) throws IOException {
        BufferedWriter w = (out instanceof BufferedWriter bw) ? bw : new BufferedWriter(out);

        w.write(HEADER);
        w.newLine();

        for (AggregateRow r : rows) {
            StringBuilder sb = new StringBuilder(160);
            sb.append(r.hourOfDay).append(',')
                    .append(csvCell(r.bin.label())).append(',')
                    .append(num(r.sumDegreeHour)).append(',')
                    .append(num(r.meanTemperature)).append(',')
                    .append(r.countActiveHours).append(',')
                    .append(r.countSpring).append(',')
                    .append(r.countSummer).append(',')
                    .append(r.countFall).append(',')
                    .append(r.countWinter).append(',')
                    .append(csvCell(r.city)).append(',')
                    .append(csvCell(r.stateProvince));
            w.write(sb.toString());
            w.newLine();
        }
        w.flush();
    }

    private static String csvCell(String s) {
        if (s == null) return "";
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }

    // полная точность double, десятичная точка независимо от локали
    private static String num(double v) {
        return Double.toString(v);
    }
}
