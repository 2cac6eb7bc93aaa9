package dhcore.io;

import dhcore.config.DegreeHourConstants;
import dhcore.error.InputShapeException;
import dhcore.model.HourlyRecord;
import dhcore.model.SiteMetadata;
import dhcore.model.TemperatureSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Загрузка EPW (EnergyPlus Weather) из .epw или из .zip-архива.
 * <p>
 * Строка 1 - LOCATION,город,регион,страна,источник,WMO,широта,долгота,TZ,высота;
 * строки 2..8 пропускаются; далее по строке на час:
 * год,месяц,день,час(1..24),минута,флаги,температура сухого термометра,...
 * Час приводится к 0..23, значение 99.9 и пустое поле считаются пропуском (NaN).
 */
public class EpwReader {

    private static final Logger log = LoggerFactory.getLogger(EpwReader.class);

    private static final int LOCATION_FIELDS = 10;

    public WeatherFile read(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        if (fileName.toLowerCase(Locale.ROOT).endsWith(".zip")) {
            return readZip(path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        }
    }

    public WeatherFile read(InputStream in, String source) throws IOException {
        BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        return parse(br, source);
    }

    private WeatherFile readZip(Path path) throws IOException {
        try (ZipFile zip = new ZipFile(path.toFile())) {
            ZipEntry entry = findEpwEntry(zip, path);
            log.debug("{}: чтение {}", path.getFileName(), entry.getName());
            try (InputStream in = zip.getInputStream(entry)) {
                return read(in, path.toString());
            }
        }
    }

    // сначала <имя архива>.epw, иначе первый .epw в архиве
    private static ZipEntry findEpwEntry(ZipFile zip, Path path) {
        String fileName = path.getFileName().toString();
        String stem = fileName.substring(0, fileName.length() - ".zip".length());

        ZipEntry exact = zip.getEntry(stem + ".epw");
        if (exact != null) {
            return exact;
        }
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry e = entries.nextElement();
            if (!e.isDirectory() && e.getName().toLowerCase(Locale.ROOT).endsWith(".epw")) {
                return e;
            }
        }
        throw new InputShapeException("В архиве нет .epw: " + path);
    }

    WeatherFile parse(BufferedReader br, String source) throws IOException {
        String first = br.readLine();
        if (first == null) {
            throw new InputShapeException("Пустой файл: " + source);
        }
        SiteMetadata site = parseLocation(first, source);

        for (int i = 1; i < DegreeHourConstants.EPW_HEADER_LINES; i++) {
            if (br.readLine() == null) {
                throw new InputShapeException("Обрезан заголовок EPW (" + source + ")");
            }
        }

        List<HourlyRecord> records = new ArrayList<>(DegreeHourConstants.HOURS_PER_LEAP_YEAR);
        String line;
        int lineNo = DegreeHourConstants.EPW_HEADER_LINES;
        while ((line = br.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty()) continue;
            records.add(parseRow(line, lineNo, source));
        }

        try {
            return new WeatherFile(source, site, TemperatureSeries.of(records));
        } catch (InputShapeException e) {
            throw new InputShapeException(e.getMessage() + " (" + source + ")", e);
        }
    }

    private static SiteMetadata parseLocation(String line, String source) {
        String[] f = line.split(",", -1);
        if (f.length < LOCATION_FIELDS) {
            throw new InputShapeException("Строка LOCATION: ожидалось " + LOCATION_FIELDS
                    + " полей, получено " + f.length + " (" + source + ")");
        }
        try {
            return new SiteMetadata(
                    f[1].trim(),
                    f[2].trim(),
                    f[3].trim(),
                    f[4].trim(),
                    f[5].trim(),
                    Double.parseDouble(f[6].trim()),
                    Double.parseDouble(f[7].trim()),
                    Double.parseDouble(f[8].trim()),
                    Double.parseDouble(f[9].trim())
            );
        } catch (NumberFormatException e) {
            throw new InputShapeException("Строка LOCATION: нечисловые координаты (" + source + ")", e);
        }
    }

    private static HourlyRecord parseRow(String line, int lineNo, String source) {
        String[] f = line.split(",", -1);
        if (f.length <= DegreeHourConstants.EPW_DRY_BULB_COLUMN) {
            throw new InputShapeException("Строка " + lineNo + ": мало полей (" + f.length + ") (" + source + ")");
        }
        try {
            int month = Integer.parseInt(f[1].trim());
            int day = Integer.parseInt(f[2].trim());
            int hour = Integer.parseInt(f[3].trim()) - 1;
            return new HourlyRecord(month, day, hour, parseTemperature(f[DegreeHourConstants.EPW_DRY_BULB_COLUMN]));
        } catch (NumberFormatException e) {
            throw new InputShapeException("Строка " + lineNo + ": " + e.getMessage() + " (" + source + ")", e);
        } catch (InputShapeException e) {
            throw new InputShapeException("Строка " + lineNo + ": " + e.getMessage() + " (" + source + ")", e);
        }
    }

    private static double parseTemperature(String raw) {
        String s = raw.trim();
        if (s.isEmpty()) return Double.NaN;
        double t = Double.parseDouble(s);
        if (t == DegreeHourConstants.EPW_MISSING_DRY_BULB) return Double.NaN;
        return t;
    }
}
