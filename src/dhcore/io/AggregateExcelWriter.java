package dhcore.io;

import dhcore.model.AggregateRow;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * XLSX со всеми сценариями: по листу на сценарий, порядок листов = порядок в map.
 */
public final class AggregateExcelWriter {

    private static final String[] HEADERS = {
            "hour", "bin", "degree_hour", "temp_mean", "count_hours_in_bin",
            "count_hour_spring", "count_hour_summer", "count_hour_fall", "count_hour_winter",
            "city", "state-prov"
    };

    private AggregateExcelWriter() {}

    public static void writeXlsx(Path path, Map<String, List<AggregateRow>> rowsByScenario) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            writeXlsx(out, rowsByScenario);
        }
    }

    public static void writeXlsx(OutputStream out, Map<String, List<AggregateRow>> rowsByScenario) throws IOException {
        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            CellStyle numberStyle = wb.createCellStyle();
            numberStyle.setAlignment(HorizontalAlignment.CENTER);
            numberStyle.setDataFormat(df.getFormat("0.0000"));

            CellStyle intStyle = wb.createCellStyle();
            intStyle.setAlignment(HorizontalAlignment.CENTER);
            intStyle.setDataFormat(df.getFormat("0"));

            for (Map.Entry<String, List<AggregateRow>> e : rowsByScenario.entrySet()) {
                Sheet sh = wb.createSheet(e.getKey());

                int r = 0;
                Row hdr = sh.createRow(r++);
                for (int c = 0; c < HEADERS.length; c++) {
                    Cell cell = hdr.createCell(c);
                    cell.setCellValue(HEADERS[c]);
                    cell.setCellStyle(headerStyle);
                }

                for (AggregateRow a : e.getValue()) {
                    Row row = sh.createRow(r++);
                    int c = 0;
                    writeInt(row, c++, a.hourOfDay, intStyle);
                    row.createCell(c++).setCellValue(a.bin.label());
                    writeNumber(row, c++, a.sumDegreeHour, numberStyle);
                    writeNumber(row, c++, a.meanTemperature, numberStyle);
                    writeInt(row, c++, a.countActiveHours, intStyle);
                    writeInt(row, c++, a.countSpring, intStyle);
                    writeInt(row, c++, a.countSummer, intStyle);
                    writeInt(row, c++, a.countFall, intStyle);
                    writeInt(row, c++, a.countWinter, intStyle);
                    row.createCell(c++).setCellValue(a.city);
                    row.createCell(c).setCellValue(a.stateProvince);
                }

                sh.createFreezePane(0, 1);
            }

            wb.write(out);
        }
    }

    private static void writeNumber(Row row, int col, double value, CellStyle numStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(numStyle);
    }

    private static void writeInt(Row row, int col, long value, CellStyle intStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(intStyle);
    }
}
