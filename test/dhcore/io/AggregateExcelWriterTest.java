package dhcore.io;

import static org.junit.jupiter.api.Assertions.*;

import dhcore.engine.Binner;
import dhcore.model.AggregateRow;
import dhcore.model.TemperatureBin;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class AggregateExcelWriterTest {

    @Test
    void oneSheetPerScenario() throws Exception {
        TemperatureBin bin = Binner.build(-29.2, 12.8, 2.8).bin(1);
        Map<String, List<AggregateRow>> data = new LinkedHashMap<>();
        data.put("hdh_sc1", List.of(new AggregateRow(7, bin, 12.5, -27.0, 40, 1, 0, 2, 37, "Iqaluit", "NU")));
        data.put("cdh_sc3", List.of());
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        AggregateExcelWriter.writeXlsx(out, data);

        try (Workbook wb = new XSSFWorkbook(new ByteArrayInputStream(out.toByteArray()))) {
            assertEquals(2, wb.getNumberOfSheets());
            assertEquals("hdh_sc1", wb.getSheetName(0));
            assertEquals("cdh_sc3", wb.getSheetName(1));

            Sheet sh = wb.getSheetAt(0);
            assertEquals("degree_hour", sh.getRow(0).getCell(2).getStringCellValue());
            Row r = sh.getRow(1);
            assertEquals(7.0, r.getCell(0).getNumericCellValue());
            assertEquals("(-29.2, -26.4]", r.getCell(1).getStringCellValue());
            assertEquals(12.5, r.getCell(2).getNumericCellValue());
            assertEquals(37.0, r.getCell(8).getNumericCellValue());
            assertEquals("NU", r.getCell(10).getStringCellValue());

            assertEquals(0, wb.getSheetAt(1).getLastRowNum());
        }
    }
}
