package de.anton.spectro.processor.spectro_processor.model;

import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExcelExporterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesTableAndHeaderSheets() throws Exception {
        DataTable table = new DataTable(List.of("s_x", "s_raw"),
                List.of(new double[] {0.0, 1.0}, new double[] {-3.5, Double.NaN}));
        Path file = tempDir.resolve("out.xlsx");

        new ExcelExporter().export(table, List.of("----- Experiment information -----", "Instrument: CD"), file);

        try (InputStream in = Files.newInputStream(file); Workbook workbook = new XSSFWorkbook(in)) {
            Sheet data = workbook.getSheet(ExcelExporter.DATA_SHEET);
            assertNotNull(data);
            assertEquals("s_x", data.getRow(0).getCell(1).getStringCellValue());
            assertEquals("s_raw", data.getRow(0).getCell(2).getStringCellValue());
            assertEquals(1.0, data.getRow(2).getCell(0).getNumericCellValue(), 1e-9);
            assertEquals(-3.5, data.getRow(1).getCell(2).getNumericCellValue(), 1e-9);
            assertEquals(CellType.BLANK, data.getRow(2).getCell(2).getCellType());

            Sheet header = workbook.getSheet(ExcelExporter.HEADER_SHEET);
            assertEquals("Instrument: CD", header.getRow(1).getCell(0).getStringCellValue());
        }
    }
}
