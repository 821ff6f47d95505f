package de.anton.spectro.processor.spectro_processor.model;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Exports a processed table to an Excel file (.xlsx): sheet {@value #DATA_SHEET} holds the table,
 * sheet {@value #HEADER_SHEET} the provenance header, one line per row.
 */
public class ExcelExporter {

    private static final Logger logger = LoggerFactory.getLogger(ExcelExporter.class);

    public static final String DATA_SHEET = "ProcessedData";
    public static final String HEADER_SHEET = "Header";
    private static final int COLUMN_WIDTH_CHARS = 14;

    /**
     * @param table       The numeric table, see {@link TableRenderer#tabulate}.
     * @param headerLines Header lines without the leading {@code "# "}.
     * @param file        Target file, overwritten if present.
     * @throws IOException if the workbook cannot be written.
     */
    public void export(DataTable table, List<String> headerLines, Path file) throws IOException {
        Objects.requireNonNull(table, "Table cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");

        logger.info("Starting Excel export to: {}", file);
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = workbook.createSheet(DATA_SHEET);
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFont(headerFont);

            Row headerRow = sheet.createRow(0);
            Cell indexHeader = headerRow.createCell(0);
            indexHeader.setCellValue("row");
            indexHeader.setCellStyle(headerStyle);
            List<String> labels = table.getLabels();
            for (int i = 0; i < labels.size(); i++) {
                Cell cell = headerRow.createCell(i + 1);
                cell.setCellValue(labels.get(i));
                cell.setCellStyle(headerStyle);
            }

            for (int r = 0; r < table.rowCount(); r++) {
                Row row = sheet.createRow(r + 1);
                row.createCell(0).setCellValue(r);
                for (int c = 0; c < table.columnCount(); c++) {
                    createNumericCell(row, c + 1, table.value(r, c));
                }
            }
            // fixed width, autoSizeColumn needs fonts which headless systems may lack
            for (int i = 0; i <= labels.size(); i++) {
                sheet.setColumnWidth(i, COLUMN_WIDTH_CHARS * 256);
            }

            Sheet headerSheet = workbook.createSheet(HEADER_SHEET);
            int rowNum = 0;
            for (String line : headerLines) {
                headerSheet.createRow(rowNum++).createCell(0).setCellValue(line);
            }

            logger.debug("Writing workbook with {} rows to file...", table.rowCount());
            workbook.write(out);
            logger.info("Excel export completed successfully to: {}", file);
        } catch (IOException e) {
            logger.error("IOException during Excel export to {}", file, e);
            throw e;
        }
    }

    private void createNumericCell(Row row, int colIndex, double value) {
        if (!Double.isNaN(value) && !Double.isInfinite(value)) {
            row.createCell(colIndex).setCellValue(value);
        } else {
            row.createCell(colIndex, CellType.BLANK);
        }
    }
}
