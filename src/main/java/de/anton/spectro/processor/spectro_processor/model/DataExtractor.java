package de.anton.spectro.processor.spectro_processor.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads numeric columns from the data block of an instrument file. The block starts two lines
 * after {@code $MDCDA} (the line in between holds the whitespace separated column headers)
 * and ends before {@code $ENDDA}.
 * <p>
 * A requested column that is not in the header is looked up under its historical alternate
 * name; if neither is present the column is skipped with a warning and its series stays absent.
 */
public class DataExtractor {

    private static final Logger logger = LoggerFactory.getLogger(DataExtractor.class);

    public static final String DATA_START_TAG = "$MDCDA";
    public static final String DATA_END_TAG = "$ENDDA";

    /** Column names the instrument software has used interchangeably across versions. */
    public static final Map<String, String> ALTERNATE_COLUMN_NAMES = Map.of(
            "CD_Error", "Error",
            "Error", "CD_Error");

    /**
     * Extracts every requested column that can be found.
     *
     * @param file The indexed instrument file.
     * @param plan The extraction plan; requested columns found under an alternate name are renamed in it.
     * @return One array per resolved series, all of the same length.
     * @throws FormatException If the data block cannot be located or a cell does not parse as a number.
     */
    public Map<Series, double[]> extract(InstrumentFile file, ExtractionPlan plan) throws FormatException {
        int start = file.indexOfTag(DATA_START_TAG) + 2;
        int end = file.indexOfTag(DATA_END_TAG);
        if (start < 2 || end < 0 || start - 1 >= file.lineCount()) {
            throw new FormatException("Problem locating data in \"" + file.getPath() + "\": "
                    + DATA_START_TAG + "/" + DATA_END_TAG + " markers missing.");
        }

        String headerLine = file.line(start - 1);
        Map<String, Integer> columnIndexes = new HashMap<>();
        String[] headers = headerLine.strip().split("\\s+");
        for (int i = 0; i < headers.length; i++) {
            columnIndexes.put(headers[i], i);
        }
        logger.debug("Data block of {}: lines {}..{}, columns {}", file.getPath().getFileName(), start + 1, end,
                columnIndexes.keySet());

        Map<String, Series> resolved = resolveColumns(plan, columnIndexes);

        Map<Series, List<Double>> values = new LinkedHashMap<>();
        resolved.values().forEach(target -> values.put(target, new ArrayList<>()));

        for (int i = start; i < end; i++) {
            String line = file.line(i);
            if (line.isBlank()) {
                logger.trace("Skipping blank data line {}", i + 1);
                continue;
            }
            String[] cells = line.strip().split("\\s+");
            for (Map.Entry<String, Series> column : resolved.entrySet()) {
                int index = columnIndexes.get(column.getKey());
                try {
                    values.get(column.getValue()).add(Double.parseDouble(cells[index]));
                } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                    throw new FormatException("Problem with \"" + column.getKey() + "\" column on line "
                            + (i + 1) + ":\n" + line, e);
                }
            }
        }

        Map<Series, double[]> result = new EnumMap<>(Series.class);
        values.forEach((target, list) -> result.put(target, list.stream().mapToDouble(Double::doubleValue).toArray()));
        logger.info("Extracted {} data columns with {} rows from {}", result.size(),
                result.values().stream().findFirst().map(a -> a.length).orElse(0), file.getPath().getFileName());
        return result;
    }

    /**
     * Maps every requested column to the header name it is found under. Columns found only under
     * their alternate name are renamed in the plan so later references use the name in the file.
     */
    private Map<String, Series> resolveColumns(ExtractionPlan plan, Map<String, Integer> columnIndexes) {
        Map<String, Series> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Series> request : new LinkedHashMap<>(plan.getColumns()).entrySet()) {
            String column = request.getKey();
            if (columnIndexes.containsKey(column)) {
                resolved.put(column, request.getValue());
                continue;
            }
            String alternate = ALTERNATE_COLUMN_NAMES.get(column);
            if (alternate != null && columnIndexes.containsKey(alternate)) {
                logger.info("Column \"{}\" not found, using alternate name \"{}\"", column, alternate);
                plan.renameColumn(column, alternate);
                resolved.put(alternate, request.getValue());
            } else {
                logger.warn("Warning! Column \"{}\" not found; {} will not be populated.", column, request.getValue());
            }
        }
        return resolved;
    }
}
