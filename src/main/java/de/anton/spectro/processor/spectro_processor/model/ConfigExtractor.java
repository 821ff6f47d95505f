package de.anton.spectro.processor.spectro_processor.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Populates configuration fields from the {@code $CONFIG} block of an instrument file.
 * Every line after the {@code $CONFIG} marker is split on colons; a line is used if its
 * first token is the source tag of a declared field. The experiment name, description
 * and date fields are always extracted in addition to the declared ones.
 */
public class ConfigExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ConfigExtractor.class);

    public static final String CONFIG_MARKER = "$CONFIG";
    public static final String NAME_TAG = "$EXPNAME";
    public static final String DESCRIPTION_TAG = "$EXDESC";
    public static final String DATE_TAG = "$MDY";

    /**
     * Extraction result: all fields (universal first) and the raw date components.
     */
    public record Result(List<ConfigField> fields, List<String> rawDate) { }

    /**
     * Extracts the declared fields plus the universal ones.
     *
     * @param file     The indexed instrument file.
     * @param declared Fields declared by the instrument and experiment profiles, in header order.
     * @return The populated fields and the raw date.
     * @throws FormatException If the {@code $CONFIG} marker is missing or a value does not match its type.
     */
    public Result extract(InstrumentFile file, List<ConfigField> declared) throws FormatException {
        List<ConfigField> fields = new ArrayList<>();
        fields.add(ConfigField.text(NAME_TAG, "name", "Name"));
        fields.add(ConfigField.text(DESCRIPTION_TAG, "description", "Description"));
        fields.add(ConfigField.text(DATE_TAG, "date", "Date"));
        fields.addAll(declared);

        int markerLine = file.indexOfLineStartingWith(CONFIG_MARKER);
        if (markerLine < 0) {
            throw new FormatException("No " + CONFIG_MARKER + " section found in \"" + file.getPath() + "\"");
        }

        Map<String, ConfigField> byTag = new LinkedHashMap<>();
        for (ConfigField field : fields) {
            byTag.putIfAbsent(field.getSourceTag(), field);
        }

        // a repeated tag is overridden by its last occurrence
        Map<String, Integer> lastLine = new LinkedHashMap<>();
        for (int i = markerLine + 1; i < file.lineCount(); i++) {
            String tag = file.line(i).split(":", -1)[0];
            if (byTag.containsKey(tag)) {
                Integer previous = lastLine.put(tag, i);
                if (previous != null) {
                    logger.debug("Config tag {} on line {} overrides line {}", tag, i + 1, previous + 1);
                }
            }
        }

        List<String> rawDate = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : lastLine.entrySet()) {
            ConfigField field = byTag.get(entry.getKey());
            int i = entry.getValue();
            String line = file.line(i);
            List<String> tokens = Arrays.asList(line.split(":", -1));
            List<String> valueTokens = tokens.subList(1, tokens.size());
            try {
                if (DATE_TAG.equals(field.getSourceTag())) {
                    field.populate(assembleDate(valueTokens, rawDate, line));
                } else {
                    field.populate(field.coerce(valueTokens));
                }
            } catch (IllegalArgumentException e) {
                throw new FormatException("Problem with configuration value " + field.getSourceTag() + " ("
                        + field.getValueType() + ") on line " + (i + 1) + ":\n" + line, e);
            }
            logger.trace("Config {} = {}", field.getName(), field.getValue());
        }

        for (ConfigField field : fields) {
            if (!field.isPopulated()) {
                logger.warn("Configuration tag {} ({}) not found in {}", field.getSourceTag(), field.getTitle(),
                        file.getPath().getFileName());
            }
        }
        logger.debug("Extracted {} configuration fields from {}", fields.size(), file.getPath().getFileName());
        return new Result(fields, rawDate);
    }

    /**
     * Turns the month/day/year tokens of the date line into {@code YY.MM.DD}, zero padding single digits.
     * The padded components are appended to {@code rawDate}.
     */
    private String assembleDate(List<String> tokens, List<String> rawDate, String line) throws FormatException {
        if (tokens.size() != 3) {
            throw new FormatException("Date line must carry month, day and year: '" + line + "'");
        }
        for (String token : tokens) {
            String part = token.strip();
            rawDate.add(part.length() == 1 ? "0" + part : part);
        }
        return rawDate.get(2) + "." + rawDate.get(0) + "." + rawDate.get(1);
    }
}
