package de.anton.spectro.processor.spectro_processor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a pipeline run reads from an instrument file: the configuration fields and the
 * mapping from instrument column name to {@link Series}. Instrument and experiment profiles
 * fill the plan one after the other; the extractors then consume it.
 */
public class ExtractionPlan {

    private final List<ConfigField> configFields = new ArrayList<>();
    private final Map<String, Series> columns = new LinkedHashMap<>();

    public ExtractionPlan addConfigField(ConfigField field) {
        configFields.add(Objects.requireNonNull(field));
        return this;
    }

    /** Drops every declared field reading the given tag. */
    public ExtractionPlan removeConfigField(String sourceTag) {
        configFields.removeIf(f -> f.getSourceTag().equals(sourceTag));
        return this;
    }

    public ExtractionPlan requestColumn(String instrumentColumn, Series target) {
        columns.put(Objects.requireNonNull(instrumentColumn), Objects.requireNonNull(target));
        return this;
    }

    /**
     * Re-keys a requested column under the name it actually carries in the file, keeping its target
     * and its position. Used when a historical alternate column name is found.
     */
    void renameColumn(String requested, String actual) {
        Map<String, Series> renamed = new LinkedHashMap<>();
        for (Map.Entry<String, Series> entry : columns.entrySet()) {
            renamed.put(entry.getKey().equals(requested) ? actual : entry.getKey(), entry.getValue());
        }
        columns.clear();
        columns.putAll(renamed);
    }

    /** @return Declared fields in declaration order (unmodifiable view). */
    public List<ConfigField> getConfigFields() {
        return Collections.unmodifiableList(configFields);
    }

    /** @return Column name → target series, in request order (unmodifiable view). */
    public Map<String, Series> getColumns() {
        return Collections.unmodifiableMap(columns);
    }

    public boolean hasConfigField(String sourceTag) {
        return configFields.stream().anyMatch(f -> f.getSourceTag().equals(sourceTag));
    }

    @Override
    public String toString() {
        return "ExtractionPlan{configFields=" + configFields.size() + ", columns=" + columns + '}';
    }
}
