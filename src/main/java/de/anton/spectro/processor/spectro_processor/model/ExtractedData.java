package de.anton.spectro.processor.spectro_processor.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything extracted from one instrument file: the populated configuration fields and
 * the numeric series. Series whose column was missing in the file are simply absent.
 * Arrays are copied on the way in and out.
 */
public class ExtractedData {

    private final InstrumentFile file;
    private final List<ConfigField> configFields;
    private final List<String> rawDate;                 // month, day, year as read (zero padded), may be empty
    private final Map<Series, double[]> series = new EnumMap<>(Series.class);

    public ExtractedData(InstrumentFile file, List<ConfigField> configFields, List<String> rawDate,
                         Map<Series, double[]> series) {
        this.file = Objects.requireNonNull(file);
        this.configFields = List.copyOf(configFields);
        this.rawDate = rawDate == null ? Collections.emptyList() : List.copyOf(rawDate);
        series.forEach((key, values) -> this.series.put(key, values.clone()));
    }

    public InstrumentFile getFile() {
        return file;
    }

    /** @return All configuration fields, universal ones first, in header order. */
    public List<ConfigField> getConfigFields() {
        return configFields;
    }

    /** Looks a configuration field up by its logical name. */
    public Optional<ConfigField> getConfigField(String name) {
        return configFields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    /** @return The raw date components (month, day, year), empty if the file carried no date. */
    public List<String> getRawDate() {
        return rawDate;
    }

    public boolean hasSeries(Series key) {
        return series.containsKey(key);
    }

    /** @return A copy of the series, or null if it was not extracted. */
    public double[] getSeries(Series key) {
        double[] values = series.get(key);
        return values == null ? null : values.clone();
    }

    /** @return The number of data rows, taken from any extracted series (0 if none). */
    public int rowCount() {
        return series.values().stream().findFirst().map(v -> v.length).orElse(0);
    }

    @Override
    public String toString() {
        return "ExtractedData{file=" + file.getPath().getFileName() + ", configFields=" + configFields.size()
                + ", series=" + series.keySet() + ", rows=" + rowCount() + '}';
    }
}
