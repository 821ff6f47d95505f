package de.anton.spectro.processor.spectro_processor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Binds one tag of the {@code $CONFIG} block (e.g. {@code $MONOWL}) to a named, typed value
 * and to the title/format used when the value is echoed into the output header.
 * <p>
 * The value is unset until {@link ConfigExtractor} populates it, which happens at most once.
 * A line carrying a single token yields a scalar, several tokens yield an unmodifiable list.
 */
public final class ConfigField {

    private final String sourceTag;     // e.g. "$MONOWL"
    private final String name;          // logical name, e.g. "wavelength"
    private final String title;         // header title, e.g. "Wavelength"
    private final ValueType valueType;
    private final String displayFormat; // java.util.Formatter pattern, e.g. "%.3f"

    private Object value;               // null until populated

    public ConfigField(String sourceTag, String name, String title, ValueType valueType, String displayFormat) {
        this.sourceTag = Objects.requireNonNull(sourceTag, "Source tag cannot be null.");
        this.name = Objects.requireNonNull(name, "Name cannot be null.");
        this.title = Objects.requireNonNull(title, "Title cannot be null.");
        this.valueType = Objects.requireNonNull(valueType, "Value type cannot be null.");
        this.displayFormat = Objects.requireNonNull(displayFormat, "Display format cannot be null.");
        if (valueType == ValueType.BOOLEAN) {
            throw new IllegalArgumentException("Instrument configuration values are never boolean: " + sourceTag);
        }
    }

    /** Shorthand for a float field rendered with three decimals, the most common kind. */
    public static ConfigField decimal(String sourceTag, String name, String title) {
        return new ConfigField(sourceTag, name, title, ValueType.FLOAT, "%.3f");
    }

    /** Shorthand for a free text field. */
    public static ConfigField text(String sourceTag, String name, String title) {
        return new ConfigField(sourceTag, name, title, ValueType.STRING, "%s");
    }

    /**
     * Coerces the colon-separated tokens that follow the tag into this field's type.
     *
     * @param tokens Tokens after the tag, not yet stripped.
     * @return A scalar if exactly one token is present, otherwise an unmodifiable list.
     * @throws IllegalArgumentException if a token does not parse as the declared type.
     */
    Object coerce(List<String> tokens) {
        List<Object> values = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            values.add(valueType.coerce(token.strip()));
        }
        if (values.size() == 1) {
            return values.get(0);
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Stores the extracted value. May only be called once.
     *
     * @throws IllegalStateException if the field has already been populated.
     */
    void populate(Object newValue) {
        if (value != null) {
            throw new IllegalStateException("Config field '" + name + "' (" + sourceTag + ") is already populated.");
        }
        this.value = Objects.requireNonNull(newValue, "Config value cannot be null.");
    }

    public boolean isPopulated() {
        return value != null;
    }

    /** @return The scalar or list value, or null if the tag was not found in the file. */
    public Object getValue() {
        return value;
    }

    /**
     * @return The value as a double.
     * @throws IllegalStateException if the field is unset or not a numeric scalar.
     */
    public double getDouble() {
        if (!(value instanceof Number)) {
            throw new IllegalStateException("Config field '" + name + "' does not hold a numeric scalar: " + value);
        }
        return ((Number) value).doubleValue();
    }

    /** @return The header text for this field's value, {@code n/a} if unset. */
    public String formatValue() {
        if (value == null) {
            return "n/a";
        }
        if (value instanceof List) {
            List<String> parts = new ArrayList<>();
            for (Object part : (List<?>) value) {
                parts.add(String.format(Locale.ROOT, displayFormat, part));
            }
            return String.join(":", parts);
        }
        return String.format(Locale.ROOT, displayFormat, value);
    }

    public String getSourceTag() { return sourceTag; }
    public String getName() { return name; }
    public String getTitle() { return title; }
    public ValueType getValueType() { return valueType; }
    public String getDisplayFormat() { return displayFormat; }

    @Override
    public String toString() {
        return "ConfigField[" + sourceTag + " -> " + name + "=" + value + "]";
    }
}
