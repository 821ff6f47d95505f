package de.anton.spectro.processor.spectro_processor.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Caller supplied parameters keyed by the names in {@link Parameters}. Values may be stored typed
 * (Integer, Double, Boolean, String) or as text; text is converted with the type the key is declared
 * with when it is read.
 */
public class ParameterBundle {

    private static final Logger logger = LoggerFactory.getLogger(ParameterBundle.class);

    private final Map<String, Object> values = new LinkedHashMap<>();

    public ParameterBundle() {
    }

    public ParameterBundle(Map<String, ?> initial) {
        initial.forEach(this::put);
    }

    /**
     * Loads a bundle from a {@code .properties} file (UTF-8). Keys are the parameter names, values are text.
     *
     * @throws IOException if the file cannot be read.
     */
    public static ParameterBundle fromProperties(Path file) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        ParameterBundle bundle = fromProperties(properties);
        logger.info("Loaded {} parameters from {}", bundle.values.size(), file);
        return bundle;
    }

    public static ParameterBundle fromProperties(Properties properties) {
        ParameterBundle bundle = new ParameterBundle();
        for (String key : properties.stringPropertyNames()) {
            if (Parameters.spec(key).isEmpty()) {
                logger.warn("Ignoring unknown parameter '{}'", key);
                continue;
            }
            bundle.put(key, properties.getProperty(key).strip());
        }
        return bundle;
    }

    /**
     * Builds a bundle holding a placeholder value for every required parameter of the given declarations.
     */
    public static ParameterBundle placeholdersFor(Collection<ParameterSpec> specs) {
        ParameterBundle bundle = new ParameterBundle();
        for (ParameterSpec spec : specs) {
            if (spec.required()) {
                bundle.put(spec.key(), spec.placeholder());
            }
        }
        return bundle;
    }

    public ParameterBundle put(String key, Object value) {
        Objects.requireNonNull(key, "Parameter key cannot be null.");
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
        return this;
    }

    /** Copies every value of {@code other} into this bundle, overriding existing keys. */
    public ParameterBundle putAll(ParameterBundle other) {
        values.putAll(other.values);
        return this;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * Checks that every required declaration is present and that every present value converts to its type.
     *
     * @throws ConfigurationException naming all missing keys, or the first key whose value does not convert.
     */
    public void requireAll(Collection<ParameterSpec> specs) throws ConfigurationException {
        List<String> missing = new ArrayList<>();
        for (ParameterSpec spec : specs) {
            if (!values.containsKey(spec.key())) {
                if (spec.required()) {
                    missing.add(spec.key());
                }
                continue;
            }
            convert(spec.key(), spec.type());
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required parameter(s): " + String.join(", ", missing), missing);
        }
    }

    // --- Typed access ---

    public double getDouble(String key) throws ConfigurationException {
        return ((Number) require(key, ValueType.FLOAT)).doubleValue();
    }

    public int getInt(String key) throws ConfigurationException {
        return ((Number) require(key, ValueType.INT)).intValue();
    }

    public String getString(String key) throws ConfigurationException {
        return (String) require(key, ValueType.STRING);
    }

    /** @return The value, or {@code defaultValue} if the key is absent. */
    public boolean getBoolean(String key, boolean defaultValue) throws ConfigurationException {
        if (!values.containsKey(key)) {
            return defaultValue;
        }
        return (Boolean) convert(key, ValueType.BOOLEAN);
    }

    public Optional<Double> optionalDouble(String key) throws ConfigurationException {
        if (!values.containsKey(key)) {
            return Optional.empty();
        }
        return Optional.of(((Number) convert(key, ValueType.FLOAT)).doubleValue());
    }

    /** @return The text value, empty if absent or blank. */
    public Optional<String> optionalString(String key) throws ConfigurationException {
        if (!values.containsKey(key)) {
            return Optional.empty();
        }
        String text = (String) convert(key, ValueType.STRING);
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    private Object require(String key, ValueType type) throws ConfigurationException {
        if (!values.containsKey(key)) {
            throw new ConfigurationException("Missing required parameter: " + key, List.of(key));
        }
        return convert(key, type);
    }

    private Object convert(String key, ValueType type) throws ConfigurationException {
        Object raw = values.get(key);
        if (type.accepts(raw)) {
            return raw;
        }
        if (raw instanceof String) {
            try {
                return type.coerce((String) raw);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Parameter " + key + " must be of type " + type + ", got '" + raw + "'", List.of(key));
            }
        }
        throw new ConfigurationException("Parameter " + key + " must be of type " + type + ", got " + raw.getClass().getSimpleName(), List.of(key));
    }

    @Override
    public String toString() {
        return "ParameterBundle" + values;
    }
}
