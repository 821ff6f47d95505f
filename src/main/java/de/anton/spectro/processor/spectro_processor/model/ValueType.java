package de.anton.spectro.processor.spectro_processor.model;

import java.util.Locale;

/**
 * Value types understood by configuration fields and caller parameters.
 * Each constant converts the textual form found in instrument files or on the command line.
 */
public enum ValueType {
    STRING("str") {
        @Override
        public Object coerce(String text) {
            return text;
        }
    },
    INT("int") {
        @Override
        public Object coerce(String text) {
            return Integer.parseInt(text.trim());
        }
    },
    FLOAT("float") {
        @Override
        public Object coerce(String text) {
            return Double.parseDouble(text.trim());
        }
    },
    BOOLEAN("bool") {
        @Override
        public Object coerce(String text) {
            switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "true": case "yes": case "1":
                    return Boolean.TRUE;
                case "false": case "no": case "0":
                    return Boolean.FALSE;
                default:
                    throw new IllegalArgumentException("Not a boolean: '" + text + "'");
            }
        }
    };

    private final String displayName;

    ValueType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Converts a text token into this type.
     *
     * @param text The token, surrounding whitespace is ignored for numeric types.
     * @return Integer, Double, Boolean or String depending on the constant.
     * @throws IllegalArgumentException (including NumberFormatException) if the token does not parse.
     */
    public abstract Object coerce(String text);

    /**
     * Checks whether an already typed value can stand for this type without conversion.
     * Integers are accepted for FLOAT.
     */
    public boolean accepts(Object value) {
        switch (this) {
            case STRING: return value instanceof String;
            case INT: return value instanceof Integer || value instanceof Long;
            case FLOAT: return value instanceof Number;
            case BOOLEAN: return value instanceof Boolean;
            default: return false;
        }
    }

    @Override
    public String toString() {
        return displayName;
    }
}
