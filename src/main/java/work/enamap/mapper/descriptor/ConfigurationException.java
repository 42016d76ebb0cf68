package work.enamap.mapper.descriptor;

import work.enamap.mapper.shared.MapperException;

/**
 * Raised for malformed descriptor fields or request settings. Always thrown before any catalog or engine I/O.
 */
public final class ConfigurationException extends MapperException {
    private final String field;
    private final String value;

    public ConfigurationException(String message) {
        super("configuration", message);
        this.field = null;
        this.value = null;
    }

    public ConfigurationException(String field, Object value) {
        super("configuration", "Invalid " + field + ": '" + value + "'");
        this.field = field;
        this.value = value == null ? null : String.valueOf(value);
    }

    public String field() {
        return field;
    }

    public String value() {
        return value;
    }
}
