package work.enamap.mapper.descriptor;

import java.util.Locale;

/**
 * Instruments a map request can name. Only HI, LO and ULTRA produce maps.
 */
public enum Instrument {
    HI,
    LO,
    ULTRA,
    GLOWS,
    IDEX;

    /**
     * Lower-case name used by the catalog and in file names ({@code hi}, {@code ultra}, ...).
     */
    public String catalogName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean hasSensors() {
        return this == HI || this == ULTRA;
    }

    public static Instrument from(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("instrument", value);
        }
        try {
            return Instrument.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("instrument", value);
        }
    }
}
