package work.enamap.mapper.descriptor;

import java.util.Locale;

/**
 * Sensor head of a HI or ULTRA map. Instruments without sensor heads use {@link #NONE}.
 */
public enum Sensor {
    SENSOR_45("45"),
    SENSOR_90("90"),
    COMBINED("combined"),
    NONE("");

    private final String token;

    Sensor(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Sensor fromToken(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (Sensor sensor : values()) {
            if (sensor.token.equals(normalized)) {
                return sensor;
            }
        }
        throw new ConfigurationException("sensor", value);
    }
}
