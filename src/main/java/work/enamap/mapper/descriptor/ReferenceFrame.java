package work.enamap.mapper.descriptor;

/**
 * Frame the map is built in: spacecraft, heliospheric or heliospheric kinematic.
 */
public enum ReferenceFrame {
    SPACECRAFT("sf"),
    HELIOSPHERIC("hf"),
    HELIOSPHERIC_KINEMATIC("hk");

    private final String token;

    ReferenceFrame(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static ReferenceFrame fromToken(String value) {
        for (ReferenceFrame frame : values()) {
            if (frame.token.equals(value)) {
                return frame;
            }
        }
        throw new ConfigurationException("frame_descriptor", value);
    }
}
