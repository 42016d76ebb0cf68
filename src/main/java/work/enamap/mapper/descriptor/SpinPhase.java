package work.enamap.mapper.descriptor;

public enum SpinPhase {
    RAM("ram"),
    ANTI("anti"),
    FULL("full");

    private final String token;

    SpinPhase(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static SpinPhase fromToken(String value) {
        for (SpinPhase phase : values()) {
            if (phase.token.equals(value)) {
                return phase;
            }
        }
        throw new ConfigurationException("spin_phase", value);
    }
}
