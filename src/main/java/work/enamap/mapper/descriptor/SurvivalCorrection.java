package work.enamap.mapper.descriptor;

public enum SurvivalCorrection {
    SP("sp"),
    NSP("nsp");

    private final String token;

    SurvivalCorrection(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static SurvivalCorrection fromToken(String value) {
        for (SurvivalCorrection correction : values()) {
            if (correction.token.equals(value)) {
                return correction;
            }
        }
        throw new ConfigurationException("survival_corrected", value);
    }
}
