package work.enamap.mapper.descriptor;

/**
 * Quantity a map carries: ENA intensity or the spectral index derived from it.
 */
public enum PrincipalData {
    ENA("ena"),
    SPX("spx");

    private final String token;

    PrincipalData(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static PrincipalData fromToken(String value) {
        for (PrincipalData data : values()) {
            if (data.token.equals(value)) {
                return data;
            }
        }
        throw new ConfigurationException("principal_data", value);
    }
}
