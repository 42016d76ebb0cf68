package work.enamap.mapper.engine;

/**
 * Kind of an entry in a {@link ProcessingInputs} collection.
 */
public enum InputType {
    SCIENCE("science"),
    ANCILLARY("ancillary"),
    SPICE("spice");

    private final String token;

    InputType(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }
}
