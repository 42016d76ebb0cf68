package work.enamap.mapper.shared;

/**
 * Base for every failure raised by the mapper. The {@link #code()} is stable and ends up in run summaries.
 */
public class MapperException extends RuntimeException {
    private final String code;

    public MapperException(String code, String message) {
        super(message);
        this.code = code;
    }

    public MapperException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
