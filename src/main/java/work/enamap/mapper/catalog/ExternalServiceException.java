package work.enamap.mapper.catalog;

import java.net.URI;
import work.enamap.mapper.shared.MapperException;

/**
 * Catalog or kernel service failure. Never retried.
 */
public final class ExternalServiceException extends MapperException {
    private final URI uri;
    private final int status;

    public ExternalServiceException(URI uri, int status) {
        super("external_service", "HTTP " + status + " from " + uri);
        this.uri = uri;
        this.status = status;
    }

    public ExternalServiceException(URI uri, String message, Throwable cause) {
        super("external_service", message + ": " + uri, cause);
        this.uri = uri;
        this.status = -1;
    }

    public URI uri() {
        return uri;
    }

    /**
     * HTTP status, or -1 when the request never completed.
     */
    public int status() {
        return status;
    }
}
