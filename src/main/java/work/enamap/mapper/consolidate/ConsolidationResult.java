package work.enamap.mapper.consolidate;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of one consolidation run. {@code output} is the canonical path in every case; it only exists on disk for
 * {@link Status#CREATED} and {@link Status#SKIPPED}.
 */
public record ConsolidationResult(Status status, Path output, Throwable failure) {
    public ConsolidationResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(output, "output");
    }

    public static ConsolidationResult created(Path output) {
        return new ConsolidationResult(Status.CREATED, output, null);
    }

    public static ConsolidationResult skipped(Path output) {
        return new ConsolidationResult(Status.SKIPPED, output, null);
    }

    public static ConsolidationResult failed(Path output, Throwable failure) {
        return new ConsolidationResult(Status.FAILED, output, Objects.requireNonNull(failure, "failure"));
    }

    public enum Status {
        CREATED,
        SKIPPED,
        FAILED
    }
}
