package work.enamap.mapper.catalog;

import java.time.Instant;
import java.util.Objects;

/**
 * Validity interval of one kernel file, closed on both ends.
 */
public record KernelWindow(KernelCategory category, String fileName, Instant minDate, Instant maxDate) {
    public KernelWindow {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(minDate, "minDate");
        Objects.requireNonNull(maxDate, "maxDate");
    }

    /**
     * {@code minDate <= end && start < maxDate}. A kernel that ends exactly at {@code start} is not selected.
     */
    public boolean overlaps(Instant start, Instant end) {
        return !minDate.isAfter(end) && start.isBefore(maxDate);
    }

    public String baseName() {
        int slash = fileName.lastIndexOf('/');
        return slash < 0 ? fileName : fileName.substring(slash + 1);
    }
}
