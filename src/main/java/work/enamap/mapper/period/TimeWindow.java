package work.enamap.mapper.period;

import java.time.Instant;
import java.util.Objects;
import work.enamap.mapper.shared.CatalogDates;

/**
 * Half-open UTC interval {@code [start, end)}.
 */
public record TimeWindow(Instant start, Instant end) {
    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start " + start + " must precede end " + end);
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    @Override
    public String toString() {
        return CatalogDates.display(start) + " to " + CatalogDates.display(end);
    }
}
