package work.enamap.mapper.period;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import work.enamap.mapper.descriptor.ConfigurationException;
import work.enamap.mapper.shared.CatalogDates;

/**
 * Recurring map windows anchored on a quarter of a year.
 *
 * <p>Boundaries use a 365.25-day year: a quarter is 7,889,400 s and a month 2,629,800 s after January 1st.
 * They are deliberately not calendar-aligned; output file names depend on this arithmetic.</p>
 */
public record CanonicalMapPeriod(int year, int quarter, int mapPeriodMonths, int numberOfMaps) {
    public static final Duration AVERAGE_YEAR = Duration.ofSeconds(31_557_600L);
    private static final Duration QUARTER = AVERAGE_YEAR.dividedBy(4);
    private static final Duration MONTH = AVERAGE_YEAR.dividedBy(12);

    public CanonicalMapPeriod {
        if (year < Year.MIN_VALUE || year > Year.MAX_VALUE) {
            throw new ConfigurationException("year", year);
        }
        if (quarter < 1 || quarter > 4) {
            throw new ConfigurationException("quarter", quarter);
        }
        if (mapPeriodMonths < 1) {
            throw new ConfigurationException("map_period", mapPeriodMonths);
        }
        if (numberOfMaps < 1) {
            throw new ConfigurationException("number_of_maps", numberOfMaps);
        }
    }

    public List<TimeWindow> windows() {
        try {
            return buildWindows();
        } catch (DateTimeException | ArithmeticException ex) {
            throw new ConfigurationException("canonical_map_period", this);
        }
    }

    private List<TimeWindow> buildWindows() {
        Instant start = CatalogDates.startOfDay(LocalDate.of(year, 1, 1)).plus(QUARTER.multipliedBy(quarter - 1L));
        Duration length = MONTH.multipliedBy(mapPeriodMonths);
        List<TimeWindow> windows = new ArrayList<>(numberOfMaps);
        for (int i = 0; i < numberOfMaps; i++) {
            Instant end = start.plus(length);
            windows.add(new TimeWindow(start, end));
            start = end;
        }
        return List.copyOf(windows);
    }
}
