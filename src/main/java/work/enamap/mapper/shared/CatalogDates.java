package work.enamap.mapper.shared;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Date formats shared by the catalog, the file names and the request files. Everything is UTC.
 */
public final class CatalogDates {
    public static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    public static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter KERNEL_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd, HH:mm:ss");
    private static final Pattern OFFSET_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$");

    private CatalogDates() {}

    public static String compact(Instant instant) {
        return COMPACT_DATE.format(instant);
    }

    public static String display(Instant instant) {
        return DISPLAY_DATE.format(instant);
    }

    public static LocalDate parseCompact(String raw) {
        return LocalDate.parse(raw.trim(), DateTimeFormatter.BASIC_ISO_DATE);
    }

    /**
     * Parses the {@code min_date_datetime}/{@code max_date_datetime} values of the kernel metadata service.
     */
    public static Instant parseKernelDateTime(String raw) {
        return LocalDateTime.parse(raw.trim(), KERNEL_DATE_TIME).toInstant(ZoneOffset.UTC);
    }

    /**
     * ISO-8601 date-time with an optional offset; a missing offset means UTC. A bare date is midnight UTC.
     */
    public static Instant parseIsoInstant(String raw) {
        String trimmed = raw.trim().replace(' ', 'T');
        if (trimmed.indexOf('T') < 0) {
            return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (OFFSET_SUFFIX.matcher(trimmed).find()) {
            return OffsetDateTime.parse(trimmed).toInstant();
        }
        return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
    }

    public static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
