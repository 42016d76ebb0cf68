package work.enamap.mapper.config;

import java.util.Locale;
import java.util.Set;

/**
 * Frame names that resolve without a custom frame kernel.
 */
public final class CoordinateFrames {
    private static final Set<String> SPICE_FRAMES = Set.of(
        "J2000",
        "ECLIPJ2000",
        "ITRF93",
        "IMAP_SPACECRAFT",
        "IMAP_LO_BASE",
        "IMAP_LO",
        "IMAP_LO_STAR_SENSOR",
        "IMAP_ULTRA_45",
        "IMAP_ULTRA_90",
        "IMAP_HI_45",
        "IMAP_HI_90",
        "IMAP_GLOWS",
        "IMAP_DPS",
        "IMAP_EARTHFIXED",
        "IMAP_RTN",
        "IMAP_GSE",
        "IMAP_GSM",
        "IMAP_SMD",
        "IMAP_HAE",
        "IMAP_HNU",
        "IMAP_GCS",
        "IMAP_MDI"
    );
    private static final Set<String> MAP_FRAMES = Set.of("hae", "hnu", "gcs", "rtn");

    private CoordinateFrames() {}

    public static boolean isKnown(String frameName) {
        if (frameName == null || frameName.isBlank()) {
            return false;
        }
        String trimmed = frameName.trim();
        return SPICE_FRAMES.contains(trimmed) || MAP_FRAMES.contains(trimmed.toLowerCase(Locale.ROOT));
    }

    /**
     * Coordinate system token of a frame name: letters and digits only, lower case.
     */
    public static String coordinateSystem(String frameName) {
        return frameName.replaceAll("[^A-Za-z0-9]", "").toLowerCase(Locale.ROOT);
    }
}
