package work.enamap.mapper.catalog;

/**
 * Geometry kernel families, declared in the order they must be loaded.
 */
public enum KernelCategory {
    LEAPSECONDS("leapseconds"),
    SPACECRAFT_CLOCK("spacecraft_clock"),
    POINTING_ATTITUDE("pointing_attitude"),
    IMAP_FRAMES("imap_frames"),
    SCIENCE_FRAMES("science_frames");

    private final String queryType;

    KernelCategory(String queryType) {
        this.queryType = queryType;
    }

    public String queryType() {
        return queryType;
    }
}
