package work.enamap.mapper.catalog;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One row of a catalog query. {@code startDate} keeps the catalog's {@code yyyyMMdd} text, {@code version} its
 * {@code vNNN} text.
 */
public record CatalogFileRecord(String filePath, String descriptorTag, String startDate, String version) {
    private static final Pattern VERSION = Pattern.compile("v?(\\d+)");

    public CatalogFileRecord {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(version, "version");
        descriptorTag = descriptorTag == null ? "" : descriptorTag;
    }

    public int versionNumber() {
        Matcher matcher = VERSION.matcher(version.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Unrecognized version '" + version + "' for " + filePath);
        }
        return Integer.parseInt(matcher.group(1));
    }

    public String fileName() {
        int slash = filePath.lastIndexOf('/');
        return slash < 0 ? filePath : filePath.substring(slash + 1);
    }
}
