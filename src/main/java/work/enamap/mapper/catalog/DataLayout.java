package work.enamap.mapper.catalog;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Archive layout of the local data directory.
 *
 * <ul>
 *   <li>science: {@code imap/<inst>/<level>/<yyyy>/<mm>/<file>}</li>
 *   <li>ancillary: {@code imap/ancillary/<inst>/<file>}</li>
 *   <li>kernels: {@code imap/spice/<kind>/<file>}, the kind chosen from the extension</li>
 * </ul>
 */
public final class DataLayout {
    private static final Pattern LEVEL = Pattern.compile("l\\d[a-z]?");
    private static final Pattern DATE = Pattern.compile("\\d{8}.*");
    private static final Map<String, String> KERNEL_DIRECTORIES = Map.of(
        "tls", "lsk",
        "tsc", "sclk",
        "bc", "ck",
        "tf", "fk",
        "bsp", "spk",
        "tpc", "pck",
        "bpc", "pck",
        "ti", "ik",
        "tm", "mk"
    );

    private final Path dataDir;

    public DataLayout(Path dataDir) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir").toAbsolutePath().normalize();
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path instrumentLevelDir(String instrument, String level) {
        return dataDir.resolve("imap").resolve(instrument).resolve(level);
    }

    /**
     * Location of an {@code imap_<inst>_<level>_<descriptor>_<yyyyMMdd>_<version>.<ext>} or
     * {@code imap_<inst>_<descriptor>_<yyyyMMdd>_<version>.<ext>} (ancillary) file, relative to the data directory.
     */
    public String relativeSciencePath(String fileName) {
        String[] parts = fileName.split("_");
        if (parts.length < 5 || !"imap".equals(parts[0])) {
            throw new IllegalArgumentException("Not an archive file name: " + fileName);
        }
        String instrument = parts[1];
        if (!LEVEL.matcher(parts[2]).matches()) {
            return "imap/ancillary/" + instrument + "/" + fileName;
        }
        String date = parts[4];
        if (!DATE.matcher(date).matches()) {
            throw new IllegalArgumentException("No start date in file name: " + fileName);
        }
        return "imap/" + instrument + "/" + parts[2] + "/" + date.substring(0, 4) + "/" + date.substring(4, 6) + "/" + fileName;
    }

    public String relativeKernelPath(String kernelName) {
        String baseName = kernelName.substring(kernelName.lastIndexOf('/') + 1);
        int dot = baseName.lastIndexOf('.');
        String extension = dot < 0 ? "" : baseName.substring(dot + 1).toLowerCase(Locale.ROOT);
        String kind = KERNEL_DIRECTORIES.get(extension);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown kernel type: " + kernelName);
        }
        return "imap/spice/" + kind + "/" + baseName;
    }

    public Path sciencePath(String fileName) {
        return dataDir.resolve(relativeSciencePath(fileName));
    }

    public Path kernelPath(String kernelName) {
        return dataDir.resolve(relativeKernelPath(kernelName));
    }
}
