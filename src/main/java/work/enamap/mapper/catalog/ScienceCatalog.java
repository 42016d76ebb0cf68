package work.enamap.mapper.catalog;

import java.nio.file.Path;
import java.util.List;

/**
 * Read-only view of the science and ancillary file catalog. Dates are {@code yyyyMMdd}, UTC.
 */
public interface ScienceCatalog {
    List<CatalogFileRecord> query(String instrument, String dataLevel, String descriptorTag, String startDate, String endDate);

    List<CatalogFileRecord> queryAncillary(String instrument);

    /**
     * Ensures the named file is present in the local data directory and returns its location.
     */
    Path download(String fileName);
}
