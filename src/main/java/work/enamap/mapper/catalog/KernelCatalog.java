package work.enamap.mapper.catalog;

import java.nio.file.Path;
import java.util.List;

/**
 * Geometry kernel metadata service.
 */
public interface KernelCatalog {
    /**
     * Every known kernel of the category, in catalog order.
     */
    List<KernelWindow> windows(KernelCategory category);

    Path download(KernelWindow kernel);
}
