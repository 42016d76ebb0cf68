package work.enamap.mapper.kernel;

import java.nio.file.Path;
import java.util.List;

/**
 * Ordered set of geometry kernels visible to the processing engines. Load order is significant.
 */
public interface KernelPool {
    void load(Path kernel);

    List<Path> loaded();

    void clear();

    /**
     * File the engines read the pool from, if the pool is file-backed.
     */
    Path location();
}
