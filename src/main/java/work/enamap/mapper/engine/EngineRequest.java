package work.enamap.mapper.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import work.enamap.mapper.catalog.DataLayout;
import work.enamap.mapper.catalog.ScienceCatalog;
import work.enamap.mapper.dependency.DataLevel;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.kernel.KernelPool;
import work.enamap.mapper.period.TimeWindow;

/**
 * Everything an engine needs for one invocation. {@code mapInputs} are prerequisite artifacts already on disk; the
 * other entries of {@code inputs} still have to be fetched from {@code catalog}.
 */
public record EngineRequest(
    MapDescriptor descriptor,
    DataLevel level,
    TimeWindow window,
    ProcessingInputs inputs,
    List<Path> mapInputs,
    Path workingDirectory,
    KernelPool kernelPool,
    DataLayout layout,
    ScienceCatalog catalog
) {
    public EngineRequest {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(inputs, "inputs");
        mapInputs = mapInputs == null ? List.of() : List.copyOf(mapInputs);
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(kernelPool, "kernelPool");
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(catalog, "catalog");
    }
}
