package work.enamap.mapper.generate;

import java.nio.file.Path;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.period.TimeWindow;

/**
 * Produces the artifact of one map over one window.
 */
@FunctionalInterface
public interface MapGenerator {
    Path generate(MapDescriptor descriptor, TimeWindow window);
}
