package work.enamap.mapper.consolidate;

import java.io.IOException;
import work.enamap.mapper.descriptor.MapDescriptor;

/**
 * Removes the intermediate artifacts a run may have left behind.
 */
public interface IntermediateCleaner {
    void clean(MapDescriptor descriptor) throws IOException;
}
