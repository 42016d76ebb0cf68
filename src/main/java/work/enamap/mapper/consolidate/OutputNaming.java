package work.enamap.mapper.consolidate;

import java.time.Instant;
import work.enamap.mapper.dependency.DependencyResolver;
import work.enamap.mapper.descriptor.DescriptorCodec;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.shared.CatalogDates;

/**
 * {@code imap_<instrument>_<level>_<canonical descriptor>_<yyyyMMdd>_v000.<ext>}
 */
public final class OutputNaming {
    public static final String VERSION = "v000";

    private OutputNaming() {}

    public static String fileName(MapDescriptor descriptor, Instant firstWindowStart, String extension) {
        return "imap_"
            + descriptor.instrument().catalogName() + "_"
            + DependencyResolver.tierOf(descriptor).token() + "_"
            + DescriptorCodec.encode(descriptor) + "_"
            + CatalogDates.compact(firstWindowStart) + "_"
            + VERSION + "." + extension;
    }

    public static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? fileName : fileName.substring(0, dot);
    }
}
