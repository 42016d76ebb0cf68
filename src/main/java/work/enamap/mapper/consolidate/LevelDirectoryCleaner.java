package work.enamap.mapper.consolidate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.enamap.mapper.catalog.DataLayout;
import work.enamap.mapper.dependency.DataLevel;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.shared.FileTrees;

/**
 * Deletes the whole {@code imap/<instrument>/l2} and {@code l3} trees of the data directory.
 */
public final class LevelDirectoryCleaner implements IntermediateCleaner {
    private static final Logger LOG = LoggerFactory.getLogger(LevelDirectoryCleaner.class);

    private final DataLayout layout;

    public LevelDirectoryCleaner(DataLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    @Override
    public void clean(MapDescriptor descriptor) throws IOException {
        for (DataLevel level : new DataLevel[] {DataLevel.L2, DataLevel.L3}) {
            Path directory = layout.instrumentLevelDir(descriptor.instrument().catalogName(), level.token());
            if (FileTrees.deleteRecursively(directory)) {
                LOG.info("Cleaning up {}", directory);
            }
        }
    }
}
