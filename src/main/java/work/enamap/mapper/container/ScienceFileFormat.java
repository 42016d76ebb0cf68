package work.enamap.mapper.container;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads and writes science files of one container format.
 */
public interface ScienceFileFormat {
    ScienceDataset read(Path file) throws IOException;

    void write(ScienceDataset dataset, Path file) throws IOException;

    /**
     * File extension without the dot.
     */
    String extension();
}
