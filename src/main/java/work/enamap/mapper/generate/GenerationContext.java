package work.enamap.mapper.generate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.enamap.mapper.catalog.DataLayout;
import work.enamap.mapper.engine.EngineRegistry;
import work.enamap.mapper.kernel.KernelPool;
import work.enamap.mapper.shared.FileTrees;

/**
 * Resources shared by the generation calls of one run: the data layout, the kernel pool, the engine registry and
 * the working directory stack. Not thread safe; one context serves one sequential run.
 */
public final class GenerationContext {
    private static final Logger LOG = LoggerFactory.getLogger(GenerationContext.class);

    private final DataLayout layout;
    private final KernelPool kernelPool;
    private final EngineRegistry engines;
    private final Path baseWorkingDirectory;
    private final Deque<Path> workingDirectories = new ArrayDeque<>();

    public GenerationContext(DataLayout layout, KernelPool kernelPool, EngineRegistry engines, Path baseWorkingDirectory) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.kernelPool = Objects.requireNonNull(kernelPool, "kernelPool");
        this.engines = Objects.requireNonNull(engines, "engines");
        this.baseWorkingDirectory = Objects.requireNonNull(baseWorkingDirectory, "baseWorkingDirectory")
            .toAbsolutePath()
            .normalize();
    }

    public DataLayout layout() {
        return layout;
    }

    public KernelPool kernelPool() {
        return kernelPool;
    }

    public EngineRegistry engines() {
        return engines;
    }

    public Path workingDirectory() {
        Path current = workingDirectories.peek();
        return current == null ? baseWorkingDirectory : current;
    }

    /**
     * Switches to a fresh scratch directory until the returned scope is closed. Closing restores the previous
     * working directory and removes the scratch directory.
     */
    public Scope enterScratch(String label) {
        Path scratch;
        try {
            Files.createDirectories(baseWorkingDirectory);
            scratch = Files.createTempDirectory(baseWorkingDirectory, "scratch-" + label + "-");
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to create scratch directory under " + baseWorkingDirectory, ex);
        }
        workingDirectories.push(scratch);
        return new Scope(scratch);
    }

    public final class Scope implements AutoCloseable {
        private final Path directory;
        private boolean closed;

        private Scope(Path directory) {
            this.directory = directory;
        }

        public Path directory() {
            return directory;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            workingDirectories.remove(directory);
            try {
                FileTrees.deleteRecursively(directory);
            } catch (IOException ex) {
                LOG.warn("Unable to remove scratch directory {}: {}", directory, ex.getMessage());
            }
        }
    }
}
