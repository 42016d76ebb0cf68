package work.enamap.mapper.kernel;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kernel pool materialized as a SPICE meta-kernel. The file is rewritten after every change so that an engine
 * started at any point sees exactly the kernels loaded so far.
 */
public final class MetaKernelPool implements KernelPool {
    private static final Logger LOG = LoggerFactory.getLogger(MetaKernelPool.class);

    private final Path metaKernel;
    private final List<Path> kernels = new ArrayList<>();

    public MetaKernelPool(Path metaKernel) {
        this.metaKernel = Objects.requireNonNull(metaKernel, "metaKernel").toAbsolutePath();
        write();
    }

    @Override
    public void load(Path kernel) {
        Path absolute = kernel.toAbsolutePath().normalize();
        kernels.add(absolute);
        LOG.debug("Loaded kernel {}", absolute);
        write();
    }

    @Override
    public List<Path> loaded() {
        return Collections.unmodifiableList(new ArrayList<>(kernels));
    }

    @Override
    public void clear() {
        kernels.clear();
        write();
    }

    @Override
    public Path location() {
        return metaKernel;
    }

    static String render(List<Path> kernels) {
        StringBuilder text = new StringBuilder("KPL/MK\n\n\\begindata\n\nKERNELS_TO_LOAD = (\n");
        for (int i = 0; i < kernels.size(); i++) {
            text.append("    '").append(kernels.get(i).toString().replace("'", "''")).append('\'');
            if (i < kernels.size() - 1) {
                text.append(',');
            }
            text.append('\n');
        }
        text.append(")\n\n\\begintext\n");
        return text.toString();
    }

    private void write() {
        try {
            Path parent = metaKernel.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(metaKernel, render(kernels), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write meta-kernel " + metaKernel, ex);
        }
    }
}
