package work.enamap.mapper.consolidate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.enamap.mapper.container.ScienceFileFormat;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.generate.MapGenerator;
import work.enamap.mapper.period.TimeWindow;

/**
 * Generates a map once per window and merges the artifacts into the canonical output file.
 *
 * <p>An existing output file short-circuits the run. Intermediate directories are cleaned after every run that got
 * past that check, whatever its outcome. Failures are logged and reported in the result, never thrown.</p>
 */
public final class OutputConsolidator {
    private static final Logger LOG = LoggerFactory.getLogger(OutputConsolidator.class);

    private final MapGenerator generator;
    private final ArtifactMerger merger;
    private final IntermediateCleaner cleaner;
    private final String extension;

    public OutputConsolidator(MapGenerator generator, ScienceFileFormat format, IntermediateCleaner cleaner) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.merger = new ArtifactMerger(format);
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner");
        this.extension = format.extension();
    }

    public ConsolidationResult run(MapDescriptor descriptor, List<TimeWindow> windows, Path outputDirectory, String toolConfiguration) {
        if (windows.isEmpty()) {
            throw new IllegalArgumentException("At least one window is required for " + descriptor);
        }
        String fileName = OutputNaming.fileName(descriptor, windows.get(0).start(), extension);
        Path output = outputDirectory.resolve(fileName);
        if (Files.exists(output)) {
            LOG.info("Skipping generation of map: {}, because it already exists!", fileName);
            return ConsolidationResult.skipped(output);
        }

        TimeWindow current = null;
        try {
            List<Path> artifacts = new ArrayList<>(windows.size());
            for (int i = 0; i < windows.size(); i++) {
                current = windows.get(i);
                LOG.info("Generating map {}/{}...", i + 1, windows.size());
                LOG.info("Generating map: {} {}", descriptor, current);
                artifacts.add(generator.generate(descriptor, current));
            }
            current = null;
            merger.merge(merger.sortByFirstEpoch(artifacts), output, descriptor, toolConfiguration);
            LOG.info("Created file {}", output);
            return ConsolidationResult.created(output);
        } catch (IOException | RuntimeException ex) {
            String stage = current == null ? "while merging" : "for window " + current;
            LOG.error("Failed to generate map: {} {}", descriptor, stage, ex);
            return ConsolidationResult.failed(output, ex);
        } finally {
            cleanUp(descriptor);
        }
    }

    private void cleanUp(MapDescriptor descriptor) {
        try {
            cleaner.clean(descriptor);
        } catch (IOException | RuntimeException ex) {
            LOG.error("Failed to clean intermediate files for {}", descriptor, ex);
        }
    }
}
