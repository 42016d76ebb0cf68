package work.enamap.mapper.consolidate;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.enamap.mapper.container.EpochOrder;
import work.enamap.mapper.container.ScienceDataset;
import work.enamap.mapper.container.ScienceFileFormat;
import work.enamap.mapper.container.ScienceVariable;
import work.enamap.mapper.dependency.DependencyResolver;
import work.enamap.mapper.descriptor.DescriptorCodec;
import work.enamap.mapper.descriptor.MapDescriptor;

/**
 * Concatenates per-window artifacts along the epoch axis and stamps the provenance of the merged product.
 */
public final class ArtifactMerger {
    private static final Logger LOG = LoggerFactory.getLogger(ArtifactMerger.class);

    public static final String LOGICAL_SOURCE = "Logical_source";
    public static final String LOGICAL_FILE_ID = "Logical_file_id";
    public static final String TOOL_CONFIGURATION = "Mapper_tool_configuration";
    public static final String DATA_TYPE = "Data_type";

    private final ScienceFileFormat format;

    public ArtifactMerger(ScienceFileFormat format) {
        this.format = Objects.requireNonNull(format, "format");
    }

    /**
     * Artifacts ordered by their first epoch value.
     */
    public List<Path> sortByFirstEpoch(List<Path> artifacts) throws IOException {
        List<Keyed> keyed = new ArrayList<>();
        for (Path artifact : artifacts) {
            keyed.add(new Keyed(format.read(artifact).firstEpoch(), artifact));
        }
        keyed.sort(Comparator.comparing(Keyed::firstEpoch, EpochOrder.INSTANCE));
        List<Path> sorted = new ArrayList<>(keyed.size());
        keyed.forEach(entry -> sorted.add(entry.path()));
        return sorted;
    }

    /**
     * Writes the merge of {@code sortedArtifacts} to {@code output}. The file only appears at {@code output} once it
     * is complete.
     */
    public void merge(List<Path> sortedArtifacts, Path output, MapDescriptor descriptor, String toolConfiguration) throws IOException {
        if (sortedArtifacts.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge into " + output);
        }
        ScienceDataset merged = format.read(sortedArtifacts.get(0));
        for (Path additional : sortedArtifacts.subList(1, sortedArtifacts.size())) {
            append(merged, format.read(additional), additional);
        }
        stampProvenance(merged, output, descriptor, toolConfiguration);

        Path parent = output.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path partial = Files.createTempFile(parent, "." + output.getFileName(), ".part");
        try {
            format.write(merged, partial);
            moveIntoPlace(partial, output);
        } finally {
            Files.deleteIfExists(partial);
        }
        LOG.debug("Merged {} artifacts into {}", sortedArtifacts.size(), output);
    }

    static void append(ScienceDataset base, ScienceDataset additional, Path source) {
        for (ScienceVariable variable : base.timeSeriesVariables()) {
            ScienceVariable extra = additional.variable(variable.name())
                .orElseThrow(() -> new IllegalStateException("Variable " + variable.name() + " missing from " + source));
            base.putVariable(variable.append(extra.records()));
        }
    }

    static void stampProvenance(ScienceDataset dataset, Path output, MapDescriptor descriptor, String toolConfiguration) {
        String canonical = DescriptorCodec.encode(descriptor);
        dataset.putAttribute(LOGICAL_SOURCE, canonical);
        dataset.putAttribute(LOGICAL_FILE_ID, OutputNaming.stem(output.getFileName().toString()));
        dataset.putAttribute(TOOL_CONFIGURATION, toolConfiguration == null ? "" : toolConfiguration);

        String dataType = dataset.attribute(DATA_TYPE).orElse("");
        int separator = dataType.indexOf('>');
        String description = separator < 0 ? "" : dataType.substring(separator + 1);
        dataset.putAttribute(DATA_TYPE, DependencyResolver.tierOf(descriptor).upperToken() + "_" + canonical + ">" + description);
    }

    private static void moveIntoPlace(Path partial, Path output) throws IOException {
        try {
            Files.move(partial, output, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            LOG.debug("Atomic move unavailable for {}, falling back to replace", output);
            Files.move(partial, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private record Keyed(JsonNode firstEpoch, Path path) {}
}
