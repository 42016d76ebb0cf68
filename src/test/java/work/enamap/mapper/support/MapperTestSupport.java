package work.enamap.mapper.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import work.enamap.mapper.catalog.CatalogFileRecord;
import work.enamap.mapper.catalog.DataLayout;
import work.enamap.mapper.catalog.KernelCatalog;
import work.enamap.mapper.catalog.KernelCategory;
import work.enamap.mapper.catalog.KernelWindow;
import work.enamap.mapper.catalog.ScienceCatalog;
import work.enamap.mapper.container.JsonScienceFileFormat;
import work.enamap.mapper.container.ScienceDataset;
import work.enamap.mapper.container.ScienceVariable;
import work.enamap.mapper.descriptor.DescriptorCodec;
import work.enamap.mapper.descriptor.Instrument;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.descriptor.Sensor;
import work.enamap.mapper.descriptor.SpinPhase;
import work.enamap.mapper.descriptor.SurvivalCorrection;
import work.enamap.mapper.engine.EngineFactory;
import work.enamap.mapper.engine.EngineRequest;
import work.enamap.mapper.engine.ProcessingEngine;
import work.enamap.mapper.period.TimeWindow;
import work.enamap.mapper.shared.CatalogDates;

/**
 * Hand-written fakes for the catalog, kernel service and engines, plus small builders used across the suites.
 */
public final class MapperTestSupport {
    private MapperTestSupport() {}

    public static MapDescriptor hi(Sensor sensor, SurvivalCorrection correction, SpinPhase spinPhase) {
        return MapDescriptor.builder()
            .instrument(Instrument.HI)
            .sensor(sensor)
            .survivalCorrection(correction)
            .spinPhase(spinPhase)
            .resolution("4deg")
            .durationMonths(3)
            .build();
    }

    public static TimeWindow window(String start, String end) {
        return new TimeWindow(CatalogDates.parseIsoInstant(start), CatalogDates.parseIsoInstant(end));
    }

    public static CatalogFileRecord record(String fileName, String tag, String startDate, String version) {
        return new CatalogFileRecord("imap/some/dir/" + fileName, tag, startDate, version);
    }

    public static KernelWindow kernel(KernelCategory category, String fileName, String min, String max) {
        return new KernelWindow(category, fileName, CatalogDates.parseKernelDateTime(min), CatalogDates.parseKernelDateTime(max));
    }

    /**
     * Dataset with the given epoch values and one intensity variable governed by them.
     */
    public static ScienceDataset dataset(long... epochs) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        List<JsonNode> epochRecords = new ArrayList<>();
        List<JsonNode> intensity = new ArrayList<>();
        for (long epoch : epochs) {
            epochRecords.add(nodes.numberNode(epoch));
            intensity.add(nodes.arrayNode().add(epoch / 10.0).add(epoch / 20.0));
        }
        return new ScienceDataset()
            .putAttribute("Data_type", "L2_h90-ena-h-sf-nsp-ram-hae-4deg-3mo>Level-2 ENA Intensity Map")
            .putAttribute("Logical_source", "imap_hi_l2_h90-ena-h-sf-nsp-ram-hae-4deg-3mo")
            .putVariable(new ScienceVariable(ScienceDataset.EPOCH, Map.of(), epochRecords))
            .putVariable(new ScienceVariable("ena_intensity", Map.of(ScienceVariable.DEPEND_0, "epoch"), intensity))
            .putVariable(new ScienceVariable("energy", Map.of(), List.of(nodes.numberNode(1), nodes.numberNode(2))));
    }

    /**
     * Catalog answering from canned records. Unknown queries return nothing; downloads create empty local files.
     */
    public static final class FakeScienceCatalog implements ScienceCatalog {
        private final Map<String, List<CatalogFileRecord>> responses = new HashMap<>();
        private final Map<String, List<CatalogFileRecord>> ancillary = new HashMap<>();
        private final List<String> queries = new ArrayList<>();
        private final List<String> downloads = new ArrayList<>();
        private final DataLayout layout;

        public FakeScienceCatalog(DataLayout layout) {
            this.layout = layout;
        }

        public FakeScienceCatalog respond(String instrument, String level, String tag, List<CatalogFileRecord> records) {
            responses.put(instrument + "/" + level + "/" + tag, List.copyOf(records));
            return this;
        }

        public FakeScienceCatalog respondAncillary(String instrument, List<CatalogFileRecord> records) {
            ancillary.put(instrument, List.copyOf(records));
            return this;
        }

        public List<String> queries() {
            return queries;
        }

        public List<String> downloads() {
            return downloads;
        }

        @Override
        public List<CatalogFileRecord> query(String instrument, String dataLevel, String descriptorTag, String startDate, String endDate) {
            queries.add(instrument + "/" + dataLevel + "/" + descriptorTag + " " + startDate + "-" + endDate);
            return responses.getOrDefault(instrument + "/" + dataLevel + "/" + descriptorTag, List.of());
        }

        @Override
        public List<CatalogFileRecord> queryAncillary(String instrument) {
            queries.add("ancillary/" + instrument);
            return ancillary.getOrDefault(instrument, List.of());
        }

        @Override
        public Path download(String fileName) {
            downloads.add(fileName);
            return touch(layout.sciencePath(fileName));
        }
    }

    public static final class FakeKernelCatalog implements KernelCatalog {
        private final Map<KernelCategory, List<KernelWindow>> windows = new EnumMap<>(KernelCategory.class);
        private final List<KernelCategory> requested = new ArrayList<>();
        private final DataLayout layout;

        public FakeKernelCatalog(DataLayout layout) {
            this.layout = layout;
        }

        public FakeKernelCatalog add(KernelWindow window) {
            windows.computeIfAbsent(window.category(), key -> new ArrayList<>()).add(window);
            return this;
        }

        public List<KernelCategory> requested() {
            return requested;
        }

        @Override
        public List<KernelWindow> windows(KernelCategory category) {
            requested.add(category);
            return windows.getOrDefault(category, List.of());
        }

        @Override
        public Path download(KernelWindow kernel) {
            return touch(layout.kernelPath(kernel.fileName()));
        }
    }

    /**
     * Engine writing one JSON artifact per invocation into the archive layout, with two epochs at the window start.
     * Every invocation is recorded as {@code <level>:<pipeline descriptor>}.
     */
    public static final class RecordingEngines {
        private final List<String> invocations = new ArrayList<>();
        private final List<EngineRequest> requests = new ArrayList<>();
        private final List<List<Path>> kernelsAtCompute = new ArrayList<>();
        private int outputsPerRun = 1;
        private RuntimeException computeFailure;
        private int released;

        public List<String> invocations() {
            return invocations;
        }

        public List<EngineRequest> requests() {
            return requests;
        }

        public List<List<Path>> kernelsAtCompute() {
            return kernelsAtCompute;
        }

        public int released() {
            return released;
        }

        public RecordingEngines outputsPerRun(int count) {
            this.outputsPerRun = count;
            return this;
        }

        public RecordingEngines failCompute(RuntimeException failure) {
            this.computeFailure = failure;
            return this;
        }

        public EngineFactory factory() {
            return request -> new ProcessingEngine<String, List<Path>>() {
                @Override
                public String prepareInputs() {
                    invocations.add(request.level().token() + ":" + DescriptorCodec.encodePipeline(request.descriptor()));
                    requests.add(request);
                    return request.inputs().serialize();
                }

                @Override
                public List<Path> compute(String inputs) throws IOException {
                    kernelsAtCompute.add(request.kernelPool().loaded());
                    if (computeFailure != null) {
                        throw computeFailure;
                    }
                    List<Path> written = new ArrayList<>();
                    for (int i = 0; i < outputsPerRun; i++) {
                        written.add(writeArtifact(request, i));
                    }
                    return written;
                }

                @Override
                public List<Path> finalizeOutputs(List<Path> results, String inputs) {
                    return results;
                }

                @Override
                public void releaseResources() {
                    released++;
                }
            };
        }

        private static Path writeArtifact(EngineRequest request, int index) throws IOException {
            String level = request.level().token();
            String name = "imap_" + request.descriptor().instrument().catalogName() + "_" + level + "_"
                + DescriptorCodec.encodePipeline(request.descriptor()) + "_"
                + CatalogDates.compact(request.window().start()) + "_v00" + index + ".json";
            Path target = request.layout().sciencePath(name);
            Files.createDirectories(target.getParent());
            long epoch = request.window().start().getEpochSecond();
            new JsonScienceFileFormat().write(dataset(epoch, epoch + 60), target);
            return target;
        }
    }

    public static Instant instant(String iso) {
        return CatalogDates.parseIsoInstant(iso);
    }

    private static Path touch(Path path) {
        try {
            Files.createDirectories(path.getParent());
            if (!Files.exists(path)) {
                Files.createFile(path);
            }
            return path;
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
