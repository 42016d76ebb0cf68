package work.enamap.mapper.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.enamap.mapper.catalog.DataLayout;
import work.enamap.mapper.catalog.HttpDataAccessClient;
import work.enamap.mapper.catalog.KernelCatalog;
import work.enamap.mapper.catalog.ScienceCatalog;
import work.enamap.mapper.collect.TemporalFileCollector;
import work.enamap.mapper.config.MapConfiguration;
import work.enamap.mapper.config.ToolSettings;
import work.enamap.mapper.consolidate.ConsolidationResult;
import work.enamap.mapper.consolidate.LevelDirectoryCleaner;
import work.enamap.mapper.consolidate.OutputConsolidator;
import work.enamap.mapper.container.JsonScienceFileFormat;
import work.enamap.mapper.container.ScienceFileFormat;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.engine.EngineRegistry;
import work.enamap.mapper.engine.ExternalCommandEngine;
import work.enamap.mapper.generate.GenerationContext;
import work.enamap.mapper.generate.MapOrchestrator;
import work.enamap.mapper.kernel.MetaKernelPool;
import work.enamap.mapper.period.TimeWindow;
import work.enamap.mapper.shared.MapperException;

/**
 * Public entry point for embedding the mapper: runs one map request file end to end.
 */
public final class MapRunner {
    private static final Logger LOG = LoggerFactory.getLogger(MapRunner.class);
    static final String STATE_DIRECTORY = ".ena-mapper";

    private final Function<ToolSettings, Backends> backendFactory;

    public MapRunner() {
        this(MapRunner::httpBackends);
    }

    public MapRunner(Function<ToolSettings, Backends> backendFactory) {
        this.backendFactory = Objects.requireNonNull(backendFactory, "backendFactory");
    }

    public RunResult run(MapRunConfiguration configuration) {
        Instant started = Instant.now();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("request", configuration.requestFile().toString());
        try {
            MapConfiguration request = MapConfiguration.fromFile(configuration.requestFile());
            MapDescriptor descriptor = request.descriptor();
            List<TimeWindow> windows = request.windows();
            metadata.put("descriptor", descriptor.toString());
            metadata.put("windows", windows.size());

            ToolSettings settings = configuration.settings();
            Backends backends = backendFactory.apply(settings);
            DataLayout layout = new DataLayout(settings.dataDir());
            Path stateDirectory = configuration.workingDirectory().resolve(STATE_DIRECTORY);
            GenerationContext context = new GenerationContext(
                layout,
                new MetaKernelPool(stateDirectory.resolve("kernels.tm")),
                backends.engines(),
                stateDirectory
            );
            MapOrchestrator orchestrator = new MapOrchestrator(
                context,
                new TemporalFileCollector(backends.science(), backends.kernels()),
                backends.science(),
                backends.kernels(),
                request.kernelPath().map(Path::toAbsolutePath).orElse(null)
            );
            OutputConsolidator consolidator = new OutputConsolidator(
                orchestrator,
                backends.format(),
                new LevelDirectoryCleaner(layout)
            );

            Path outputDirectory = configuration.outputDirectory().orElse(request.outputDirectory());
            Files.createDirectories(outputDirectory);
            ConsolidationResult result = consolidator.run(descriptor, windows, outputDirectory, request.rawConfig());
            metadata.put("output", result.output().toString());
            switch (result.status()) {
                case CREATED:
                    return RunResult.success(metadata, started);
                case SKIPPED:
                    return RunResult.skipped(metadata, started);
                default:
                    return failure(result.failure(), metadata, started);
            }
        } catch (IOException | RuntimeException ex) {
            LOG.error("Map request {} failed: {}", configuration.requestFile(), ex.getMessage());
            LOG.debug("Failure detail", ex);
            return failure(ex, metadata, started);
        }
    }

    /**
     * Registry with one {@link ExternalCommandEngine} per configured command template.
     */
    public static EngineRegistry engineRegistry(ToolSettings settings) {
        EngineRegistry registry = new EngineRegistry();
        settings.engineCommands().forEach((instrument, levels) ->
            levels.forEach((level, command) -> registry.register(instrument, level, ExternalCommandEngine.factory(command))));
        return registry;
    }

    private static Backends httpBackends(ToolSettings settings) {
        settings.validate();
        HttpDataAccessClient client = new HttpDataAccessClient(
            settings.dataAccessUrl(),
            settings.apiKey(),
            new DataLayout(settings.dataDir())
        );
        return new Backends(client, client, new JsonScienceFileFormat(), engineRegistry(settings));
    }

    private static RunResult failure(Throwable error, Map<String, Object> metadata, Instant started) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        if (error instanceof MapperException) {
            meta.put("code", ((MapperException) error).code());
        }
        meta.put("error", rootMessage(error));
        return RunResult.failure(error.getMessage(), meta, started);
    }

    private static String rootMessage(Throwable error) {
        StringBuilder message = new StringBuilder(String.valueOf(error.getMessage()));
        Throwable cause = error.getCause();
        while (cause != null && cause != error) {
            message.append(": ").append(cause.getMessage());
            error = cause;
            cause = cause.getCause();
        }
        return message.toString();
    }

    /**
     * External collaborators of a run.
     */
    public record Backends(ScienceCatalog science, KernelCatalog kernels, ScienceFileFormat format, EngineRegistry engines) {
        public Backends {
            Objects.requireNonNull(science, "science");
            Objects.requireNonNull(kernels, "kernels");
            Objects.requireNonNull(format, "format");
            Objects.requireNonNull(engines, "engines");
        }
    }
}
