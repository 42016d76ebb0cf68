package work.enamap.mapper.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.enamap.mapper.support.MapperTestSupport.record;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.enamap.mapper.catalog.DataLayout;
import work.enamap.mapper.config.ToolSettings;
import work.enamap.mapper.container.JsonScienceFileFormat;
import work.enamap.mapper.dependency.DataLevel;
import work.enamap.mapper.descriptor.Instrument;
import work.enamap.mapper.engine.EngineRegistry;
import work.enamap.mapper.support.MapperTestSupport.FakeKernelCatalog;
import work.enamap.mapper.support.MapperTestSupport.FakeScienceCatalog;
import work.enamap.mapper.support.MapperTestSupport.RecordingEngines;

class MapRunnerTest {
    private static final String OUTPUT_NAME = "imap_hi_l2_h45-ena-h-sf-nsp-anti-eclipj2000-4deg-3mo-mapper_20250101_v000.json";

    @TempDir
    Path root;

    private ToolSettings settings;
    private FakeScienceCatalog science;
    private RecordingEngines engines;
    private MapRunner runner;
    private Path request;

    @BeforeEach
    void setUp() throws IOException {
        settings = ToolSettings.load(null, Map.of(ToolSettings.ENV_DATA_DIR, root.resolve("data").toString()));
        var layout = new DataLayout(settings.dataDir());
        science = new FakeScienceCatalog(layout);
        engines = new RecordingEngines();
        var registry = new EngineRegistry().register(Instrument.HI, DataLevel.L2, engines.factory());
        var kernels = new FakeKernelCatalog(layout);
        runner = new MapRunner(ignored -> new MapRunner.Backends(science, kernels, new JsonScienceFileFormat(), registry));

        request = root.resolve("h45-anti.yaml");
        Files.writeString(request, "instrument: Hi 45\n"
            + "spin_phase: Anti-Ram\n"
            + "reference_frame_type: spacecraft\n"
            + "survival_corrected: false\n"
            + "spice_frame_name: ECLIPJ2000\n"
            + "pixelation_scheme: square\n"
            + "pixel_parameter: 4\n"
            + "map_data_type: ENA Intensity\n"
            + "output_directory: " + root.resolve("from-request") + "\n"
            + "canonical_map_period: {year: 2025, quarter: 1, map_period: 3, number_of_maps: 2}\n");
    }

    private MapRunConfiguration configuration(Path requestFile) {
        return MapRunConfiguration.builder()
            .requestFile(requestFile)
            .settings(settings)
            .outputDirectory(Optional.of(root.resolve("out")))
            .workingDirectory(root)
            .build();
    }

    @Test
    void producesOutputAndSkipsOnRerun() {
        science.respond("hi", "l1c", "45sensor-pset", List.of(
            record("imap_hi_l1c_45sensor-pset_20250110_v001.cdf", "45sensor-pset", "20250110", "v001")
        ));

        var first = runner.run(configuration(request));

        assertEquals(RunResult.Status.SUCCESS, first.status());
        Path output = root.resolve("out").resolve(OUTPUT_NAME);
        assertTrue(Files.isRegularFile(output));
        assertEquals(output.toString(), first.metadata().get("output"));
        assertEquals("h45-ena-h-sf-nsp-anti-eclipj2000-4deg-3mo-mapper", first.metadata().get("descriptor"));
        assertEquals(2, first.metadata().get("windows"));
        assertEquals(2, engines.invocations().size());
        assertFalse(Files.exists(root.resolve("data/imap/hi/l2")));
        assertFalse(Files.exists(root.resolve("from-request")));

        var second = runner.run(configuration(request));

        assertEquals(RunResult.Status.SKIPPED, second.status());
        assertEquals(0, second.status().exitCode());
        assertEquals(2, engines.invocations().size());
    }

    @Test
    void requestOutputDirectoryIsUsedWithoutOverride() {
        science.respond("hi", "l1c", "45sensor-pset", List.of(
            record("imap_hi_l1c_45sensor-pset_20250110_v001.cdf", "45sensor-pset", "20250110", "v001")
        ));
        var config = MapRunConfiguration.builder()
            .requestFile(request)
            .settings(settings)
            .workingDirectory(root)
            .build();

        var result = runner.run(config);

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertTrue(Files.isRegularFile(root.resolve("from-request").resolve(OUTPUT_NAME)));
    }

    @Test
    void missingInputsFailWithCode() {
        var result = runner.run(configuration(request));

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("no_inputs", result.metadata().get("code"));
        assertTrue(engines.invocations().isEmpty());
        assertFalse(Files.exists(root.resolve("out").resolve(OUTPUT_NAME)));
    }

    @Test
    void invalidRequestFailsBeforeAnyCatalogCall() throws IOException {
        Path invalid = root.resolve("bad.yaml");
        Files.writeString(invalid, "instrument: Hi 45\n");

        var result = runner.run(configuration(invalid));

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("configuration", result.metadata().get("code"));
        assertEquals("Missing required field 'spin_phase'", result.metadata().get("error"));
        assertTrue(science.queries().isEmpty());
    }

    @Test
    void unreadableRequestIsReported() {
        var result = runner.run(configuration(root.resolve("absent.json")));

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertFalse(result.metadata().containsKey("code"));
        assertTrue(result.toPrettyJson().contains("\"status\" : \"failure\""));
    }

    @Test
    void registersOneCommandEnginePerConfiguredLevel() {
        var configured = settings
            .withEngineCommand(Instrument.HI, DataLevel.L2, List.of("hi-l2"))
            .withEngineCommand(Instrument.HI, DataLevel.L3, List.of("hi-l3"))
            .withEngineCommand(Instrument.LO, DataLevel.L2, List.of("lo-l2"));

        var registry = MapRunner.engineRegistry(configured);

        assertEquals(3, registry.entries().size());
        assertTrue(registry.contains(Instrument.HI, DataLevel.L3));
        assertFalse(registry.contains(Instrument.ULTRA, DataLevel.L2));
    }

    @Test
    void logLevelsMapToBackend() {
        assertEquals(LogLevel.INFO, LogLevel.from(null));
        assertEquals("ERROR", LogLevel.from("fatal").backendName());
        assertEquals("DEBUG", LogLevel.from("Debug").backendName());
    }
}
