package work.enamap.mapper.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.enamap.mapper.support.MapperTestSupport.hi;
import static work.enamap.mapper.support.MapperTestSupport.window;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.enamap.mapper.catalog.DataLayout;
import work.enamap.mapper.dependency.DataLevel;
import work.enamap.mapper.descriptor.Sensor;
import work.enamap.mapper.descriptor.SpinPhase;
import work.enamap.mapper.descriptor.SurvivalCorrection;
import work.enamap.mapper.kernel.MetaKernelPool;
import work.enamap.mapper.support.MapperTestSupport.FakeScienceCatalog;

class ExternalCommandEngineTest {
    private static final Path SHELL = Path.of("/bin/sh");

    @TempDir
    Path root;

    private DataLayout layout;
    private FakeScienceCatalog catalog;
    private Path mapInput;
    private EngineRequest request;

    @BeforeEach
    void setUp() throws IOException {
        layout = new DataLayout(root.resolve("data"));
        catalog = new FakeScienceCatalog(layout);
        mapInput = layout.sciencePath("imap_hi_l2_h90-ena-h-sf-nsp-anti-hae-4deg-3mo_20250101_v001.json");
        Files.createDirectories(mapInput.getParent());
        Files.writeString(mapInput, "{}");
        Path scratch = Files.createDirectories(root.resolve("scratch"));
        ProcessingInputs inputs = ProcessingInputs.builder()
            .add(InputType.SCIENCE, "imap_hi_l1c_90sensor-pset_20250110_v001.cdf")
            .add(InputType.SCIENCE, mapInput.getFileName().toString())
            .add(InputType.ANCILLARY, "imap_hi_90sensor-esa-energies_20240101_v001.csv")
            .add(InputType.SPICE, "naif0012.tls")
            .build();
        request = new EngineRequest(
            hi(Sensor.SENSOR_90, SurvivalCorrection.SP, SpinPhase.ANTI),
            DataLevel.L3,
            window("2025-01-01", "2025-04-01"),
            inputs,
            List.of(mapInput),
            scratch,
            new MetaKernelPool(root.resolve("state/kernels.tm")),
            layout,
            catalog
        );
    }

    @Test
    void rendersPlaceholders() {
        ExternalCommandEngine engine = new ExternalCommandEngine(
            List.of("hi-l3", "--descriptor={descriptor}", "{start}-{end}", "{instrument}/{level}", "{frame}", "{dependencies}"),
            request
        );

        List<String> command = engine.render(Path.of("inputs.json"));

        assertEquals(
            List.of("hi-l3", "--descriptor=h90-ena-h-sf-sp-anti-hae-4deg-3mo", "20250101-20250401", "hi/l3", "hae", "inputs.json"),
            command
        );
    }

    @Test
    void preparesInputsByDownloadingEverythingButMapArtifacts() throws IOException {
        ExternalCommandEngine engine = new ExternalCommandEngine(List.of("true"), request);

        ExternalCommandEngine.PreparedInputs prepared = engine.prepareInputs();

        assertEquals(
            List.of("imap_hi_l1c_90sensor-pset_20250110_v001.cdf", "imap_hi_90sensor-esa-energies_20240101_v001.csv"),
            catalog.downloads()
        );
        assertEquals(3, prepared.localFiles().size());
        assertEquals(mapInput, prepared.localFiles().get(0));
        assertEquals(request.inputs().serialize(), Files.readString(prepared.inputsFile()));
    }

    @Test
    void collectsArtifactsWrittenByCommand() throws Exception {
        Assumptions.assumeTrue(Files.isExecutable(SHELL));
        String artifact = "$IMAP_DATA_DIR/imap/hi/l3/2025/01/imap_hi_l3_{descriptor}_{start}_v001.json";
        ExternalCommandEngine engine = new ExternalCommandEngine(
            List.of(SHELL.toString(), "-c", "mkdir -p \"$(dirname " + artifact + ")\" && echo '{}' > " + artifact + " && echo done"),
            request
        );

        ExternalCommandEngine.PreparedInputs prepared = engine.prepareInputs();
        ExternalCommandEngine.ProcessOutcome outcome = engine.compute(prepared);
        List<Path> outputs = engine.finalizeOutputs(outcome, prepared);

        assertEquals(0, outcome.exitCode());
        assertEquals("done", outcome.outputTail());
        assertEquals(1, outputs.size());
        assertEquals("imap_hi_l3_h90-ena-h-sf-sp-anti-hae-4deg-3mo_20250101_v001.json", outputs.get(0).getFileName().toString());
    }

    @Test
    void nonZeroExitCarriesOutputTail() throws IOException {
        Assumptions.assumeTrue(Files.isExecutable(SHELL));
        ExternalCommandEngine engine = new ExternalCommandEngine(
            List.of(SHELL.toString(), "-c", "echo 'missing calibration'; exit 3"),
            request
        );
        ExternalCommandEngine.PreparedInputs prepared = engine.prepareInputs();

        IOException thrown = assertThrows(IOException.class, () -> engine.compute(prepared));

        assertTrue(thrown.getMessage().contains("exited with status 3"));
        assertTrue(thrown.getMessage().endsWith("missing calibration"));
    }

    @Test
    void noLevelDirectoryMeansNoOutputs() throws IOException {
        ExternalCommandEngine engine = new ExternalCommandEngine(List.of("true"), request);

        assertTrue(engine.finalizeOutputs(new ExternalCommandEngine.ProcessOutcome(0, ""), null).isEmpty());
    }

    @Test
    void rejectsEmptyTemplate() {
        assertThrows(IllegalArgumentException.class, () -> new ExternalCommandEngine(List.of(), request));
    }
}
