package work.enamap.mapper.engine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.enamap.mapper.descriptor.DescriptorCodec;
import work.enamap.mapper.shared.CatalogDates;

/**
 * Runs a configured command line as the processing engine.
 *
 * <p>Placeholders in the template: {@code {instrument}}, {@code {level}}, {@code {descriptor}} (pipeline form),
 * {@code {start}}, {@code {end}} ({@code yyyyMMdd}), {@code {dependencies}} (path of the serialized inputs),
 * {@code {metakernel}} and {@code {frame}} (coordinate system token).</p>
 */
public final class ExternalCommandEngine implements ProcessingEngine<ExternalCommandEngine.PreparedInputs, ExternalCommandEngine.ProcessOutcome> {
    private static final Logger LOG = LoggerFactory.getLogger(ExternalCommandEngine.class);
    private static final String INPUTS_FILE = "processing-inputs.json";
    private static final String OUTPUT_LOG = "engine-output.log";
    private static final int TAIL_LINES = 20;

    private final List<String> commandTemplate;
    private final EngineRequest request;

    public ExternalCommandEngine(List<String> commandTemplate, EngineRequest request) {
        if (commandTemplate == null || commandTemplate.isEmpty()) {
            throw new IllegalArgumentException("Engine command template must not be empty");
        }
        this.commandTemplate = List.copyOf(commandTemplate);
        this.request = Objects.requireNonNull(request, "request");
    }

    /**
     * Factory for registering one command template in an {@link EngineRegistry}.
     */
    public static EngineFactory factory(List<String> commandTemplate) {
        List<String> template = List.copyOf(commandTemplate);
        return request -> new ExternalCommandEngine(template, request);
    }

    @Override
    public PreparedInputs prepareInputs() throws IOException {
        List<Path> localFiles = new ArrayList<>(request.mapInputs());
        List<String> mapNames = request.mapInputs().stream()
            .map(path -> path.getFileName().toString())
            .collect(Collectors.toList());
        for (InputType type : List.of(InputType.SCIENCE, InputType.ANCILLARY)) {
            for (String file : request.inputs().files(type)) {
                if (!mapNames.contains(file)) {
                    localFiles.add(request.catalog().download(file));
                }
            }
        }
        Path inputsFile = request.workingDirectory().resolve(INPUTS_FILE);
        Files.writeString(inputsFile, request.inputs().serialize(), StandardCharsets.UTF_8);
        return new PreparedInputs(inputsFile, localFiles);
    }

    @Override
    public ProcessOutcome compute(PreparedInputs inputs) throws IOException, InterruptedException {
        List<String> command = render(inputs.inputsFile());
        Path outputLog = request.workingDirectory().resolve(OUTPUT_LOG);
        ProcessBuilder builder = new ProcessBuilder(command)
            .directory(request.workingDirectory().toFile())
            .redirectErrorStream(true)
            .redirectOutput(outputLog.toFile());
        builder.environment().put("IMAP_DATA_DIR", request.layout().dataDir().toString());
        builder.environment().put("SPICE_METAKERNEL", String.valueOf(request.kernelPool().location()));

        LOG.debug("Running {}", command);
        Process process = builder.start();
        int exitCode = process.waitFor();
        String tail = tail(outputLog);
        if (exitCode != 0) {
            throw new IOException("Command " + command.get(0) + " exited with status " + exitCode + (tail.isEmpty() ? "" : ":\n" + tail));
        }
        return new ProcessOutcome(exitCode, tail);
    }

    @Override
    public List<Path> finalizeOutputs(ProcessOutcome results, PreparedInputs inputs) throws IOException {
        String level = request.level().token();
        Path levelDir = request.layout().instrumentLevelDir(request.descriptor().instrument().catalogName(), level);
        if (!Files.isDirectory(levelDir)) {
            return List.of();
        }
        String marker = "_" + level + "_" + DescriptorCodec.encodePipeline(request.descriptor())
            + "_" + CatalogDates.compact(request.window().start()) + "_";
        try (Stream<Path> files = Files.walk(levelDir)) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().contains(marker))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    @Override
    public void releaseResources() {
        LOG.debug("Released engine for {}", request.descriptor());
    }

    List<String> render(Path inputsFile) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("{instrument}", request.descriptor().instrument().catalogName());
        values.put("{level}", request.level().token());
        values.put("{descriptor}", DescriptorCodec.encodePipeline(request.descriptor()));
        values.put("{start}", CatalogDates.compact(request.window().start()));
        values.put("{end}", CatalogDates.compact(request.window().end()));
        values.put("{dependencies}", inputsFile.toString());
        values.put("{metakernel}", String.valueOf(request.kernelPool().location()));
        values.put("{frame}", request.descriptor().coordinateSystem());

        List<String> command = new ArrayList<>(commandTemplate.size());
        for (String argument : commandTemplate) {
            String rendered = argument;
            for (Map.Entry<String, String> value : values.entrySet()) {
                rendered = rendered.replace(value.getKey(), value.getValue());
            }
            command.add(rendered);
        }
        return command;
    }

    private static String tail(Path outputLog) throws IOException {
        if (!Files.exists(outputLog)) {
            return "";
        }
        List<String> lines = new String(Files.readAllBytes(outputLog), StandardCharsets.UTF_8).lines()
            .collect(Collectors.toList());
        return String.join("\n", lines.subList(Math.max(0, lines.size() - TAIL_LINES), lines.size()));
    }

    public record PreparedInputs(Path inputsFile, List<Path> localFiles) {}

    public record ProcessOutcome(int exitCode, String outputTail) {}
}
