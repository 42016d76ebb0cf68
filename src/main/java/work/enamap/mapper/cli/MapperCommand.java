package work.enamap.mapper.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.enamap.mapper.api.LogLevel;
import work.enamap.mapper.api.MapRunConfiguration;
import work.enamap.mapper.api.MapRunner;
import work.enamap.mapper.api.RunResult;
import work.enamap.mapper.config.ToolSettings;

@CommandLine.Command(
    name = "ena-mapper",
    description = "Generate ENA map products from map request files.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class MapperCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Parameters(
        paramLabel = "CONFIG",
        arity = "1..*",
        description = "Map request files (.json or .yaml), processed in order."
    )
    private List<Path> requestFiles = new ArrayList<>();

    @CommandLine.Option(
        names = {"-s", "--settings"},
        description = "TOML settings file (data access and engine commands).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path settingsFile;

    @CommandLine.Option(
        names = "--data-dir",
        description = "Local data directory (overrides IMAP_DATA_DIR and the settings file).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path dataDir;

    @CommandLine.Option(
        names = {"-o", "--output-dir"},
        description = "Output directory (overrides output_directory of every request).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path outputDir;

    @CommandLine.Option(
        names = "--data-access-url",
        description = "Data access API base URL.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String dataAccessUrl;

    @CommandLine.Option(
        names = "--api-key",
        description = "Data access API key.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String apiKey;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = LogLevel.from(logLevelRaw);
        applyLogLevel(logLevel);

        for (Path request : requestFiles) {
            if (!Files.isRegularFile(request)) {
                throw new CommandLine.ParameterException(new CommandLine(this), "Request file not found: " + request);
            }
        }

        ToolSettings settings = ToolSettings.load(settingsFile, System.getenv())
            .withOverrides(dataAccessUrl, apiKey, dataDir);
        MapRunner runner = new MapRunner();
        Path workingDir = Paths.get("").toAbsolutePath();
        int exitCode = 0;

        for (Path request : requestFiles) {
            MapRunConfiguration configuration = MapRunConfiguration.builder()
                .requestFile(request.toAbsolutePath().normalize())
                .settings(settings)
                .outputDirectory(Optional.ofNullable(outputDir))
                .workingDirectory(workingDir)
                .build();

            RunResult result = runner.run(configuration);
            exitCode = Math.max(exitCode, result.status().exitCode());
            System.out.println(JSON_WRITER.writeValueAsString(result.toSerializableMap()));
        }

        return exitCode;
    }

    private static void applyLogLevel(LogLevel logLevel) {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof Logger) {
            ((Logger) root).setLevel(Level.toLevel(logLevel.backendName(), Level.INFO));
        }
    }
}
