package work.enamap.mapper.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.enamap.mapper.dependency.DataLevel;
import work.enamap.mapper.descriptor.ConfigurationException;
import work.enamap.mapper.descriptor.Instrument;

/**
 * Installation settings: where the data access API lives, where data is cached and which command runs each engine.
 *
 * <pre>
 * [data_access]
 * url = "https://api.dev.imap-mission.com"
 * api_key = "..."
 * data_dir = "/data"
 *
 * [engines.hi]
 * l2 = ["imap_cli", "--instrument", "{instrument}", "--data-level", "{level}", ...]
 * l3 = [...]
 * </pre>
 *
 * Environment variables {@value #ENV_URL}, {@value #ENV_API_KEY} and {@value #ENV_DATA_DIR} take precedence over
 * the file.
 */
public final class ToolSettings {
    public static final String ENV_URL = "IMAP_DATA_ACCESS_URL";
    public static final String ENV_API_KEY = "IMAP_API_KEY";
    public static final String ENV_DATA_DIR = "IMAP_DATA_DIR";
    public static final Path DEFAULT_DATA_DIR = Path.of("data");

    private final String dataAccessUrl;
    private final String apiKey;
    private final Path dataDir;
    private final Map<Instrument, Map<DataLevel, List<String>>> engineCommands;

    private ToolSettings(String dataAccessUrl, String apiKey, Path dataDir, Map<Instrument, Map<DataLevel, List<String>>> engineCommands) {
        this.dataAccessUrl = dataAccessUrl;
        this.apiKey = apiKey;
        this.dataDir = dataDir == null ? DEFAULT_DATA_DIR : dataDir;
        this.engineCommands = engineCommands;
    }

    public static ToolSettings load(Path settingsFile, Map<String, String> environment) throws IOException {
        if (settingsFile == null) {
            return fromToml(Toml.parse(""), environment);
        }
        if (!Files.isRegularFile(settingsFile)) {
            throw new ConfigurationException("Settings file not found: " + settingsFile);
        }
        return fromToml(Toml.parse(Files.readString(settingsFile)), environment);
    }

    static ToolSettings fromToml(TomlParseResult toml, Map<String, String> environment) {
        if (toml.hasErrors()) {
            String errors = toml.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new ConfigurationException("Invalid settings file: " + errors);
        }
        String url = firstNonBlank(environment.get(ENV_URL), toml.getString("data_access.url"));
        String key = firstNonBlank(environment.get(ENV_API_KEY), toml.getString("data_access.api_key"));
        String dir = firstNonBlank(environment.get(ENV_DATA_DIR), toml.getString("data_access.data_dir"));
        return new ToolSettings(url, key, dir == null ? null : Path.of(dir), readEngines(toml.getTable("engines")));
    }

    /**
     * Copy with command-line values applied on top; {@code null} keeps the current value.
     */
    public ToolSettings withOverrides(String url, String key, Path dir) {
        return new ToolSettings(
            firstNonBlank(url, dataAccessUrl),
            firstNonBlank(key, apiKey),
            dir == null ? dataDir : dir,
            engineCommands
        );
    }

    public ToolSettings withEngineCommand(Instrument instrument, DataLevel level, List<String> command) {
        Map<Instrument, Map<DataLevel, List<String>>> copy = new EnumMap<>(Instrument.class);
        engineCommands.forEach((key, value) -> copy.put(key, new EnumMap<>(value)));
        copy.computeIfAbsent(instrument, ignored -> new EnumMap<>(DataLevel.class)).put(level, List.copyOf(command));
        return new ToolSettings(dataAccessUrl, apiKey, dataDir, Collections.unmodifiableMap(copy));
    }

    /**
     * @throws ConfigurationException when no data access URL is configured
     */
    public ToolSettings validate() {
        if (dataAccessUrl == null) {
            throw new ConfigurationException("No data access URL configured (set " + ENV_URL + " or [data_access] url)");
        }
        return this;
    }

    public String dataAccessUrl() {
        return dataAccessUrl;
    }

    public String apiKey() {
        return apiKey;
    }

    public Path dataDir() {
        return dataDir;
    }

    public Map<Instrument, Map<DataLevel, List<String>>> engineCommands() {
        return engineCommands;
    }

    private static Map<Instrument, Map<DataLevel, List<String>>> readEngines(TomlTable engines) {
        Map<Instrument, Map<DataLevel, List<String>>> commands = new EnumMap<>(Instrument.class);
        if (engines == null) {
            return Collections.unmodifiableMap(commands);
        }
        for (String name : engines.keySet()) {
            TomlTable table = engines.getTable(name);
            if (table == null) {
                throw new ConfigurationException("engines." + name, engines.get(name));
            }
            Instrument instrument = Instrument.from(name);
            Map<DataLevel, List<String>> levels = new EnumMap<>(DataLevel.class);
            for (DataLevel level : new DataLevel[] {DataLevel.L2, DataLevel.L3}) {
                TomlArray array = table.getArray(level.token());
                if (array != null) {
                    levels.put(level, readCommand(array, "engines." + name + "." + level.token()));
                }
            }
            commands.put(instrument, Collections.unmodifiableMap(levels));
        }
        return Collections.unmodifiableMap(commands);
    }

    private static List<String> readCommand(TomlArray array, String field) {
        List<String> command = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            if (!(value instanceof String)) {
                throw new ConfigurationException(field, value);
            }
            command.add((String) value);
        }
        if (command.isEmpty()) {
            throw new ConfigurationException(field, "[]");
        }
        return List.copyOf(command);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second == null || second.isBlank() ? null : second;
    }
}
