package work.enamap.mapper.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.tomlj.Toml;
import work.enamap.mapper.dependency.DataLevel;
import work.enamap.mapper.descriptor.ConfigurationException;
import work.enamap.mapper.descriptor.Instrument;

class ToolSettingsTest {
    private static Path settingsFile() throws Exception {
        return Path.of(ToolSettingsTest.class.getResource("/settings/ena-mapper.toml").toURI());
    }

    @Test
    void readsSettingsFile() throws Exception {
        ToolSettings settings = ToolSettings.load(settingsFile(), Map.of());

        assertEquals("https://catalog.example.org/api", settings.dataAccessUrl());
        assertEquals("file-key", settings.apiKey());
        assertEquals(Path.of("/srv/imap-data"), settings.dataDir());
        assertEquals(
            List.of("imap_l3", "{descriptor}", "{dependencies}"),
            settings.engineCommands().get(Instrument.HI).get(DataLevel.L3)
        );
        assertEquals(List.of(DataLevel.L2), List.copyOf(settings.engineCommands().get(Instrument.LO).keySet()));
    }

    @Test
    void environmentWinsOverFile() throws Exception {
        ToolSettings settings = ToolSettings.load(settingsFile(), Map.of(
            ToolSettings.ENV_URL, "http://localhost:8080",
            ToolSettings.ENV_DATA_DIR, "/tmp/data",
            ToolSettings.ENV_API_KEY, " "
        ));

        assertEquals("http://localhost:8080", settings.dataAccessUrl());
        assertEquals(Path.of("/tmp/data"), settings.dataDir());
        assertEquals("file-key", settings.apiKey());
    }

    @Test
    void defaultsWithoutFile() throws Exception {
        ToolSettings settings = ToolSettings.load(null, Map.of());

        assertNull(settings.dataAccessUrl());
        assertEquals(ToolSettings.DEFAULT_DATA_DIR, settings.dataDir());
        assertTrue(settings.engineCommands().isEmpty());
        assertThrows(ConfigurationException.class, settings::validate);
    }

    @Test
    void overridesApplyOnTop() throws Exception {
        ToolSettings settings = ToolSettings.load(settingsFile(), Map.of())
            .withOverrides("http://override", null, Path.of("local"))
            .withEngineCommand(Instrument.ULTRA, DataLevel.L2, List.of("ultra-l2"));

        assertEquals("http://override", settings.dataAccessUrl());
        assertEquals("file-key", settings.apiKey());
        assertEquals(Path.of("local"), settings.dataDir());
        assertEquals(List.of("ultra-l2"), settings.engineCommands().get(Instrument.ULTRA).get(DataLevel.L2));
        assertEquals(2, settings.engineCommands().get(Instrument.HI).size());
    }

    @Test
    void rejectsMalformedEngineTables() {
        assertThrows(
            ConfigurationException.class,
            () -> ToolSettings.fromToml(Toml.parse("[engines.hi]\nl2 = []\n"), Map.of())
        );
        assertThrows(
            ConfigurationException.class,
            () -> ToolSettings.fromToml(Toml.parse("[engines.hi]\nl2 = [1, 2]\n"), Map.of())
        );
        assertThrows(
            ConfigurationException.class,
            () -> ToolSettings.fromToml(Toml.parse("[engines.mag]\nl2 = [\"x\"]\n"), Map.of())
        );
        assertThrows(
            ConfigurationException.class,
            () -> ToolSettings.fromToml(Toml.parse("engines = 3\n[data_access\n"), Map.of())
        );
    }

    @Test
    void missingSettingsFileIsConfigurationError() {
        assertThrows(ConfigurationException.class, () -> ToolSettings.load(Path.of("does/not/exist.toml"), Map.of()));
    }
}
