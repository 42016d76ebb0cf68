package work.enamap.mapper.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.enamap.mapper.descriptor.ConfigurationException;
import work.enamap.mapper.descriptor.Instrument;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.descriptor.PrincipalData;
import work.enamap.mapper.descriptor.ReferenceFrame;
import work.enamap.mapper.descriptor.Sensor;
import work.enamap.mapper.descriptor.SpinPhase;
import work.enamap.mapper.descriptor.SurvivalCorrection;
import work.enamap.mapper.period.CanonicalMapPeriod;
import work.enamap.mapper.period.TimeWindow;
import work.enamap.mapper.shared.CatalogDates;

/**
 * A map request file (JSON or YAML).
 *
 * <pre>
 * instrument: Hi 90
 * spin_phase: Ram
 * reference_frame_type: spacecraft
 * survival_corrected: true
 * spice_frame_name: ECLIPJ2000
 * pixelation_scheme: square
 * pixel_parameter: 4
 * map_data_type: ENA Intensity
 * canonical_map_period: {year: 2025, quarter: 1, map_period: 3, number_of_maps: 2}
 * </pre>
 *
 * <p>{@code time_ranges: [{start, end}]} may replace {@code canonical_map_period}. Optional: {@code kernel_path},
 * {@code lo_species}, {@code output_directory}, {@code quantity_suffix}.</p>
 */
public final class MapConfiguration {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper YAML_WRITER = new ObjectMapper(
        YAMLFactory.builder().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER).build()
    );
    private static final List<String> REQUIRED = List.of(
        "instrument",
        "spin_phase",
        "reference_frame_type",
        "survival_corrected",
        "spice_frame_name",
        "pixelation_scheme",
        "pixel_parameter",
        "map_data_type"
    );
    private static final Map<String, ReferenceFrame> FRAME_TYPES = Map.of(
        "spacecraft", ReferenceFrame.SPACECRAFT,
        "heliospheric", ReferenceFrame.HELIOSPHERIC,
        "heliospheric kinematic", ReferenceFrame.HELIOSPHERIC_KINEMATIC
    );
    private static final Map<String, PrincipalData> DATA_TYPES = Map.of(
        "ena intensity", PrincipalData.ENA,
        "spectral index", PrincipalData.SPX
    );
    private static final Map<String, SpinPhase> SPIN_PHASES = Map.of(
        "ram", SpinPhase.RAM,
        "anti-ram", SpinPhase.ANTI,
        "full spin", SpinPhase.FULL
    );

    private final String rawConfig;
    private final String instrument;
    private final String spinPhase;
    private final String referenceFrameType;
    private final boolean survivalCorrected;
    private final String spiceFrameName;
    private final String pixelationScheme;
    private final int pixelParameter;
    private final String mapDataType;
    private final CanonicalMapPeriod canonicalMapPeriod;
    private final List<TimeWindow> timeRanges;
    private final Path kernelPath;
    private final String loSpecies;
    private final Path outputDirectory;
    private final String quantitySuffix;

    private MapConfiguration(JsonNode root, String rawConfig) {
        for (String field : REQUIRED) {
            if (!root.hasNonNull(field)) {
                throw new ConfigurationException("Missing required field '" + field + "'");
            }
        }
        boolean hasPeriod = root.hasNonNull("canonical_map_period");
        boolean hasRanges = root.hasNonNull("time_ranges");
        if (hasPeriod == hasRanges) {
            throw new ConfigurationException("Exactly one of 'canonical_map_period' or 'time_ranges' is required");
        }
        this.rawConfig = rawConfig;
        this.instrument = root.get("instrument").asText();
        this.spinPhase = root.get("spin_phase").asText();
        this.referenceFrameType = root.get("reference_frame_type").asText();
        this.survivalCorrected = requireBoolean(root, "survival_corrected");
        this.spiceFrameName = root.get("spice_frame_name").asText();
        this.pixelationScheme = root.get("pixelation_scheme").asText();
        this.pixelParameter = requireInt(root, "pixel_parameter");
        this.mapDataType = root.get("map_data_type").asText();
        this.canonicalMapPeriod = hasPeriod ? readPeriod(root.get("canonical_map_period")) : null;
        this.timeRanges = hasRanges ? readRanges(root.get("time_ranges")) : null;
        this.kernelPath = root.hasNonNull("kernel_path") ? Path.of(root.get("kernel_path").asText()) : null;
        this.loSpecies = root.hasNonNull("lo_species") ? root.get("lo_species").asText() : null;
        this.outputDirectory = Path.of(root.hasNonNull("output_directory") ? root.get("output_directory").asText() : ".");
        this.quantitySuffix = root.hasNonNull("quantity_suffix") ? root.get("quantity_suffix").asText() : "";
    }

    public static MapConfiguration fromFile(Path configPath) throws IOException {
        String name = configPath.getFileName().toString();
        if (!name.endsWith(".json") && !name.endsWith(".yaml") && !name.endsWith(".yml")) {
            throw new ConfigurationException("Configuration file " + configPath + " must have .json or .yaml extension");
        }
        return parse(Files.readString(configPath));
    }

    /**
     * Parses request text. YAML is a superset of JSON, so one reader handles both; timestamps stay text.
     */
    public static MapConfiguration parse(String text) {
        JsonNode root;
        String raw;
        try {
            root = YAML_MAPPER.readTree(text);
            if (root == null || !root.isObject()) {
                throw new ConfigurationException("Configuration must be a mapping of settings");
            }
            raw = YAML_WRITER.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Unreadable configuration: " + ex.getOriginalMessage());
        }
        return new MapConfiguration(root, raw);
    }

    public MapDescriptor descriptor() {
        String[] instrumentSensor = instrument.trim().split("\\s+");
        Instrument parsedInstrument = Instrument.from(instrumentSensor[0]);
        Sensor sensor = instrumentSensor.length > 1 ? Sensor.fromToken(instrumentSensor[1]) : Sensor.NONE;

        if (kernelPath == null && !CoordinateFrames.isKnown(spiceFrameName)) {
            throw new ConfigurationException("Unknown Spice Frame " + spiceFrameName + " with no custom kernel path provided");
        }

        return MapDescriptor.builder()
            .instrument(parsedInstrument)
            .sensor(sensor)
            .principalData(lookup(DATA_TYPES, "map_data_type", mapDataType))
            .quantitySuffix(quantitySuffix)
            .species(loSpecies == null ? "h" : loSpecies)
            .frame(lookup(FRAME_TYPES, "reference_frame_type", referenceFrameType))
            .survivalCorrection(survivalCorrected ? SurvivalCorrection.SP : SurvivalCorrection.NSP)
            .spinPhase(lookup(SPIN_PHASES, "spin_phase", spinPhase))
            .coordinateSystem(CoordinateFrames.coordinateSystem(spiceFrameName))
            .resolution(resolution())
            .durationMonths(canonicalMapPeriod == null ? MapDescriptor.CUSTOM_DURATION : canonicalMapPeriod.mapPeriodMonths())
            .build();
    }

    /**
     * Windows to generate, ascending by start.
     */
    public List<TimeWindow> windows() {
        return canonicalMapPeriod != null ? canonicalMapPeriod.windows() : timeRanges;
    }

    public String rawConfig() {
        return rawConfig;
    }

    public Optional<CanonicalMapPeriod> canonicalMapPeriod() {
        return Optional.ofNullable(canonicalMapPeriod);
    }

    public Optional<Path> kernelPath() {
        return Optional.ofNullable(kernelPath);
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    private String resolution() {
        String scheme = pixelationScheme.trim().toLowerCase(Locale.ROOT);
        if ("square".equals(scheme)) {
            return pixelParameter + "deg";
        }
        if ("healpix".equals(scheme)) {
            return "nside" + pixelParameter;
        }
        throw new ConfigurationException("pixelation_scheme", pixelationScheme);
    }

    private static <T> T lookup(Map<String, T> table, String field, String value) {
        T resolved = table.get(value.trim().toLowerCase(Locale.ROOT));
        if (resolved == null) {
            throw new ConfigurationException(field, value);
        }
        return resolved;
    }

    private static CanonicalMapPeriod readPeriod(JsonNode node) {
        return new CanonicalMapPeriod(
            requireInt(node, "year"),
            requireInt(node, "quarter"),
            requireInt(node, "map_period"),
            requireInt(node, "number_of_maps")
        );
    }

    private static List<TimeWindow> readRanges(JsonNode node) {
        if (!node.isArray() || node.isEmpty()) {
            throw new ConfigurationException("time_ranges", node);
        }
        List<TimeWindow> ranges = new ArrayList<>();
        for (JsonNode range : node) {
            Instant start = parseInstant(range, "start");
            Instant end = parseInstant(range, "end");
            if (!start.isBefore(end)) {
                throw new ConfigurationException("time_ranges", range);
            }
            ranges.add(new TimeWindow(start, end));
        }
        ranges.sort(Comparator.comparing(TimeWindow::start));
        return List.copyOf(ranges);
    }

    private static Instant parseInstant(JsonNode range, String field) {
        if (!range.hasNonNull(field)) {
            throw new ConfigurationException("Time range without '" + field + "'");
        }
        String text = range.get(field).asText();
        try {
            return CatalogDates.parseIsoInstant(text);
        } catch (DateTimeParseException ex) {
            throw new ConfigurationException(field, text);
        }
    }

    private static boolean requireBoolean(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        String text = value.asText().trim().toLowerCase(Locale.ROOT);
        if ("true".equals(text) || "false".equals(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new ConfigurationException(field, value.asText());
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ConfigurationException("Missing required field '" + field + "'");
        }
        if (value.canConvertToInt() && value.isIntegralNumber()) {
            return value.intValue();
        }
        String text = value.asText().trim();
        if (text.matches("-?\\d+")) {
            return Integer.parseInt(text);
        }
        throw new ConfigurationException(field, value.asText());
    }
}
