package work.enamap.mapper.descriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dash-joined string forms of a {@link MapDescriptor}.
 *
 * <p>The canonical form ({@link #encode}) names outputs and provenance, e.g.
 * {@code h90-enaCUSTOM-h-sf-sp-ram-hae-2deg-6mo-mapper}. The pipeline form ({@link #encodePipeline}) is what the
 * processing engines receive, e.g. {@code h90-ena-h-sf-sp-ram-hae-2deg-6mo}. {@link #decode} reads both.</p>
 *
 * <p>An ad hoc duration is written as {@code custom}; decoding it yields {@link MapDescriptor#CUSTOM_DURATION}, not
 * the original span.</p>
 */
public final class DescriptorCodec {
    public static final String MAPPER_MARKER = "mapper";
    public static final String CUSTOM_DURATION_TOKEN = "custom";

    private static final Pattern MONTHS = Pattern.compile("(\\d+)mo");
    private static final int FIELD_COUNT = 9;
    private static final Map<String, InstrumentSensor> INSTRUMENT_TOKENS = Map.of(
        "h45", new InstrumentSensor(Instrument.HI, Sensor.SENSOR_45),
        "h90", new InstrumentSensor(Instrument.HI, Sensor.SENSOR_90),
        "hic", new InstrumentSensor(Instrument.HI, Sensor.COMBINED),
        "u45", new InstrumentSensor(Instrument.ULTRA, Sensor.SENSOR_45),
        "u90", new InstrumentSensor(Instrument.ULTRA, Sensor.SENSOR_90),
        "ulc", new InstrumentSensor(Instrument.ULTRA, Sensor.COMBINED),
        "ilo", new InstrumentSensor(Instrument.LO, Sensor.NONE),
        "glx", new InstrumentSensor(Instrument.GLOWS, Sensor.NONE),
        "idx", new InstrumentSensor(Instrument.IDEX, Sensor.NONE)
    );

    private DescriptorCodec() {}

    public static String encode(MapDescriptor descriptor) {
        return join(descriptor, descriptor.principalData().token() + descriptor.quantitySuffix()) + "-" + MAPPER_MARKER;
    }

    public static String encodePipeline(MapDescriptor descriptor) {
        return join(descriptor, descriptor.principalData().token());
    }

    public static String instrumentToken(MapDescriptor descriptor) {
        return instrumentToken(descriptor.instrument(), descriptor.sensor());
    }

    public static String instrumentToken(Instrument instrument, Sensor sensor) {
        switch (instrument) {
            case HI:
                return sensor == Sensor.COMBINED ? "hic" : "h" + sensor.token();
            case ULTRA:
                return sensor == Sensor.COMBINED ? "ulc" : "u" + sensor.token();
            case LO:
                return "ilo";
            case GLOWS:
                return "glx";
            case IDEX:
                return "idx";
            default:
                throw new IllegalStateException("Unhandled instrument " + instrument);
        }
    }

    public static String durationToken(int durationMonths) {
        return durationMonths == MapDescriptor.CUSTOM_DURATION ? CUSTOM_DURATION_TOKEN : durationMonths + "mo";
    }

    public static MapDescriptor decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new ConfigurationException("descriptor", encoded);
        }
        List<String> parts = new ArrayList<>(Arrays.asList(encoded.trim().split("-")));
        if (!parts.isEmpty() && MAPPER_MARKER.equals(parts.get(parts.size() - 1))) {
            parts.remove(parts.size() - 1);
        }
        if (parts.size() != FIELD_COUNT) {
            throw new ConfigurationException("descriptor", encoded);
        }

        InstrumentSensor instrumentSensor = INSTRUMENT_TOKENS.get(parts.get(0));
        if (instrumentSensor == null) {
            throw new ConfigurationException("instrument", parts.get(0));
        }
        String quantity = parts.get(1);
        PrincipalData principalData = null;
        for (PrincipalData candidate : PrincipalData.values()) {
            if (quantity.startsWith(candidate.token())) {
                principalData = candidate;
                break;
            }
        }
        if (principalData == null) {
            throw new ConfigurationException("principal_data", quantity);
        }

        return MapDescriptor.builder()
            .instrument(instrumentSensor.instrument())
            .sensor(instrumentSensor.sensor())
            .principalData(principalData)
            .quantitySuffix(quantity.substring(principalData.token().length()))
            .species(parts.get(2))
            .frame(ReferenceFrame.fromToken(parts.get(3)))
            .survivalCorrection(SurvivalCorrection.fromToken(parts.get(4)))
            .spinPhase(SpinPhase.fromToken(parts.get(5)))
            .coordinateSystem(parts.get(6))
            .resolution(parts.get(7))
            .durationMonths(decodeDuration(parts.get(8)))
            .build();
    }

    private static int decodeDuration(String token) {
        if (CUSTOM_DURATION_TOKEN.equals(token)) {
            return MapDescriptor.CUSTOM_DURATION;
        }
        Matcher matcher = MONTHS.matcher(token);
        if (!matcher.matches()) {
            throw new ConfigurationException("duration", token);
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException ex) {
            throw new ConfigurationException("duration", token);
        }
    }

    private static String join(MapDescriptor descriptor, String quantity) {
        return String.join(
            "-",
            instrumentToken(descriptor),
            quantity,
            descriptor.species(),
            descriptor.frame().token(),
            descriptor.survivalCorrection().token(),
            descriptor.spinPhase().token(),
            descriptor.coordinateSystem(),
            descriptor.resolution(),
            durationToken(descriptor.durationMonths())
        );
    }

    private record InstrumentSensor(Instrument instrument, Sensor sensor) {}
}
