package work.enamap.mapper.descriptor;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable identity of a map product. Every transformation returns a new value; see the {@code with*} methods.
 *
 * <p>{@code durationMonths} is the canonical map period in months. {@link #CUSTOM_DURATION} marks an ad hoc span
 * (explicit time ranges), which the string encodings collapse to {@code custom}.</p>
 */
public record MapDescriptor(
    Instrument instrument,
    Sensor sensor,
    PrincipalData principalData,
    SurvivalCorrection survivalCorrection,
    SpinPhase spinPhase,
    ReferenceFrame frame,
    String coordinateSystem,
    String resolution,
    int durationMonths,
    String species,
    String quantitySuffix
) {
    public static final int CUSTOM_DURATION = 0;

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9]+");
    private static final Pattern RESOLUTION = Pattern.compile("\\d+deg|nside\\d+");
    private static final Pattern SUFFIX = Pattern.compile("[A-Za-z0-9]*");

    public MapDescriptor {
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(sensor, "sensor");
        Objects.requireNonNull(principalData, "principalData");
        Objects.requireNonNull(survivalCorrection, "survivalCorrection");
        Objects.requireNonNull(spinPhase, "spinPhase");
        Objects.requireNonNull(frame, "frame");
        quantitySuffix = quantitySuffix == null ? "" : quantitySuffix;
        if (instrument.hasSensors() == (sensor == Sensor.NONE)) {
            throw new ConfigurationException("sensor", sensor.token());
        }
        if (coordinateSystem == null || !TOKEN.matcher(coordinateSystem).matches()) {
            throw new ConfigurationException("coordinate_system", coordinateSystem);
        }
        if (resolution == null || !RESOLUTION.matcher(resolution).matches()) {
            throw new ConfigurationException("resolution", resolution);
        }
        if (durationMonths < 0) {
            throw new ConfigurationException("duration", durationMonths);
        }
        if (species == null || !TOKEN.matcher(species).matches()) {
            throw new ConfigurationException("species", species);
        }
        if (!SUFFIX.matcher(quantitySuffix).matches()) {
            throw new ConfigurationException("quantity_suffix", quantitySuffix);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public MapDescriptor withSensor(Sensor value) {
        return toBuilder().sensor(value).build();
    }

    public MapDescriptor withPrincipalData(PrincipalData value) {
        return toBuilder().principalData(value).build();
    }

    public MapDescriptor withSurvivalCorrection(SurvivalCorrection value) {
        return toBuilder().survivalCorrection(value).build();
    }

    public MapDescriptor withSpinPhase(SpinPhase value) {
        return toBuilder().spinPhase(value).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .instrument(instrument)
            .sensor(sensor)
            .principalData(principalData)
            .survivalCorrection(survivalCorrection)
            .spinPhase(spinPhase)
            .frame(frame)
            .coordinateSystem(coordinateSystem)
            .resolution(resolution)
            .durationMonths(durationMonths)
            .species(species)
            .quantitySuffix(quantitySuffix);
    }

    @Override
    public String toString() {
        return DescriptorCodec.encode(this);
    }

    public static final class Builder {
        private Instrument instrument;
        private Sensor sensor = Sensor.NONE;
        private PrincipalData principalData = PrincipalData.ENA;
        private SurvivalCorrection survivalCorrection = SurvivalCorrection.NSP;
        private SpinPhase spinPhase = SpinPhase.FULL;
        private ReferenceFrame frame = ReferenceFrame.SPACECRAFT;
        private String coordinateSystem = "hae";
        private String resolution;
        private int durationMonths = CUSTOM_DURATION;
        private String species = "h";
        private String quantitySuffix = "";

        public Builder instrument(Instrument instrument) {
            this.instrument = instrument;
            return this;
        }

        public Builder sensor(Sensor sensor) {
            this.sensor = sensor;
            return this;
        }

        public Builder principalData(PrincipalData principalData) {
            this.principalData = principalData;
            return this;
        }

        public Builder survivalCorrection(SurvivalCorrection survivalCorrection) {
            this.survivalCorrection = survivalCorrection;
            return this;
        }

        public Builder spinPhase(SpinPhase spinPhase) {
            this.spinPhase = spinPhase;
            return this;
        }

        public Builder frame(ReferenceFrame frame) {
            this.frame = frame;
            return this;
        }

        public Builder coordinateSystem(String coordinateSystem) {
            this.coordinateSystem = coordinateSystem;
            return this;
        }

        public Builder resolution(String resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder durationMonths(int durationMonths) {
            this.durationMonths = durationMonths;
            return this;
        }

        public Builder species(String species) {
            this.species = species;
            return this;
        }

        public Builder quantitySuffix(String quantitySuffix) {
            this.quantitySuffix = quantitySuffix;
            return this;
        }

        public MapDescriptor build() {
            return new MapDescriptor(
                instrument,
                sensor,
                principalData,
                survivalCorrection,
                spinPhase,
                frame,
                coordinateSystem,
                resolution,
                durationMonths,
                species,
                quantitySuffix
            );
        }
    }
}
