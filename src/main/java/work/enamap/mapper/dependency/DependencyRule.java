package work.enamap.mapper.dependency;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.descriptor.PrincipalData;
import work.enamap.mapper.descriptor.Sensor;
import work.enamap.mapper.descriptor.SpinPhase;
import work.enamap.mapper.descriptor.SurvivalCorrection;

/**
 * Guarded prerequisite rules, evaluated in declaration order. The first rule whose guard matches decides the
 * prerequisites; a descriptor matching none is a base case.
 */
public enum DependencyRule {
    SPECTRAL_INDEX_FROM_INTENSITY(
        d -> d.principalData() == PrincipalData.SPX,
        d -> List.of(d.withPrincipalData(PrincipalData.ENA))
    ),
    COMBINED_FROM_SENSOR_HALVES(
        d -> d.sensor() == Sensor.COMBINED,
        d -> List.of(d.withSensor(Sensor.SENSOR_90), d.withSensor(Sensor.SENSOR_45))
    ),
    FULL_SPIN_FROM_RAM_AND_ANTI(
        d -> d.survivalCorrection() == SurvivalCorrection.SP && d.spinPhase() == SpinPhase.FULL,
        d -> List.of(uncorrected(d, SpinPhase.RAM), uncorrected(d, SpinPhase.ANTI))
    ),
    SURVIVAL_CORRECTED_FROM_UNCORRECTED(
        d -> d.survivalCorrection() == SurvivalCorrection.SP
            && (d.spinPhase() == SpinPhase.RAM || d.spinPhase() == SpinPhase.ANTI),
        d -> List.of(d.withSurvivalCorrection(SurvivalCorrection.NSP))
    );

    private final Predicate<MapDescriptor> guard;
    private final Function<MapDescriptor, List<MapDescriptor>> expansion;

    DependencyRule(Predicate<MapDescriptor> guard, Function<MapDescriptor, List<MapDescriptor>> expansion) {
        this.guard = guard;
        this.expansion = expansion;
    }

    public boolean matches(MapDescriptor descriptor) {
        return guard.test(descriptor);
    }

    public List<MapDescriptor> expand(MapDescriptor descriptor) {
        return expansion.apply(descriptor);
    }

    private static MapDescriptor uncorrected(MapDescriptor descriptor, SpinPhase spinPhase) {
        return descriptor.toBuilder()
            .spinPhase(spinPhase)
            .survivalCorrection(SurvivalCorrection.NSP)
            .build();
    }
}
