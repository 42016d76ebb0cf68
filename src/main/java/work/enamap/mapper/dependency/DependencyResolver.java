package work.enamap.mapper.dependency;

import java.util.List;
import java.util.Optional;
import work.enamap.mapper.descriptor.Instrument;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.descriptor.PrincipalData;
import work.enamap.mapper.descriptor.Sensor;
import work.enamap.mapper.descriptor.SurvivalCorrection;

/**
 * Pure functions over descriptors: which maps must exist before a map can be built, and at which tier the map is
 * produced.
 */
public final class DependencyResolver {
    private DependencyResolver() {}

    public static List<MapDescriptor> dependenciesOf(MapDescriptor descriptor) {
        return ruleFor(descriptor)
            .map(rule -> rule.expand(descriptor))
            .orElse(List.of());
    }

    public static Optional<DependencyRule> ruleFor(MapDescriptor descriptor) {
        for (DependencyRule rule : DependencyRule.values()) {
            if (rule.matches(descriptor)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public static DataLevel tierOf(MapDescriptor descriptor) {
        if (descriptor.instrument() == Instrument.GLOWS || descriptor.instrument() == Instrument.IDEX) {
            return DataLevel.NOT_APPLICABLE;
        }
        if (descriptor.survivalCorrection() == SurvivalCorrection.SP
            || descriptor.sensor() == Sensor.COMBINED
            || descriptor.principalData() == PrincipalData.SPX) {
            return DataLevel.L3;
        }
        return DataLevel.L2;
    }
}
