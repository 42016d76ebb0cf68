package work.enamap.mapper.container;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory science file: global attributes plus ordered variables. {@value #EPOCH} is the timestamp axis.
 */
public final class ScienceDataset {
    public static final String EPOCH = "epoch";

    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final Map<String, ScienceVariable> variables = new LinkedHashMap<>();

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public ScienceDataset putAttribute(String name, String value) {
        attributes.put(name, value);
        return this;
    }

    public List<ScienceVariable> variables() {
        return List.copyOf(variables.values());
    }

    public Optional<ScienceVariable> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public ScienceDataset putVariable(ScienceVariable variable) {
        variables.put(variable.name(), variable);
        return this;
    }

    public List<JsonNode> epochs() {
        return variable(EPOCH).map(ScienceVariable::records).orElse(List.of());
    }

    /**
     * First timestamp of the file.
     *
     * @throws IllegalStateException when the file has no epoch values
     */
    public JsonNode firstEpoch() {
        List<JsonNode> epochs = epochs();
        if (epochs.isEmpty()) {
            throw new IllegalStateException("Dataset has no " + EPOCH + " values");
        }
        return epochs.get(0);
    }

    /**
     * The epoch variable and every variable whose leading dimension it governs.
     */
    public List<ScienceVariable> timeSeriesVariables() {
        List<ScienceVariable> series = new ArrayList<>();
        for (ScienceVariable variable : variables.values()) {
            if (variable.name().equals(EPOCH) || variable.dependsOn(EPOCH)) {
                series.add(variable);
            }
        }
        return series;
    }
}
