package work.enamap.mapper.container;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named array of a science file. Each entry of {@code records} is one slice along the leading dimension.
 */
public record ScienceVariable(String name, Map<String, String> attributes, List<JsonNode> records) {
    public static final String DEPEND_0 = "DEPEND_0";

    public ScienceVariable {
        Objects.requireNonNull(name, "name");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes == null ? Map.of() : attributes));
        records = Collections.unmodifiableList(new ArrayList<>(records == null ? List.of() : records));
    }

    /**
     * Whether the leading dimension of this variable is governed by {@code axis}.
     */
    public boolean dependsOn(String axis) {
        return axis.equals(attributes.get(DEPEND_0));
    }

    public ScienceVariable append(List<JsonNode> more) {
        List<JsonNode> combined = new ArrayList<>(records);
        combined.addAll(more);
        return new ScienceVariable(name, attributes, combined);
    }
}
