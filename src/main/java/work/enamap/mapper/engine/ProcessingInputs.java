package work.enamap.mapper.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * File names handed to an engine, grouped by {@link InputType}. Serialized as
 * {@code [{"type":"science","files":[...]}, ...]}; empty groups are omitted.
 */
public final class ProcessingInputs {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<InputType, List<String>> groups;

    private ProcessingInputs(Map<InputType, List<String>> groups) {
        this.groups = groups;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> files(InputType type) {
        return groups.getOrDefault(type, List.of());
    }

    public List<String> allFiles() {
        List<String> all = new ArrayList<>();
        for (List<String> files : groups.values()) {
            all.addAll(files);
        }
        return all;
    }

    public String serialize() {
        ArrayNode root = JSON.createArrayNode();
        for (Map.Entry<InputType, List<String>> group : groups.entrySet()) {
            if (group.getValue().isEmpty()) {
                continue;
            }
            ObjectNode node = root.addObject();
            node.put("type", group.getKey().token());
            ArrayNode files = node.putArray("files");
            group.getValue().forEach(files::add);
        }
        try {
            return JSON.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize processing inputs", ex);
        }
    }

    @Override
    public String toString() {
        return serialize();
    }

    public static final class Builder {
        private final Map<InputType, List<String>> groups = new LinkedHashMap<>();

        public Builder add(InputType type, List<String> files) {
            groups.computeIfAbsent(type, key -> new ArrayList<>()).addAll(files);
            return this;
        }

        public Builder add(InputType type, String file) {
            return add(type, List.of(file));
        }

        public ProcessingInputs build() {
            Map<InputType, List<String>> copy = new LinkedHashMap<>();
            groups.forEach((type, files) -> copy.put(type, List.copyOf(files)));
            return new ProcessingInputs(Collections.unmodifiableMap(copy));
        }
    }
}
