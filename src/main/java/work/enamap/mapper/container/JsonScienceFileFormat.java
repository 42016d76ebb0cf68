package work.enamap.mapper.container;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Science files stored as JSON documents:
 *
 * <pre>
 * {"attributes": {"Logical_source": "..."},
 *  "variables": [{"name": "epoch", "attributes": {}, "records": [1, 2]},
 *                {"name": "ena_intensity", "attributes": {"DEPEND_0": "epoch"}, "records": [[...], [...]]}]}
 * </pre>
 */
public final class JsonScienceFileFormat implements ScienceFileFormat {
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public ScienceDataset read(Path file) throws IOException {
        JsonNode root = JSON.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Science file must hold a JSON object: " + file);
        }
        ScienceDataset dataset = new ScienceDataset();
        readAttributes(root.path("attributes")).forEach(dataset::putAttribute);
        for (JsonNode node : root.path("variables")) {
            String name = node.path("name").asText(null);
            if (name == null || name.isBlank()) {
                throw new IOException("Variable without a name in " + file);
            }
            List<JsonNode> records = new ArrayList<>();
            node.path("records").forEach(records::add);
            dataset.putVariable(new ScienceVariable(name, readAttributes(node.path("attributes")), records));
        }
        return dataset;
    }

    @Override
    public void write(ScienceDataset dataset, Path file) throws IOException {
        ObjectNode root = JSON.createObjectNode();
        ObjectNode attributes = root.putObject("attributes");
        dataset.attributes().forEach(attributes::put);
        ArrayNode variables = root.putArray("variables");
        for (ScienceVariable variable : dataset.variables()) {
            ObjectNode node = variables.addObject();
            node.put("name", variable.name());
            ObjectNode variableAttributes = node.putObject("attributes");
            variable.attributes().forEach(variableAttributes::put);
            ArrayNode records = node.putArray("records");
            variable.records().forEach(records::add);
        }
        JSON.writeValue(file.toFile(), root);
    }

    @Override
    public String extension() {
        return "json";
    }

    private static Map<String, String> readAttributes(JsonNode node) {
        Map<String, String> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            attributes.put(field.getKey(), field.getValue().asText());
        }
        return attributes;
    }
}
