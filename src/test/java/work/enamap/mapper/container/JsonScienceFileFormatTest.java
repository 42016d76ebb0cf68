package work.enamap.mapper.container;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonScienceFileFormatTest {
    @TempDir
    Path root;

    private final JsonScienceFileFormat format = new JsonScienceFileFormat();

    @Test
    void readsDocumentLayout() throws IOException {
        Path file = root.resolve("map.json");
        Files.writeString(file, "{\"attributes\": {\"Logical_source\": \"src\", \"Data_version\": 3},"
            + " \"variables\": ["
            + "{\"name\": \"epoch\", \"records\": [20, 10]},"
            + "{\"name\": \"ena_intensity\", \"attributes\": {\"DEPEND_0\": \"epoch\"}, \"records\": [[1.5], [2.5]]},"
            + "{\"name\": \"latitude\", \"records\": [-90, 90]}]}");

        ScienceDataset dataset = format.read(file);

        assertEquals("src", dataset.attribute("Logical_source").orElseThrow());
        assertEquals("3", dataset.attribute("Data_version").orElseThrow());
        assertEquals(20L, dataset.firstEpoch().asLong());
        assertEquals(
            List.of("epoch", "ena_intensity"),
            dataset.timeSeriesVariables().stream().map(ScienceVariable::name).toList()
        );
        assertTrue(dataset.variable("latitude").orElseThrow().attributes().isEmpty());
    }

    @Test
    void writtenFilesReadBackInVariableOrder() throws IOException {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ScienceDataset dataset = new ScienceDataset()
            .putAttribute("Data_type", "L2_x>desc")
            .putVariable(new ScienceVariable("longitude", null, List.of(nodes.numberNode(0), nodes.numberNode(4))))
            .putVariable(new ScienceVariable(ScienceDataset.EPOCH, null, List.of(nodes.textNode("2025-01-01T00:00:00"))));
        Path file = root.resolve("nested/out.json");
        Files.createDirectories(file.getParent());

        format.write(dataset, file);
        ScienceDataset read = format.read(file);

        assertEquals(List.of("longitude", "epoch"), read.variables().stream().map(ScienceVariable::name).toList());
        assertEquals("2025-01-01T00:00:00", read.firstEpoch().asText());
        assertEquals("json", format.extension());
    }

    @Test
    void rejectsNonObjectDocuments() throws IOException {
        Path file = root.resolve("list.json");
        Files.writeString(file, "[1, 2]");

        assertThrows(IOException.class, () -> format.read(file));
    }

    @Test
    void rejectsUnnamedVariables() throws IOException {
        Path file = root.resolve("unnamed.json");
        Files.writeString(file, "{\"variables\": [{\"records\": [1]}]}");

        assertThrows(IOException.class, () -> format.read(file));
    }

    @Test
    void datasetWithoutEpochHasNoFirstEpoch() {
        assertThrows(IllegalStateException.class, () -> new ScienceDataset().firstEpoch());
    }

    @Test
    void epochOrderComparesNumbersNumerically() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        assertTrue(EpochOrder.INSTANCE.compare(nodes.numberNode(9), nodes.numberNode(10L)) < 0);
        assertTrue(EpochOrder.INSTANCE.compare(nodes.textNode("9"), nodes.textNode("10")) > 0);
    }
}
