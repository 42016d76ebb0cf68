package work.enamap.mapper.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProcessingInputsTest {
    @Test
    void serializesGroupsInInsertionOrderSkippingEmptyOnes() {
        ProcessingInputs inputs = ProcessingInputs.builder()
            .add(InputType.SCIENCE, List.of("imap_hi_l1c_90sensor-pset_20250110_v001.cdf"))
            .add(InputType.ANCILLARY, List.of())
            .add(InputType.SPICE, "naif0012.tls")
            .add(InputType.SCIENCE, "imap_hi_l2_h90-ena-h-sf-nsp-ram-hae-4deg-3mo_20250101_v001.cdf")
            .build();

        assertEquals(
            "[{\"type\":\"science\",\"files\":[\"imap_hi_l1c_90sensor-pset_20250110_v001.cdf\","
                + "\"imap_hi_l2_h90-ena-h-sf-nsp-ram-hae-4deg-3mo_20250101_v001.cdf\"]},"
                + "{\"type\":\"spice\",\"files\":[\"naif0012.tls\"]}]",
            inputs.serialize()
        );
        assertEquals(3, inputs.allFiles().size());
        assertEquals(List.of(), inputs.files(InputType.ANCILLARY));
    }

    @Test
    void emptyInputsSerializeToEmptyArray() {
        assertEquals("[]", ProcessingInputs.builder().build().serialize());
    }
}
