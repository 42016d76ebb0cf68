package work.enamap.mapper.container;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Comparator;

/**
 * Orders epoch values: numbers numerically (TT2000 nanoseconds), anything else by its text.
 */
public final class EpochOrder implements Comparator<JsonNode> {
    public static final EpochOrder INSTANCE = new EpochOrder();

    private EpochOrder() {}

    @Override
    public int compare(JsonNode left, JsonNode right) {
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue());
        }
        return left.asText().compareTo(right.asText());
    }
}
