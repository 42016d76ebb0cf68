package work.enamap.mapper.engine;

import work.enamap.mapper.shared.MapperException;

/**
 * An engine finished without exactly one output artifact.
 */
public final class EngineContractViolationException extends MapperException {
    private final int outputCount;

    public EngineContractViolationException(String message, int outputCount) {
        super("engine_contract", message);
        this.outputCount = outputCount;
    }

    public int outputCount() {
        return outputCount;
    }
}
