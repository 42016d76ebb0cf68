package work.enamap.mapper.engine;

import work.enamap.mapper.shared.MapperException;

/**
 * An engine phase failed. The message names the map being produced; the cause is the engine's own failure.
 */
public final class EngineExecutionException extends MapperException {
    private final String pipelineDescriptor;

    public EngineExecutionException(String pipelineDescriptor, Throwable cause) {
        super("engine_failure", "Processing for " + pipelineDescriptor + " failed", cause);
        this.pipelineDescriptor = pipelineDescriptor;
    }

    public String pipelineDescriptor() {
        return pipelineDescriptor;
    }
}
