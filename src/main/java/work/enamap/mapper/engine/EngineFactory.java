package work.enamap.mapper.engine;

/**
 * Creates a fresh engine for one invocation.
 */
@FunctionalInterface
public interface EngineFactory {
    ProcessingEngine<?, ?> create(EngineRequest request);
}
