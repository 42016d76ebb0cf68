package work.enamap.mapper.engine;

import java.nio.file.Path;
import java.util.List;

/**
 * Three-phase contract of an external processing engine. {@link #releaseResources()} is always called once the
 * phases have run, whether they succeeded or not.
 *
 * @param <D> resolved inputs produced by {@link #prepareInputs()}
 * @param <R> intermediate results produced by {@link #compute}
 */
public interface ProcessingEngine<D, R> {
    D prepareInputs() throws Exception;

    R compute(D inputs) throws Exception;

    /**
     * Artifacts written by this invocation. Callers only rely on the number of entries.
     */
    List<Path> finalizeOutputs(R results, D inputs) throws Exception;

    void releaseResources();
}
