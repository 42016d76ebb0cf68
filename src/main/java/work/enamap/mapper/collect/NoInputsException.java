package work.enamap.mapper.collect;

import work.enamap.mapper.shared.MapperException;

/**
 * The catalog holds no pointing inputs for a requested window.
 */
public final class NoInputsException extends MapperException {
    public NoInputsException(String message) {
        super("no_inputs", message);
    }
}
