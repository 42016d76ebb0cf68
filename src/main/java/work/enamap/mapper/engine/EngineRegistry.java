package work.enamap.mapper.engine;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import work.enamap.mapper.dependency.DataLevel;
import work.enamap.mapper.descriptor.Instrument;

/**
 * Stores engine factories per instrument and tier.
 */
public final class EngineRegistry {
    private final Map<Key, EngineFactory> factories = new ConcurrentHashMap<>();

    public EngineRegistry register(Instrument instrument, DataLevel level, EngineFactory factory) {
        if (!level.isProducible()) {
            throw new IllegalArgumentException("No engine can be registered for " + level);
        }
        factories.put(new Key(instrument, level), factory);
        return this;
    }

    public Optional<EngineFactory> get(Instrument instrument, DataLevel level) {
        return Optional.ofNullable(factories.get(new Key(instrument, level)));
    }

    public boolean contains(Instrument instrument, DataLevel level) {
        return factories.containsKey(new Key(instrument, level));
    }

    public Map<Key, EngineFactory> entries() {
        return Collections.unmodifiableMap(factories);
    }

    public record Key(Instrument instrument, DataLevel level) {}
}
