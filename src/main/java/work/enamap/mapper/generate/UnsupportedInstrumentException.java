package work.enamap.mapper.generate;

import work.enamap.mapper.shared.MapperException;

public final class UnsupportedInstrumentException extends MapperException {
    public UnsupportedInstrumentException(String instrumentToken) {
        super("unsupported_instrument", "Cannot produce map for instrument: " + instrumentToken);
    }
}
