package work.enamap.mapper.dependency;

import java.util.Locale;

/**
 * Processing tier of a map. Derived from a descriptor by {@link DependencyResolver#tierOf}, never stored.
 */
public enum DataLevel {
    L2("l2"),
    L3("l3"),
    NOT_APPLICABLE("no applicable level");

    private final String token;

    DataLevel(String token) {
        this.token = token;
    }

    /**
     * Level as it appears in catalog paths and file names ({@code l2}, {@code l3}).
     */
    public String token() {
        return token;
    }

    public boolean isProducible() {
        return this != NOT_APPLICABLE;
    }

    public String upperToken() {
        return token.toUpperCase(Locale.ROOT);
    }
}
