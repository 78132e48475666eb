package lab.freshnesslab.pricing.domain;

import java.util.Locale;

public enum Backend {
    BASELINE("PostgreSQL View", "view", "view", BackendFamily.POSTGRES, "dynamic_pricing"),
    CACHED_TABLE("PostgreSQL MV", "materialized_view", "mv", BackendFamily.POSTGRES, "mv_dynamic_pricing"),
    STREAMING("Materialize", "materialize", "mz", BackendFamily.MATERIALIZE, "dynamic_pricing");

    private final String displayName;
    private final String statsKey;
    private final String shortKey;
    private final BackendFamily family;
    private final String relation;

    Backend(String displayName, String statsKey, String shortKey, BackendFamily family, String relation) {
        this.displayName = displayName;
        this.statsKey = statsKey;
        this.shortKey = shortKey;
        this.family = family;
        this.relation = relation;
    }

    public String displayName() {
        return displayName;
    }

    public String statsKey() {
        return statsKey;
    }

    public String shortKey() {
        return shortKey;
    }

    public BackendFamily family() {
        return family;
    }

    public String relation() {
        return relation;
    }

    /**
     * Resolves a backend from its stats key, short key or enum name.
     */
    public static Backend from(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Backend must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Backend backend : values()) {
            if (backend.statsKey.equals(normalized)
                    || backend.shortKey.equals(normalized)
                    || backend.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return backend;
            }
        }
        throw new IllegalArgumentException("Unknown backend: " + value);
    }
}
