package lab.freshnesslab.pricing.domain;

public enum BackendFamily {
    POSTGRES("PostgreSQL", true),
    MATERIALIZE("Materialize", false);

    private final String displayName;
    private final boolean supportsSessionReset;

    BackendFamily(String displayName, boolean supportsSessionReset) {
        this.displayName = displayName;
        this.supportsSessionReset = supportsSessionReset;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Whether the pool may rely on the driver's implicit reset when a connection is returned.
     * Materialize rejects session commands such as LISTEN/UNLISTEN and DISCARD, so its
     * connections get a reduced cleanup instead.
     */
    public boolean supportsSessionReset() {
        return supportsSessionReset;
    }
}
