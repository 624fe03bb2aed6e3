package io.evalsandbox.core.policy;

/** The capability classes a {@link CapabilityPolicy} governs. */
public enum AccessKind {
    READ("read"),
    WRITE("write"),
    EXECUTE("execute"),
    NETWORK("network");

    private final String label;

    AccessKind(String label) {
        this.label = label;
    }

    /** Lowercase name used in error messages. */
    public String label() {
        return label;
    }
}
