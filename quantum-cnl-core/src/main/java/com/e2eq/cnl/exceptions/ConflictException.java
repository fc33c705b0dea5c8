package com.e2eq.cnl.exceptions;

/**
 * Thrown when a write carries an expected node version that no longer matches the
 * stored one.
 */
public class ConflictException extends CnlGraphException {
    private static final long serialVersionUID = 1L;

    private final String nodeId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConflictException(String nodeId, long expectedVersion, long actualVersion) {
        super(String.format("Stale write on node '%s': expected version %d but found %d",
                nodeId, expectedVersion, actualVersion));
        this.nodeId = nodeId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getNodeId() {
        return nodeId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
