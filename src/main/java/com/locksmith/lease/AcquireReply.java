package com.locksmith.lease;

/**
 * Decoded reply of {@code locksmith:acquire}.
 */
final class AcquireReply {

    private final boolean granted;
    private final String name;
    private final String leaseId;

    AcquireReply(boolean granted, String name, String leaseId) {
        this.granted = granted;
        this.name = name;
        this.leaseId = leaseId;
    }

    boolean isGranted() {
        return granted;
    }

    /**
     * @return the lock name echoed by the authority, may be {@code null} for a denied acquisition.
     */
    String getName() {
        return name;
    }

    /**
     * @return the id of the new lease, {@code null} for a denied acquisition.
     */
    String getLeaseId() {
        return leaseId;
    }

}
