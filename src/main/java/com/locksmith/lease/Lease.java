package com.locksmith.lease;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static java.lang.String.format;

/**
 * Handle of a lease granted by the remote authority.
 * <p>
 * A handle is only produced by a successful {@link Locksmith#acquire}. It keeps no local view
 * of the remaining validity: once the lease expired, was released or taken over, the handle
 * stays usable but {@link #update} and {@link #release} return {@code false}.
 * </p>
 */
public final class Lease {

    private final Locksmith locksmith;
    private final String name;
    private final String leaseId;

    Lease(Locksmith locksmith, String name, String leaseId) {
        this.locksmith = Objects.requireNonNull(locksmith);
        this.name = Objects.requireNonNull(name);
        this.leaseId = Objects.requireNonNull(leaseId);
    }

    public String getName() {
        return name;
    }

    public String getLeaseId() {
        return leaseId;
    }

    /**
     * Extends this lease by {@code validity} counted from now.
     *
     * @return {@code true} if the lease was still held and has been extended.
     * @see Locksmith#update(String, long, TimeUnit)
     */
    public boolean update(long validity, TimeUnit unit) {
        return locksmith.update(leaseId, validity, unit);
    }

    /**
     * Releases this lease.
     *
     * @return {@code true} if the lease was still held and has been released.
     * @see Locksmith#release(String)
     */
    public boolean release() {
        return locksmith.release(leaseId);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Lease)) {
            return false;
        }
        var that = (Lease) other;
        return name.equals(that.name) && leaseId.equals(that.leaseId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, leaseId);
    }

    @Override
    public String toString() {
        return format("<Lease name='%s' id='%s'>", name, leaseId);
    }

}
