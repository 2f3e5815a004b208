package com.locksmith.lease;

/**
 * Decoded reply of {@code locksmith:update} and {@code locksmith:release}.
 * A confirmed reply means the lease existed and was unexpired when the authority handled the call.
 */
final class LeaseReply {

    private final boolean confirmed;

    LeaseReply(boolean confirmed) {
        this.confirmed = confirmed;
    }

    boolean isConfirmed() {
        return confirmed;
    }

}
