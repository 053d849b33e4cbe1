// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.error;

import java.util.Objects;

/**
 * Thrown when a collaborator reports state that contradicts the request, such as a
 * deposit wrapper fronting a different pool.
 *
 * @since 0.1.0
 */
public final class ExternalMismatchException extends SluiceException {

    /** Precondition that failed. */
    public enum Reason {
        WRAPPER_MISMATCH,
        POOL_OWNER_NOT_APPROVED
    }

    private final Reason reason;

    public ExternalMismatchException(final Reason reason, final String message) {
        super(Objects.requireNonNull(reason, "reason") + ": " + message);
        this.reason = reason;
    }

    public ExternalMismatchException(final Reason reason, final String message, final Throwable cause) {
        super(Objects.requireNonNull(reason, "reason") + ": " + message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
