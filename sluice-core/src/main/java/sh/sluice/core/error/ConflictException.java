// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.error;

import java.util.Objects;

/**
 * Thrown when a registration would break a uniqueness invariant.
 *
 * @since 0.1.0
 */
public final class ConflictException extends SluiceException {

    /** Precondition that failed. */
    public enum Reason {
        ALREADY_REGISTERED,
        DUPLICATE_IDENTIFIER,
        DUPLICATE_NAME
    }

    private final Reason reason;

    public ConflictException(final Reason reason, final String message) {
        super(Objects.requireNonNull(reason, "reason") + ": " + message);
        this.reason = reason;
    }

    public ConflictException(final Reason reason, final String message, final Throwable cause) {
        super(Objects.requireNonNull(reason, "reason") + ": " + message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
