// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.error;

import java.util.Objects;

/**
 * Thrown when an input is malformed or is the null identifier.
 *
 * @since 0.1.0
 */
public final class ValidationException extends SluiceException {

    /** Precondition that failed. */
    public enum Reason {
        INVALID_NAME,
        INVALID_IDENTIFIER,
        INVALID_POOL_ADDRESS,
        ZERO_TOKEN,
        INVALID_PAIR
    }

    private final Reason reason;

    public ValidationException(final Reason reason, final String message) {
        super(Objects.requireNonNull(reason, "reason") + ": " + message);
        this.reason = reason;
    }

    public ValidationException(final Reason reason, final String message, final Throwable cause) {
        super(Objects.requireNonNull(reason, "reason") + ": " + message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
