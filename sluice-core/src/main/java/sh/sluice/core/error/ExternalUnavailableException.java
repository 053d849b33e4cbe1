// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.error;

import java.util.Objects;

/**
 * Thrown when no recognised collaborator answers a required query.
 *
 * @since 0.1.0
 */
public final class ExternalUnavailableException extends SluiceException {

    /** Precondition that failed. */
    public enum Reason {
        NO_PARAMETER_DATA,
        NO_COLLABORATOR
    }

    private final Reason reason;

    public ExternalUnavailableException(final Reason reason, final String message) {
        super(Objects.requireNonNull(reason, "reason") + ": " + message);
        this.reason = reason;
    }

    public ExternalUnavailableException(final Reason reason, final String message, final Throwable cause) {
        super(Objects.requireNonNull(reason, "reason") + ": " + message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
