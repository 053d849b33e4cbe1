// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.error;

import java.util.Objects;

/**
 * Thrown when a lookup targets a name, version, identifier or pool that is not registered.
 *
 * @since 0.1.0
 */
public final class NotFoundException extends SluiceException {

    /** Precondition that failed. */
    public enum Reason {
        NAME_NOT_FOUND,
        VERSION_NOT_FOUND,
        IDENTIFIER_NOT_FOUND,
        POOL_NOT_FOUND,
        BASE_POOL_NOT_FOUND,
        OUT_OF_BOUNDS
    }

    private final Reason reason;

    public NotFoundException(final Reason reason, final String message) {
        super(Objects.requireNonNull(reason, "reason") + ": " + message);
        this.reason = reason;
    }

    public NotFoundException(final Reason reason, final String message, final Throwable cause) {
        super(Objects.requireNonNull(reason, "reason") + ": " + message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
