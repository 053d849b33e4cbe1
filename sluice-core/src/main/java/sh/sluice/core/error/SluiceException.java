// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.error;

/**
 * Base runtime exception for all registry failures.
 *
 * <p>
 * Every failure is raised synchronously by an upfront precondition check and is never
 * retried. Write operations that throw leave registry state untouched.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * SluiceException
 * ├── {@link ValidationException} - malformed or zero input
 * ├── {@link NotFoundException} - missing name, version, identifier, pool or index
 * ├── {@link ConflictException} - duplicate registration
 * ├── {@link AuthorizationException} - caller lacks a required role
 * ├── {@link ExternalMismatchException} - collaborator state contradicts the request
 * └── {@link ExternalUnavailableException} - no recognised collaborator response
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     registry.addPool(manager, input);
 * } catch (ConflictException e) {
 *     // already registered
 * } catch (SluiceException e) {
 *     // any other registry error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class SluiceException extends RuntimeException
        permits ValidationException,
        NotFoundException,
        ConflictException,
        AuthorizationException,
        ExternalMismatchException,
        ExternalUnavailableException {

    public SluiceException(final String message) {
        super(message);
    }

    public SluiceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
