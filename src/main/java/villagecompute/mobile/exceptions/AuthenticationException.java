package villagecompute.mobile.exceptions;

/**
 * Exception thrown when a mobile sign-in attempt is rejected (invalid Google ID token, disabled account, unreachable
 * identity provider).
 *
 * <p>
 * Extends RuntimeException per project standards. REST resources map it to an unsuccessful authorization payload
 * rather than an HTTP error.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
