package villagecompute.mobile.exceptions;

/**
 * Exception thrown when section records cannot be read from storage (connection loss, query failure).
 *
 * <p>
 * Extends RuntimeException per project standards. Storage failures are transient; retrying is left to the caller.
 */
public class SectionStorageException extends RuntimeException {

    public SectionStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
