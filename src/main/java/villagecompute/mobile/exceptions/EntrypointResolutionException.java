package villagecompute.mobile.exceptions;

/**
 * Exception thrown when the sections of an entrypoint cannot be resolved.
 *
 * <p>
 * The {@link Reason} tells callers how to react:
 * <ul>
 * <li>{@link Reason#INVALID_KEY} - the entrypoint key was blank; permanent, typically HTTP 400</li>
 * <li>{@link Reason#DECODE} - a persisted section is malformed; permanent, cause is a
 * {@link ComponentDecodeException}</li>
 * <li>{@link Reason#STORAGE} - records could not be loaded; transient, cause is a {@link SectionStorageException}</li>
 * </ul>
 */
public class EntrypointResolutionException extends RuntimeException {

    public enum Reason {
        INVALID_KEY, DECODE, STORAGE
    }

    private final Reason reason;
    private final String entrypointKey;

    private EntrypointResolutionException(Reason reason, String entrypointKey, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.entrypointKey = entrypointKey;
    }

    public static EntrypointResolutionException invalidKey(String entrypointKey) {
        return new EntrypointResolutionException(Reason.INVALID_KEY, entrypointKey,
                "Entrypoint key must not be blank", null);
    }

    public static EntrypointResolutionException decode(String entrypointKey, ComponentDecodeException cause) {
        return new EntrypointResolutionException(Reason.DECODE, entrypointKey,
                "Entrypoint '" + entrypointKey + "' contains a malformed section: " + cause.getMessage(), cause);
    }

    public static EntrypointResolutionException storage(String entrypointKey, SectionStorageException cause) {
        return new EntrypointResolutionException(Reason.STORAGE, entrypointKey,
                "Unable to load sections for entrypoint '" + entrypointKey + "'", cause);
    }

    public Reason getReason() {
        return reason;
    }

    public String getEntrypointKey() {
        return entrypointKey;
    }
}
