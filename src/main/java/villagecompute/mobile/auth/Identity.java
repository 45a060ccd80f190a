package villagecompute.mobile.auth;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of the user behind a mobile request.
 *
 * <p>
 * Consumed as an input (visibility filtering, {@code whoami}); never persisted with section or component data.
 *
 * @param kind
 *            identity state
 * @param id
 *            user UUID for authorized/unauthorized users, anonymous device identifier for anonymous users
 */
public record Identity(IdentityKind kind, String id) {

    public Identity {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(id, "id is required");
    }

    public static Identity authorized(UUID userId) {
        return new Identity(IdentityKind.AUTHORIZED_USER, userId.toString());
    }

    public static Identity unauthorized(UUID userId) {
        return new Identity(IdentityKind.UNAUTHORIZED_USER, userId.toString());
    }

    public static Identity anonymous(String anonymousId) {
        return new Identity(IdentityKind.ANONYMOUS_USER, anonymousId);
    }
}
