package villagecompute.mobile.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.mobile.auth.Identity;

/**
 * Response of {@code GET /api/mobile/whoami}. Intended for testing clients; the wording of
 * {@code human_readable_type} may change.
 *
 * @param id
 *            user UUID, or the anonymous device id
 * @param humanReadableType
 *            description of the identity state
 */
public record WhoamiType(String id, @JsonProperty("human_readable_type") String humanReadableType) {

    public static WhoamiType from(Identity identity) {
        String description = switch (identity.kind()) {
            case AUTHORIZED_USER -> "authorized user";
            case ANONYMOUS_USER -> "anonymous user";
            case UNAUTHORIZED_USER -> "unauthorized (but not anonymous) user";
        };
        return new WhoamiType(identity.id(), description);
    }
}
