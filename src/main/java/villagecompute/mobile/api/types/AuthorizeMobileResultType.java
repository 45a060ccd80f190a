package villagecompute.mobile.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of {@code POST /api/mobile/auth/authorize}.
 *
 * @param success
 *            whether the Google ID token was accepted
 * @param sessionToken
 *            opaque session token, null when {@code success} is false
 */
public record AuthorizeMobileResultType(boolean success, @JsonProperty("session_token") String sessionToken) {

    public static AuthorizeMobileResultType authorized(String sessionToken) {
        return new AuthorizeMobileResultType(true, sessionToken);
    }

    public static AuthorizeMobileResultType rejected() {
        return new AuthorizeMobileResultType(false, null);
    }
}
