package villagecompute.mobile.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Google tokeninfo response for an ID token.
 *
 * <p>
 * Returned by GET https://oauth2.googleapis.com/tokeninfo?id_token=... Google reports every claim as a string,
 * including {@code email_verified} and {@code exp}.
 *
 * @param iss
 *            token issuer
 * @param sub
 *            Google user ID (unique, stable identifier)
 * @param aud
 *            OAuth client id the token was issued to
 * @param email
 *            user's email address
 * @param emailVerified
 *            "true" when Google verified the email
 * @param exp
 *            expiry in epoch seconds
 * @param name
 *            full name
 * @param picture
 *            profile picture URL
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record GoogleTokenInfoType(String iss, String sub, String aud, String email,
        @JsonProperty("email_verified") String emailVerified, String exp, String name, String picture) {
}
