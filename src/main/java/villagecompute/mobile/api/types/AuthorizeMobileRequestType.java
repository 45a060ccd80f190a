package villagecompute.mobile.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for {@code POST /api/mobile/auth/authorize}.
 *
 * @param googleIdToken
 *            ID token obtained by the app from Google Sign-In
 */
public record AuthorizeMobileRequestType(@JsonProperty("google_id_token") @NotBlank String googleIdToken) {
}
