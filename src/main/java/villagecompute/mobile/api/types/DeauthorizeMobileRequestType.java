package villagecompute.mobile.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for {@code POST /api/mobile/auth/deauthorize}.
 *
 * @param sessionToken
 *            token previously returned by authorize
 */
public record DeauthorizeMobileRequestType(@JsonProperty("session_token") @NotBlank String sessionToken) {
}
