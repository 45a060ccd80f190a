package villagecompute.mobile.api.types;

/**
 * Result of {@code POST /api/mobile/auth/deauthorize}.
 *
 * @param success
 *            true if a session was revoked
 */
public record DeauthorizeMobileResultType(boolean success) {
}
