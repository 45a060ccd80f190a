package villagecompute.mobile.integration.google;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import villagecompute.mobile.api.types.GoogleTokenInfoType;
import villagecompute.mobile.exceptions.AuthenticationException;

import java.time.Instant;
import java.util.List;

/**
 * Verifies Google ID tokens sent by the mobile app.
 *
 * <p>
 * A token is accepted when Google's tokeninfo endpoint recognises it and its claims match this deployment:
 *
 * <ul>
 * <li>{@code aud} equals village.auth.google.client-id
 * <li>{@code iss} is one of village.auth.google.issuers
 * <li>{@code email_verified} is "true"
 * <li>{@code exp} lies in the future
 * </ul>
 */
@ApplicationScoped
public class GoogleIdTokenVerifier {

    private static final Logger LOG = Logger.getLogger(GoogleIdTokenVerifier.class);

    @ConfigProperty(
            name = "village.auth.google.client-id")
    String clientId;

    @ConfigProperty(
            name = "village.auth.google.issuers",
            defaultValue = "accounts.google.com,https://accounts.google.com")
    List<String> issuers;

    @Inject
    @RestClient
    GoogleTokenInfoRestClient restClient;

    /**
     * Verifies an ID token.
     *
     * @param idToken
     *            raw Google ID token
     * @return verified token claims
     * @throws AuthenticationException
     *             if the token is blank, rejected by Google, or its claims do not match
     */
    public GoogleTokenInfoType verify(String idToken) {
        if (idToken == null || idToken.isBlank()) {
            throw new AuthenticationException("Google ID token is required");
        }

        GoogleTokenInfoType info;
        try {
            info = restClient.tokenInfo(idToken);
        } catch (WebApplicationException e) {
            throw new AuthenticationException(
                    "Google rejected ID token (HTTP " + e.getResponse().getStatus() + ")", e);
        } catch (ProcessingException e) {
            LOG.warnf(e, "Google tokeninfo call failed");
            throw new AuthenticationException("Unable to reach Google tokeninfo endpoint", e);
        }
        if (info == null) {
            throw new AuthenticationException("Empty tokeninfo response");
        }

        if (!clientId.equals(info.aud())) {
            throw new AuthenticationException("ID token audience does not match client id");
        }
        if (info.iss() == null || !issuers.contains(info.iss())) {
            throw new AuthenticationException("Unexpected ID token issuer: " + info.iss());
        }
        if (!"true".equals(info.emailVerified())) {
            throw new AuthenticationException("Google account email is not verified");
        }
        if (info.sub() == null || info.sub().isBlank()) {
            throw new AuthenticationException("ID token has no subject");
        }
        if (isExpired(info.exp())) {
            throw new AuthenticationException("ID token has expired");
        }
        return info;
    }

    private static boolean isExpired(String exp) {
        if (exp == null) {
            return true;
        }
        try {
            return !Instant.ofEpochSecond(Long.parseLong(exp)).isAfter(Instant.now());
        } catch (NumberFormatException e) {
            LOG.warnf("Malformed exp claim in ID token: %s", exp);
            return true;
        }
    }
}
