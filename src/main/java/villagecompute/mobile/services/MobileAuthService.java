package villagecompute.mobile.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.mobile.api.types.GoogleTokenInfoType;
import villagecompute.mobile.auth.Identity;
import villagecompute.mobile.data.models.MobileSession;
import villagecompute.mobile.data.models.User;
import villagecompute.mobile.exceptions.AuthenticationException;
import villagecompute.mobile.integration.google.GoogleIdTokenVerifier;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;

/**
 * Mobile sign-in and per-request identity resolution.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Exchanging a verified Google ID token for an opaque session token ({@code authorize})</li>
 * <li>Revoking session tokens ({@code deauthorize})</li>
 * <li>Resolving the three-state {@link Identity} of a request from its bearer token and anonymous id</li>
 * </ul>
 *
 * <p>
 * Session tokens are 32 random bytes, base64url encoded. Only their SHA-256 digest is stored.
 */
@ApplicationScoped
public class MobileAuthService {

    private static final Logger LOG = Logger.getLogger(MobileAuthService.class);

    public static final String ANONYMOUS_ID_HEADER = "X-Anonymous-Id";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom = new SecureRandom();

    @ConfigProperty(
            name = "village.auth.session.ttl-days",
            defaultValue = "30")
    long sessionTtlDays;

    @Inject
    GoogleIdTokenVerifier googleIdTokenVerifier;

    @Inject
    Tracer tracer;

    /**
     * Signs a user in with a Google ID token, registering the user on first sign-in.
     *
     * @param googleIdToken
     *            ID token obtained by the app from Google Sign-In
     * @return opaque session token to send as {@code Authorization: Bearer <token>}
     * @throws AuthenticationException
     *             if the token is rejected or the account is disabled
     */
    @Transactional
    public String authorize(String googleIdToken) {
        Span span = tracer.spanBuilder("mobile_auth.authorize").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            GoogleTokenInfoType tokenInfo = googleIdTokenVerifier.verify(googleIdToken);

            User user = User.findByOAuth(User.PROVIDER_GOOGLE, tokenInfo.sub())
                    .orElseGet(() -> User.createFromGoogle(tokenInfo.sub(), tokenInfo.email(), tokenInfo.name(),
                            tokenInfo.picture()));
            if (!user.isActive) {
                throw new AuthenticationException("Account " + user.id + " is disabled");
            }
            user.updateLastActive();

            String token = newSessionToken();
            MobileSession.issue(user.id, hash(token), Duration.ofDays(sessionTtlDays));
            span.setAttribute("user.id", user.id.toString());
            LOG.infof("Issued mobile session for user %s", user.id);
            return token;
        } catch (AuthenticationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Revokes a session token.
     *
     * @param sessionToken
     *            token returned by {@link #authorize(String)}
     * @return true if a session was deleted
     */
    @Transactional
    public boolean deauthorize(String sessionToken) {
        Span span = tracer.spanBuilder("mobile_auth.deauthorize").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            if (sessionToken == null || sessionToken.isBlank()) {
                return false;
            }
            long deleted = MobileSession.deleteByTokenHash(hash(sessionToken));
            span.setAttribute("sessions.deleted", deleted);
            return deleted > 0;
        } finally {
            span.end();
        }
    }

    /**
     * Resolves the identity of a request.
     *
     * <ul>
     * <li>Valid bearer token of an active user: authorized user</li>
     * <li>Known bearer token that expired, or whose user is disabled: unauthorized user</li>
     * <li>Anything else: anonymous user, identified by {@code anonymousId} when it is a UUID, otherwise by a fresh
     * random id</li>
     * </ul>
     *
     * @param authorizationHeader
     *            raw Authorization header (nullable)
     * @param anonymousId
     *            device id sent by the app (nullable)
     * @return resolved identity, never null
     */
    @Transactional
    public Identity resolveIdentity(String authorizationHeader, String anonymousId) {
        Span span = tracer.spanBuilder("mobile_auth.resolve_identity").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            Identity identity = bearerToken(authorizationHeader).flatMap(this::identityForToken)
                    .orElseGet(() -> Identity.anonymous(normalizeAnonymousId(anonymousId)));
            span.setAttribute("identity.kind", identity.kind().name());
            return identity;
        } finally {
            span.end();
        }
    }

    private Optional<Identity> identityForToken(String token) {
        Optional<MobileSession> found = MobileSession.findByTokenHash(hash(token));
        if (found.isEmpty()) {
            LOG.debugf("Unknown session token presented");
            return Optional.empty();
        }
        MobileSession session = found.get();
        User user = User.findById(session.userId);
        if (user == null) {
            LOG.warnf("Session %s references missing user %s", session.id, session.userId);
            return Optional.empty();
        }
        if (session.isExpired(Instant.now()) || !user.isActive) {
            return Optional.of(Identity.unauthorized(user.id));
        }
        session.markUsed();
        return Optional.of(Identity.authorized(user.id));
    }

    private static Optional<String> bearerToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0,
                BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    private static String normalizeAnonymousId(String anonymousId) {
        if (anonymousId != null) {
            try {
                return UUID.fromString(anonymousId.trim()).toString();
            } catch (IllegalArgumentException e) {
                LOG.debugf("Ignoring malformed anonymous id: %s", anonymousId);
            }
        }
        return UUID.randomUUID().toString();
    }

    private String newSessionToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
