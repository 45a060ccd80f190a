package villagecompute.mobile.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Session issued to a mobile client after a successful authorize call.
 *
 * <p>
 * Only the SHA-256 digest of the opaque session token is stored. Expired sessions are kept so the owner can still be
 * recognised as an unauthorized user; deauthorize deletes the row.
 */
@Entity
@Table(
        name = "sessions")
@NamedQuery(
        name = MobileSession.QUERY_FIND_BY_TOKEN_HASH,
        query = "SELECT s FROM MobileSession s WHERE s.tokenHash = :tokenHash")
public class MobileSession extends PanacheEntityBase {

    public static final String QUERY_FIND_BY_TOKEN_HASH = "MobileSession.findByTokenHash";

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "token_hash",
            nullable = false,
            unique = true)
    public String tokenHash;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "expires_at",
            nullable = false)
    public Instant expiresAt;

    @Column(
            name = "last_used_at")
    public Instant lastUsedAt;

    /**
     * Find a session by the digest of its token, including expired sessions.
     *
     * @param tokenHash
     *            hex SHA-256 digest of the session token
     * @return the session if found
     */
    public static Optional<MobileSession> findByTokenHash(String tokenHash) {
        return find("#" + QUERY_FIND_BY_TOKEN_HASH, Parameters.with("tokenHash", tokenHash)).firstResultOptional();
    }

    public static long deleteByTokenHash(String tokenHash) {
        return delete("tokenHash", tokenHash);
    }

    /**
     * Creates and persists a session. Must be called inside a transaction.
     *
     * @param userId
     *            owning user
     * @param tokenHash
     *            hex SHA-256 digest of the issued token
     * @param ttl
     *            session lifetime
     * @return persisted session
     */
    public static MobileSession issue(UUID userId, String tokenHash, Duration ttl) {
        MobileSession session = new MobileSession();
        session.userId = userId;
        session.tokenHash = tokenHash;
        session.createdAt = Instant.now();
        session.expiresAt = session.createdAt.plus(ttl);
        session.persist();
        return session;
    }

    public void markUsed() {
        this.lastUsedAt = Instant.now();
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
