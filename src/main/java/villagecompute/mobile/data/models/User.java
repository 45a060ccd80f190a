package villagecompute.mobile.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Account of a mobile user who signed in through an OAuth provider, implementing the Panache ActiveRecord pattern.
 *
 * <p>
 * Anonymous users have no row here; they are identified per request by the id the client sends.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier, exposed by whoami</li>
 * <li>{@code email} (TEXT) - Verified email address reported by the provider</li>
 * <li>{@code oauth_provider} (TEXT) - OAuth provider: google</li>
 * <li>{@code oauth_id} (TEXT) - Provider-specific user ID (Google {@code sub})</li>
 * <li>{@code display_name} (TEXT) - User's display name</li>
 * <li>{@code avatar_url} (TEXT) - Profile picture URL</li>
 * <li>{@code is_active} (BOOLEAN) - Inactive accounts keep their sessions but lose authorized access</li>
 * <li>{@code last_active_at} (TIMESTAMPTZ) - Last activity timestamp</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - Record creation timestamp</li>
 * <li>{@code updated_at} (TIMESTAMPTZ) - Last modification timestamp</li>
 * </ul>
 */
@Entity
@Table(
        name = "users",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_users_oauth",
                columnNames = {"oauth_provider", "oauth_id"}))
@NamedQuery(
        name = User.QUERY_FIND_BY_OAUTH,
        query = "SELECT u FROM User u WHERE u.oauthProvider = :provider AND u.oauthId = :providerId")
public class User extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(User.class);

    public static final String QUERY_FIND_BY_OAUTH = "User.findByOAuth";

    public static final String PROVIDER_GOOGLE = "google";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column
    public String email;

    @Column(
            name = "oauth_provider",
            nullable = false)
    public String oauthProvider;

    @Column(
            name = "oauth_id",
            nullable = false)
    public String oauthId;

    @Column(
            name = "display_name")
    public String displayName;

    @Column(
            name = "avatar_url")
    public String avatarUrl;

    @Column(
            name = "is_active",
            nullable = false)
    public boolean isActive;

    @Column(
            name = "last_active_at")
    public Instant lastActiveAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Finds a user by OAuth provider and provider-specific ID.
     *
     * @param provider
     *            OAuth provider (google)
     * @param providerId
     *            provider-specific user ID
     * @return Optional containing the user if found
     */
    public static Optional<User> findByOAuth(String provider, String providerId) {
        if (provider == null || providerId == null) {
            return Optional.empty();
        }
        return find("#" + QUERY_FIND_BY_OAUTH, Parameters.with("provider", provider).and("providerId", providerId))
                .firstResultOptional();
    }

    /**
     * Creates and persists a user from a verified Google identity. Must be called inside a transaction.
     *
     * @param googleSubject
     *            Google {@code sub} claim
     * @param email
     *            verified email address
     * @param displayName
     *            user's display name (nullable)
     * @param avatarUrl
     *            profile picture URL (nullable)
     * @return persisted user with generated UUID
     */
    public static User createFromGoogle(String googleSubject, String email, String displayName, String avatarUrl) {
        User user = new User();
        user.oauthProvider = PROVIDER_GOOGLE;
        user.oauthId = googleSubject;
        user.email = email;
        user.displayName = displayName;
        user.avatarUrl = avatarUrl;
        user.isActive = true;
        user.createdAt = Instant.now();
        user.updatedAt = user.createdAt;
        user.lastActiveAt = user.createdAt;
        user.persist();
        LOG.infof("Created mobile user %s from Google subject", user.id);
        return user;
    }

    /**
     * Updates the last_active_at timestamp to current time.
     */
    public void updateLastActive() {
        this.lastActiveAt = Instant.now();
        this.updatedAt = Instant.now();
    }
}
