package villagecompute.mobile.data.models;

/**
 * Audience a persisted section is restricted to.
 *
 * <p>
 * Stored as text in {@code sdui_sections.visibility}. The mapping from audience to identity states is decided by the
 * active {@code SectionVisibilityPolicy}.
 */
public enum SectionVisibility {

    /**
     * Shown to everybody, including anonymous users.
     */
    PUBLIC,

    /**
     * Shown to users who identified themselves with a session token, whether or not the session is still valid.
     */
    IDENTIFIED,

    /**
     * Shown only to users with a valid session.
     */
    AUTHORIZED
}
