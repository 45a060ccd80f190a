package villagecompute.mobile.auth;

/**
 * The three states a requesting mobile user can be in.
 *
 * <p>
 * Code that depends on the caller's state switches over this enum with switch expressions (no {@code default}
 * branch), so a new state fails compilation everywhere it is not handled.
 */
public enum IdentityKind {

    /**
     * Presented a live session token of an active account.
     */
    AUTHORIZED_USER,

    /**
     * Presented no session token, or one this server never issued.
     */
    ANONYMOUS_USER,

    /**
     * Presented a session token that maps to a known account but is expired or belongs to a disabled account.
     */
    UNAUTHORIZED_USER
}
