package tech.flowcatalyst.authz.resolve;

/**
 * Reserved role keys.
 */
public final class Roles {

    /**
     * Satisfies every permission check in a workspace without consulting grant links.
     */
    public static final String SUPER_ADMIN = "super_admin";

    private Roles() {}
}
