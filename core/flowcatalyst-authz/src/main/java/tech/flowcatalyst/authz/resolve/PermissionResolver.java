package tech.flowcatalyst.authz.resolve;

import java.util.Collection;
import java.util.Map;

/**
 * The workspace decision rule, free of any I/O.
 *
 * A principal is allowed an action when it holds {@link Roles#SUPER_ADMIN}, or
 * when at least one of its roles grants the action. Role order does not matter
 * and no role outranks another.
 */
public final class PermissionResolver {

    /**
     * Resolve a permission against an in-memory grant map.
     *
     * @param roleKeys role keys held by the principal
     * @param grants role key -> granted permission keys
     * @param actionKey permission key being checked
     * @return true if the action is allowed
     */
    public static boolean resolvePermission(Collection<String> roleKeys,
                                            Map<String, ? extends Collection<String>> grants,
                                            String actionKey) {
        if (roleKeys == null || roleKeys.isEmpty()) {
            return false;
        }
        if (roleKeys.contains(Roles.SUPER_ADMIN)) {
            return true;
        }
        if (grants == null || actionKey == null) {
            return false;
        }
        for (String roleKey : roleKeys) {
            Collection<String> granted = grants.get(roleKey);
            if (granted != null && granted.contains(actionKey)) {
                return true;
            }
        }
        return false;
    }

    private PermissionResolver() {}
}
