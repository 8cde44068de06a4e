package tech.flowcatalyst.authz.catalog;

import java.util.List;

/**
 * The production permission catalog.
 */
public final class StandardCatalog {

    /**
     * Actions any authenticated principal may perform without a workspace.
     */
    public static final List<String> GLOBAL_ACTIONS = List.of(
        WorkspacePermissions.WORKSPACES_CREATE.key(),
        WorkspacePermissions.WORKSPACES_LIST_FOR_USER.key()
    );

    /**
     * Build the catalog from {@link WorkspacePermissions} and {@link WorkspaceRoles}.
     *
     * @throws CatalogValidationException if the definitions are inconsistent
     */
    public static PermissionCatalog load() {
        return PermissionCatalog.of(WorkspacePermissions.ALL, WorkspaceRoles.ALL, GLOBAL_ACTIONS);
    }

    private StandardCatalog() {}
}
