package tech.flowcatalyst.authz.catalog;

import tech.flowcatalyst.authz.resolve.Roles;

import java.util.List;

import static tech.flowcatalyst.authz.catalog.WorkspacePermissions.*;

/**
 * Role definitions for workspace members.
 *
 * Each role lists exactly the permissions it should hold; reconciliation removes
 * any other catalog permission linked to the role in the grant store.
 */
public final class WorkspaceRoles {

    /**
     * Workspace owner - full access to every workspace feature.
     */
    public static final RoleDefinition WORKSPACE_OWNER = RoleDefinition.make(
        "workspace_owner",
        "Workspace Owner with full access",
        WorkspacePermissions.ALL
    );

    /**
     * Basic member. Holds no permissions of its own; members are granted
     * additional roles for actual capabilities.
     */
    public static final RoleDefinition WORKSPACE_MEMBER = RoleDefinition.make(
        "workspace_member",
        "Workspace Member",
        List.of()
    );

    /**
     * All docs and CMS permissions, including comment moderation.
     * No invites and no telemetry.
     */
    public static final RoleDefinition CONTENT_EDITOR = RoleDefinition.make(
        "content_editor",
        "Content Editor",
        List.of(
            // Documents
            DOCUMENT_CREATE,
            DOCUMENT_READ,
            DOCUMENT_UPDATE,
            DOCUMENT_LIST_BY_WORKSPACE,
            // Content types and entries
            CONTENT_TYPE_MANAGE,
            CONTENT_ENTRY_CREATE,
            CONTENT_ENTRY_UPDATE,
            CONTENT_ENTRY_PUBLISH,
            CONTENT_ENTRY_LIST_PUBLISHED,
            CONTENT_ENTRY_GET_PUBLISHED_BY_SLUG,
            // Blog (legacy)
            BLOG_ENTRY_CREATE,
            BLOG_ENTRY_READ,
            BLOG_ENTRY_LIST_PUBLISHED,
            BLOG_ENTRY_GET_PUBLISHED_BY_SLUG,
            BLOG_ENTRY_LIST_ADMIN,
            BLOG_ENTRY_UPDATE_META,
            // Generic content (legacy)
            CONTENT_CREATE,
            CONTENT_LIST_PUBLISHED,
            CONTENT_GET_PUBLISHED_BY_SLUG,
            // Templates (legacy)
            TEMPLATES_LIST_GLOBAL,
            CONTENT_TYPES_LIST_FOR_WORKSPACE,
            // Comments
            COMMENTS_CREATE,
            COMMENTS_LIST_FOR_ENTRY,
            COMMENTS_MODERATE,
            // Workspaces (global)
            WORKSPACES_CREATE,
            WORKSPACES_LIST_FOR_USER
        )
    );

    /**
     * Read and list published content only - no create, update, publish or moderate.
     */
    public static final RoleDefinition READ_ONLY = RoleDefinition.make(
        "read_only",
        "Read Only User",
        List.of(
            DOCUMENT_READ,
            DOCUMENT_LIST_BY_WORKSPACE,
            CONTENT_ENTRY_LIST_PUBLISHED,
            CONTENT_ENTRY_GET_PUBLISHED_BY_SLUG,
            BLOG_ENTRY_READ,
            BLOG_ENTRY_LIST_PUBLISHED,
            BLOG_ENTRY_GET_PUBLISHED_BY_SLUG,
            COMMENTS_LIST_FOR_ENTRY,
            CONTENT_LIST_PUBLISHED,
            CONTENT_GET_PUBLISHED_BY_SLUG,
            TEMPLATES_LIST_GLOBAL,
            CONTENT_TYPES_LIST_FOR_WORKSPACE,
            WORKSPACES_LIST_FOR_USER
        )
    );

    /**
     * System administrator.
     *
     * The resolver lets this role through without looking at its links; the
     * permissions are still listed so the grant store reflects what it can do.
     */
    public static final RoleDefinition SUPER_ADMIN = RoleDefinition.make(
        Roles.SUPER_ADMIN,
        "Super Admin with all permissions",
        WorkspacePermissions.ALL
    );

    public static final List<RoleDefinition> ALL = List.of(
        WORKSPACE_OWNER,
        WORKSPACE_MEMBER,
        CONTENT_EDITOR,
        READ_ONLY,
        SUPER_ADMIN
    );

    private WorkspaceRoles() {}
}
