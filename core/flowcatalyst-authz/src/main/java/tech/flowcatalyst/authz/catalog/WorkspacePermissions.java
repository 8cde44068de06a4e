package tech.flowcatalyst.authz.catalog;

import java.util.List;

/**
 * Every permission the authz service knows about.
 *
 * Key format: {service}.{resource}.{action}
 * Examples: docs.document.create, cms.content_entry.publish
 *
 * Adding a permission here and listing it in {@link #ALL} is enough for it to be
 * reconciled into the grant store on the next deployment.
 */
public final class WorkspacePermissions {

    // ========================================================================
    // Workspaces (global)
    // ========================================================================

    public static final PermissionDefinition WORKSPACES_CREATE = PermissionDefinition.make(
        "accounts.workspaces.create", "Create workspaces");

    public static final PermissionDefinition WORKSPACES_LIST_FOR_USER = PermissionDefinition.make(
        "accounts.workspaces.listForUser", "List workspaces for user");

    // ========================================================================
    // Workspace Invites
    // ========================================================================

    public static final PermissionDefinition INVITES_CREATE = PermissionDefinition.make(
        "accounts.invites.create", "Create workspace invites");

    // ========================================================================
    // Documents (Docs Service)
    // ========================================================================

    public static final PermissionDefinition DOCUMENT_CREATE = PermissionDefinition.make(
        "docs.document.create", "Create documents");

    public static final PermissionDefinition DOCUMENT_READ = PermissionDefinition.make(
        "docs.document.read", "Read documents");

    public static final PermissionDefinition DOCUMENT_UPDATE = PermissionDefinition.make(
        "docs.document.update", "Update documents");

    public static final PermissionDefinition DOCUMENT_LIST_BY_WORKSPACE = PermissionDefinition.make(
        "docs.document.listByWorkspace", "List documents by workspace");

    // ========================================================================
    // CMS Blog Entries (legacy)
    // ========================================================================

    public static final PermissionDefinition BLOG_ENTRY_CREATE = PermissionDefinition.make(
        "cms.blog_entry.create", "Create blog entries");

    public static final PermissionDefinition BLOG_ENTRY_READ = PermissionDefinition.make(
        "cms.blog_entry.read", "Read blog entries");

    public static final PermissionDefinition BLOG_ENTRY_LIST_PUBLISHED = PermissionDefinition.make(
        "cms.blog_entry.listPublished", "List published blog entries");

    public static final PermissionDefinition BLOG_ENTRY_GET_PUBLISHED_BY_SLUG = PermissionDefinition.make(
        "cms.blog_entry.getPublishedBySlug", "Get published blog entry by slug");

    public static final PermissionDefinition BLOG_ENTRY_LIST_ADMIN = PermissionDefinition.make(
        "cms.blog_entry.listAdmin", "List blog entries (admin)");

    public static final PermissionDefinition BLOG_ENTRY_UPDATE_META = PermissionDefinition.make(
        "cms.blog_entry.updateMeta", "Update blog entry metadata");

    // ========================================================================
    // CMS Content Types
    // ========================================================================

    public static final PermissionDefinition CONTENT_TYPE_MANAGE = PermissionDefinition.make(
        "cms.content_type.manage", "Manage content types (create, update, delete)");

    // ========================================================================
    // CMS Content Entries
    // ========================================================================

    public static final PermissionDefinition CONTENT_ENTRY_CREATE = PermissionDefinition.make(
        "cms.content_entry.create", "Create content entries");

    public static final PermissionDefinition CONTENT_ENTRY_UPDATE = PermissionDefinition.make(
        "cms.content_entry.update", "Update content entries");

    public static final PermissionDefinition CONTENT_ENTRY_PUBLISH = PermissionDefinition.make(
        "cms.content_entry.publish", "Publish content entries");

    public static final PermissionDefinition CONTENT_ENTRY_LIST_PUBLISHED = PermissionDefinition.make(
        "cms.content_entry.listPublished", "List published content entries");

    public static final PermissionDefinition CONTENT_ENTRY_GET_PUBLISHED_BY_SLUG = PermissionDefinition.make(
        "cms.content_entry.getPublishedBySlug", "Get published content entry by slug");

    // ========================================================================
    // CMS Generic Content (legacy)
    // ========================================================================

    public static final PermissionDefinition CONTENT_CREATE = PermissionDefinition.make(
        "cms.content.create", "Create content");

    public static final PermissionDefinition CONTENT_LIST_PUBLISHED = PermissionDefinition.make(
        "cms.content.listPublished", "List published content");

    public static final PermissionDefinition CONTENT_GET_PUBLISHED_BY_SLUG = PermissionDefinition.make(
        "cms.content.getPublishedBySlug", "Get published content by slug");

    // ========================================================================
    // CMS Templates / Content Types (legacy)
    // ========================================================================

    public static final PermissionDefinition TEMPLATES_LIST_GLOBAL = PermissionDefinition.make(
        "cms.templates.listGlobal", "List global templates");

    public static final PermissionDefinition CONTENT_TYPES_LIST_FOR_WORKSPACE = PermissionDefinition.make(
        "cms.content_types.listForWorkspace", "List content types for workspace");

    // ========================================================================
    // CMS Comments
    // ========================================================================

    public static final PermissionDefinition COMMENTS_CREATE = PermissionDefinition.make(
        "cms.comments.create", "Create comments");

    public static final PermissionDefinition COMMENTS_LIST_FOR_ENTRY = PermissionDefinition.make(
        "cms.comments.listForEntry", "List comments for entry");

    public static final PermissionDefinition COMMENTS_MODERATE = PermissionDefinition.make(
        "cms.comments.moderate", "Moderate comments (approve, reject, delete)");

    // ========================================================================
    // Telemetry
    // ========================================================================

    public static final PermissionDefinition TELEMETRY_EVENTS_VIEW = PermissionDefinition.make(
        "telemetry.events.view", "View telemetry events and stats for workspace");

    /**
     * All permissions, in registration order.
     */
    public static final List<PermissionDefinition> ALL = List.of(
        WORKSPACES_CREATE,
        WORKSPACES_LIST_FOR_USER,
        INVITES_CREATE,
        DOCUMENT_CREATE,
        DOCUMENT_READ,
        DOCUMENT_UPDATE,
        DOCUMENT_LIST_BY_WORKSPACE,
        BLOG_ENTRY_CREATE,
        BLOG_ENTRY_READ,
        BLOG_ENTRY_LIST_PUBLISHED,
        BLOG_ENTRY_GET_PUBLISHED_BY_SLUG,
        BLOG_ENTRY_LIST_ADMIN,
        BLOG_ENTRY_UPDATE_META,
        CONTENT_TYPE_MANAGE,
        CONTENT_ENTRY_CREATE,
        CONTENT_ENTRY_UPDATE,
        CONTENT_ENTRY_PUBLISH,
        CONTENT_ENTRY_LIST_PUBLISHED,
        CONTENT_ENTRY_GET_PUBLISHED_BY_SLUG,
        CONTENT_CREATE,
        CONTENT_LIST_PUBLISHED,
        CONTENT_GET_PUBLISHED_BY_SLUG,
        TEMPLATES_LIST_GLOBAL,
        CONTENT_TYPES_LIST_FOR_WORKSPACE,
        COMMENTS_CREATE,
        COMMENTS_LIST_FOR_ENTRY,
        COMMENTS_MODERATE,
        TELEMETRY_EVENTS_VIEW
    );

    private WorkspacePermissions() {}
}
