package tech.flowcatalyst.authz.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.authz.resolve.Roles;

import static org.assertj.core.api.Assertions.*;

/**
 * Checks on the production catalog. A failure here would abort startup.
 */
class StandardCatalogTest {

    private final PermissionCatalog catalog = StandardCatalog.load();

    @Test
    @DisplayName("The production catalog loads and covers every declared permission and role")
    void load_shouldSucceed() {
        assertThat(catalog.permissions()).hasSameSizeAs(WorkspacePermissions.ALL);
        assertThat(catalog.roleKeys())
            .containsExactlyInAnyOrder("workspace_owner", "workspace_member", "content_editor", "read_only", Roles.SUPER_ADMIN);
    }

    @Test
    @DisplayName("Only workspace creation and listing are global actions")
    void globalActions_shouldBeWorkspaceCreateAndList() {
        assertThat(catalog.globalActions())
            .containsExactlyInAnyOrder("accounts.workspaces.create", "accounts.workspaces.listForUser");
    }

    @Test
    @DisplayName("Owner and super admin hold every permission; member holds none")
    void roles_shouldHaveExpectedBreadth() {
        assertThat(catalog.permissionKeysForRole("workspace_owner")).isEqualTo(catalog.permissionKeys());
        assertThat(catalog.permissionKeysForRole(Roles.SUPER_ADMIN)).isEqualTo(catalog.permissionKeys());
        assertThat(catalog.permissionKeysForRole("workspace_member")).isEmpty();
    }

    @Test
    @DisplayName("Content editor cannot invite members or view telemetry")
    void contentEditor_shouldNotInviteOrViewTelemetry() {
        assertThat(catalog.permissionKeysForRole("content_editor"))
            .contains(WorkspacePermissions.DOCUMENT_CREATE.key(), WorkspacePermissions.COMMENTS_MODERATE.key())
            .doesNotContain(WorkspacePermissions.INVITES_CREATE.key(), WorkspacePermissions.TELEMETRY_EVENTS_VIEW.key());
    }

    @Test
    @DisplayName("Read-only holds no create, update, publish or moderate permission")
    void readOnly_shouldOnlyReadAndList() {
        assertThat(catalog.permissionKeysForRole("read_only"))
            .contains(WorkspacePermissions.DOCUMENT_READ.key())
            .allSatisfy(key -> assertThat(key).doesNotContainPattern(
                "\\.(create|update|publish|moderate|manage|updateMeta|listAdmin|view)$"));
    }
}
