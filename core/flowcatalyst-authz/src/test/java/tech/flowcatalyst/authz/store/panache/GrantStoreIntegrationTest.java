package tech.flowcatalyst.authz.store.panache;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.authz.catalog.PermissionCatalog;
import tech.flowcatalyst.authz.catalog.WorkspacePermissions;
import tech.flowcatalyst.authz.reconcile.CatalogReconciler;
import tech.flowcatalyst.authz.reconcile.ReconciliationResult;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the PostgreSQL grant store. The catalog has already
 * been reconciled once at startup.
 */
@Tag("integration")
@QuarkusTest
class GrantStoreIntegrationTest {

    @Inject
    CatalogWriteRepository catalogStore;

    @Inject
    RoleAssignmentReadRepository assignments;

    @Inject
    RoleGrantReadRepository grants;

    @Inject
    CatalogReconciler reconciler;

    @Inject
    PermissionCatalog catalog;

    @Test
    @DisplayName("Persisted links match the catalog after startup")
    void startup_shouldPersistCatalogLinks() {
        String roleId = catalogStore.findRoleId("read_only").orElseThrow();

        assertThat(catalogStore.findRoleGrants(roleId).keySet())
            .isEqualTo(catalog.permissionKeysForRole("read_only"));
    }

    @Test
    @DisplayName("roleSetGrants follows role links")
    void roleSetGrants_shouldFollowLinks() {
        assertThat(grants.roleSetGrants(Set.of("read_only"), WorkspacePermissions.DOCUMENT_READ.key())).isTrue();
        assertThat(grants.roleSetGrants(Set.of("read_only"), WorkspacePermissions.DOCUMENT_CREATE.key())).isFalse();
        assertThat(grants.roleSetGrants(Set.of("workspace_member", "content_editor"),
            WorkspacePermissions.DOCUMENT_CREATE.key())).isTrue();
        assertThat(grants.roleSetGrants(Set.of(), WorkspacePermissions.DOCUMENT_READ.key())).isFalse();
    }

    @Test
    @DisplayName("A drifted link is removed by the next reconciliation")
    void reconcile_shouldRemoveDriftedLink() {
        String roleId = catalogStore.findRoleId("read_only").orElseThrow();
        Map<String, String> ids = catalogStore.findPermissionIds(Set.of(WorkspacePermissions.DOCUMENT_CREATE.key()));
        catalogStore.insertRoleGrants(roleId, ids.values());
        assertThat(grants.roleSetGrants(Set.of("read_only"), WorkspacePermissions.DOCUMENT_CREATE.key())).isTrue();

        ReconciliationResult result = reconciler.reconcile(catalog);

        assertThat(result.grantsRemoved()).isEqualTo(1);
        assertThat(result.grantsInserted()).isZero();
        assertThat(grants.roleSetGrants(Set.of("read_only"), WorkspacePermissions.DOCUMENT_CREATE.key())).isFalse();
    }

    @Test
    @DisplayName("Assigning a role twice stores one assignment")
    void assignRole_shouldBeIdempotent() {
        String user = UUID.randomUUID().toString();
        String workspace = UUID.randomUUID().toString();

        assertThat(assignments.assignRole(user, workspace, "content_editor")).isTrue();
        assertThat(assignments.assignRole(user, workspace, "content_editor")).isFalse();

        assertThat(assignments.fetchRoleKeys(user, workspace)).containsExactly("content_editor");
        assertThat(assignments.fetchRoleKeys(user, UUID.randomUUID().toString())).isEmpty();
    }
}
