package tech.flowcatalyst.authz.reconcile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.authz.catalog.PermissionCatalog;
import tech.flowcatalyst.authz.catalog.PermissionDefinition;
import tech.flowcatalyst.authz.catalog.RoleDefinition;
import tech.flowcatalyst.authz.catalog.StandardCatalog;
import tech.flowcatalyst.authz.store.CatalogStore;
import tech.flowcatalyst.authz.store.GrantStoreUnavailableException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CatalogReconciler against an in-memory store.
 */
class CatalogReconcilerTest {

    private static final PermissionDefinition A = PermissionDefinition.make("docs.document.read", "Read documents");
    private static final PermissionDefinition B = PermissionDefinition.make("docs.document.update", "Update documents");
    private static final PermissionDefinition C = PermissionDefinition.make("docs.document.create", "Create documents");

    private static final PermissionCatalog CATALOG = PermissionCatalog.of(
        List.of(A, B, C),
        List.of(
            RoleDefinition.make("editor", "Editor", List.of(A, B)),
            RoleDefinition.make("owner", "Owner", List.of(A, B, C)),
            RoleDefinition.make("member", "Member", List.of())
        ),
        List.of());

    private InMemoryCatalogStore store;
    private CatalogReconciler reconciler;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatalogStore();
        reconciler = new CatalogReconciler(store);
    }

    @Test
    @DisplayName("An empty store receives every catalog link")
    void reconcile_shouldInsertAllLinks_whenStoreEmpty() {
        ReconciliationResult result = reconciler.reconcile(CATALOG);

        assertThat(store.grantedKeys("editor")).containsExactly(A.key(), B.key());
        assertThat(store.grantedKeys("owner")).containsExactly(C.key(), A.key(), B.key());
        assertThat(store.grantedKeys("member")).isEmpty();
        assertThat(result.permissions()).isEqualTo(3);
        assertThat(result.roles()).isEqualTo(3);
        assertThat(result.grantsInserted()).isEqualTo(5);
        assertThat(result.grantsRemoved()).isZero();
        assertThat(result.changedGrants()).isTrue();
    }

    @Test
    @DisplayName("Reconciling twice leaves the same links as reconciling once")
    void reconcile_shouldBeIdempotent() {
        reconciler.reconcile(CATALOG);
        var afterFirst = store.links();

        ReconciliationResult second = reconciler.reconcile(CATALOG);

        assertThat(store.links()).isEqualTo(afterFirst);
        assertThat(second.changedGrants()).isFalse();
    }

    @Test
    @DisplayName("A catalog permission linked to a role outside its desired set is removed")
    void reconcile_shouldRemoveDrift() {
        reconciler.reconcile(CATALOG);
        store.seedLink("editor", C.key());

        ReconciliationResult result = reconciler.reconcile(CATALOG);

        assertThat(store.grantedKeys("editor")).containsExactly(A.key(), B.key());
        assertThat(store.grantedKeys("owner")).contains(C.key());
        assertThat(result.grantsRemoved()).isEqualTo(1);
    }

    @Test
    @DisplayName("Links to permissions the catalog does not track are left alone")
    void reconcile_shouldKeepUntrackedLinks() {
        store.seedPermission("legacy.report.export", "Export reports");
        store.seedRole("editor");
        store.seedLink("editor", "legacy.report.export");

        reconciler.reconcile(CATALOG);

        assertThat(store.grantedKeys("editor")).containsExactly(A.key(), B.key(), "legacy.report.export");
    }

    @Test
    @DisplayName("Changed descriptions are applied; ids stay stable")
    void reconcile_shouldUpdateDescription() {
        String id = store.seedPermission(A.key(), "Old description");

        reconciler.reconcile(CATALOG);

        assertThat(store.permissionDescription(A.key())).isEqualTo("Read documents");
        assertThat(store.findPermissionIds(List.of(A.key()))).containsEntry(A.key(), id);
    }

    @Test
    @DisplayName("Role id is re-queried when the upsert does not return it")
    void reconcile_shouldRequeryRoleId_whenUpsertReturnsNone() {
        store.returnRoleIdFromUpsert(false);

        reconciler.reconcile(CATALOG);

        assertThat(store.grantedKeys("editor")).containsExactly(A.key(), B.key());
    }

    @Test
    @DisplayName("An unresolvable role aborts the run before any of its links are written")
    void reconcile_shouldAbort_whenRoleCannotBeResolved() {
        CatalogStore failing = mock(CatalogStore.class);
        when(failing.upsertRole(any())).thenReturn(Optional.empty());
        when(failing.findRoleId(anyString())).thenReturn(Optional.empty());

        Throwable thrown = catchThrowable(() -> new CatalogReconciler(failing).reconcile(CATALOG));

        assertThat(thrown)
            .isInstanceOf(ReconciliationException.class)
            .hasMessageContaining("Failed to upsert role: editor");
        assertThat(((ReconciliationException) thrown).roleKey()).isEqualTo("editor");

        verify(failing, never()).insertRoleGrants(anyString(), anyCollection());
        verify(failing, never()).findRoleGrants(anyString());
        verify(failing, never()).deleteRoleGrant(anyString(), anyString());
    }

    @Test
    @DisplayName("Store failures propagate unchanged")
    void reconcile_shouldPropagate_whenStoreFails() {
        CatalogStore failing = mock(CatalogStore.class);
        GrantStoreUnavailableException failure = new GrantStoreUnavailableException("down", new RuntimeException());
        doThrow(failure).when(failing).upsertPermissions(anyCollection());

        assertThatThrownBy(() -> new CatalogReconciler(failing).reconcile(CATALOG)).isSameAs(failure);
    }

    @Test
    @DisplayName("Overlapping runs converge on the same links as a single run")
    void reconcile_shouldConverge_whenRunsOverlap() throws Exception {
        PermissionCatalog catalog = StandardCatalog.load();
        InMemoryCatalogStore reference = new InMemoryCatalogStore();
        new CatalogReconciler(reference).reconcile(catalog);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Callable<ReconciliationResult> run = () -> {
                start.await();
                return reconciler.reconcile(catalog);
            };
            Future<ReconciliationResult> first = executor.submit(run);
            Future<ReconciliationResult> second = executor.submit(run);
            start.countDown();

            int inserted = first.get(10, TimeUnit.SECONDS).grantsInserted()
                + second.get(10, TimeUnit.SECONDS).grantsInserted();

            assertThat(inserted).isEqualTo(reference.links().size());
        } finally {
            executor.shutdownNow();
        }

        for (String roleKey : catalog.roleKeys()) {
            assertThat(store.grantedKeys(roleKey)).as(roleKey).isEqualTo(reference.grantedKeys(roleKey));
        }
    }
}
