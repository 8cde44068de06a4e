package tech.flowcatalyst.authz.api;

import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.authz.store.GrantStoreUnavailableException;
import tech.flowcatalyst.authz.store.RoleAssignmentRepository;

import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * HTTP behaviour when the grant store cannot be reached: the request fails
 * closed with a 500 envelope instead of an allow or a deny.
 */
@Tag("integration")
@QuarkusTest
class GrantStoreFailureIntegrationTest {

    @InjectMock
    RoleAssignmentRepository roleAssignmentRepository;

    @Test
    @DisplayName("A check that cannot read role assignments returns INTERNAL_ERROR")
    void check_shouldReturn500_whenGrantStoreUnavailable() {
        when(roleAssignmentRepository.fetchRoleKeys(anyString(), anyString()))
            .thenThrow(new GrantStoreUnavailableException("Failed to fetch roles",
                new RuntimeException("connection refused")));

        given()
            .contentType(ContentType.JSON)
            .header(RequestIdFilter.REQUEST_ID_HEADER, "req-store-down")
            .body("""
                {"userId": "%s", "workspaceId": "%s", "actionKey": "docs.document.read"}
                """.formatted(UUID.randomUUID(), UUID.randomUUID()))
        .when()
            .post("/authz/check")
        .then()
            .statusCode(500)
            .body("ok", equalTo(false))
            .body("error.code", equalTo(ApiEnvelope.INTERNAL_ERROR))
            .body("error.message", not(containsString("connection refused")))
            .body("meta.requestId", equalTo("req-store-down"));
    }

    @Test
    @DisplayName("A global action never touches the grant store")
    void check_shouldAllowGlobalAction_whenGrantStoreUnavailable() {
        given()
            .contentType(ContentType.JSON)
            .body("""
                {"userId": "%s", "actionKey": "accounts.workspaces.create"}
                """.formatted(UUID.randomUUID()))
        .when()
            .post("/authz/check")
        .then()
            .statusCode(200)
            .body("data.allowed", equalTo(true));

        verifyNoInteractions(roleAssignmentRepository);
    }

    @Test
    @DisplayName("An assignment that cannot be written returns INTERNAL_ERROR")
    void execute_shouldReturn500_whenAssignmentCannotBeWritten() {
        when(roleAssignmentRepository.assignRole(anyString(), anyString(), anyString()))
            .thenThrow(new GrantStoreUnavailableException("Failed to assign role workspace_owner",
                new RuntimeException("commit failed")));

        given()
            .contentType(ContentType.JSON)
            .body("""
                {"actionKey": "authz.assignRole",
                 "payload": {"userId": "%s", "workspaceId": "%s", "roleKey": "workspace_owner"}}
                """.formatted(UUID.randomUUID(), UUID.randomUUID()))
        .when()
            .post("/internal/authz-actions")
        .then()
            .statusCode(500)
            .body("ok", equalTo(false))
            .body("error.code", equalTo(ApiEnvelope.INTERNAL_ERROR))
            .body("meta.requestId", startsWith("req-"));
    }
}
