package tech.flowcatalyst.authz.store.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

import java.io.Serializable;
import java.util.Objects;

/**
 * JPA entity for authz.user_roles table.
 * A principal may hold several roles in the same workspace.
 */
@Entity
@Table(name = "user_roles", schema = "authz")
@IdClass(RoleAssignmentEntity.Key.class)
public class RoleAssignmentEntity {

    @Id
    @Column(name = "user_id", length = 64)
    public String userId;

    @Id
    @Column(name = "workspace_id", length = 64)
    public String workspaceId;

    @Id
    @Column(name = "role_key", length = 100)
    public String roleKey;

    public RoleAssignmentEntity() {
    }

    public static class Key implements Serializable {

        public String userId;
        public String workspaceId;
        public String roleKey;

        public Key() {
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key other)) return false;
            return Objects.equals(userId, other.userId)
                && Objects.equals(workspaceId, other.workspaceId)
                && Objects.equals(roleKey, other.roleKey);
        }

        @Override
        public int hashCode() {
            return Objects.hash(userId, workspaceId, roleKey);
        }
    }
}
