package tech.flowcatalyst.authz.store.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;

import java.io.Serializable;
import java.util.Objects;

/**
 * JPA entity for authz.role_permissions table.
 * A role either grants a permission or it does not, so the pair is the key.
 */
@Entity
@Table(name = "role_permissions", schema = "authz")
@IdClass(RoleGrantEntity.Key.class)
public class RoleGrantEntity {

    @Id
    @Column(name = "role_id", length = 17)
    public String roleId;

    @Id
    @Column(name = "permission_id", length = 17)
    public String permissionId;

    public RoleGrantEntity() {
    }

    public static class Key implements Serializable {

        public String roleId;
        public String permissionId;

        public Key() {
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key other)) return false;
            return Objects.equals(roleId, other.roleId) && Objects.equals(permissionId, other.permissionId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(roleId, permissionId);
        }
    }
}
