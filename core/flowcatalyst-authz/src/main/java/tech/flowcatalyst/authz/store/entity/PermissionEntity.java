package tech.flowcatalyst.authz.store.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for authz.permissions table.
 */
@Entity
@Table(name = "permissions", schema = "authz")
public class PermissionEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "key", nullable = false, unique = true, length = 128)
    public String permissionKey;

    @Column(name = "description", columnDefinition = "TEXT")
    public String description;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public PermissionEntity() {
    }
}
