package tech.flowcatalyst.authz.store.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for authz.roles table.
 */
@Entity
@Table(name = "roles", schema = "authz")
public class RoleEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "key", nullable = false, unique = true, length = 100)
    public String roleKey;

    @Column(name = "description", columnDefinition = "TEXT")
    public String description;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public RoleEntity() {
    }
}
