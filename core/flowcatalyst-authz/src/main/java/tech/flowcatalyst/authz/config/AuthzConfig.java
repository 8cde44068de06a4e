package tech.flowcatalyst.authz.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Set;

/**
 * Configuration for the authz service.
 *
 * Example configuration:
 * <pre>
 * authz.reconcile.on-startup=true
 * authz.assignment.assignable-roles=workspace_owner,workspace_member
 * authz.readiness.schema=authz
 * </pre>
 */
@ConfigMapping(prefix = "authz")
public interface AuthzConfig {

    Reconcile reconcile();

    Assignment assignment();

    Readiness readiness();

    interface Reconcile {

        /**
         * Reconcile the permission catalog into the grant store when the application starts.
         * Disable for read-only replicas or tests that manage the store themselves.
         */
        @WithName("on-startup")
        @WithDefault("true")
        boolean onStartup();
    }

    interface Assignment {

        /**
         * Role keys the internal assign-role action may hand out.
         */
        @WithName("assignable-roles")
        @WithDefault("workspace_owner,workspace_member")
        Set<String> assignableRoles();
    }

    interface Readiness {

        /**
         * Schema whose presence is probed by the readiness check.
         */
        @WithDefault("authz")
        String schema();
    }
}
