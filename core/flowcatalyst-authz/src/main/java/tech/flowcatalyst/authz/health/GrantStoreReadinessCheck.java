package tech.flowcatalyst.authz.health;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;
import tech.flowcatalyst.authz.config.AuthzConfig;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Readiness check for the grant store.
 * Reports DOWN if the database is unreachable or the authz schema is missing,
 * so the instance is taken out of the load balancer until both are back.
 */
@ApplicationScoped
@Readiness
public class GrantStoreReadinessCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(GrantStoreReadinessCheck.class);

    static final String NAME = "GrantStore";

    @Inject
    AgroalDataSource dataSource;

    @Inject
    AuthzConfig config;

    @Override
    public HealthCheckResponse call() {
        String schema = config.readiness().schema();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(
                 "SELECT 1 FROM pg_namespace WHERE nspname = ?")) {
            statement.setString(1, schema);
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    return HealthCheckResponse.builder()
                        .name(NAME)
                        .down()
                        .withData("schema", schema)
                        .withData("error", "Schema not found")
                        .build();
                }
            }
        } catch (SQLException e) {
            LOG.warnf("Grant store readiness probe failed: %s", e.getMessage());
            return HealthCheckResponse.builder()
                .name(NAME)
                .down()
                .withData("schema", schema)
                .withData("error", String.valueOf(e.getMessage()))
                .build();
        }

        return HealthCheckResponse.builder()
            .name(NAME)
            .up()
            .withData("schema", schema)
            .build();
    }
}
