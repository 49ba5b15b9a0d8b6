package tech.manajer.messaging.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import tech.manajer.messaging.config.MessagingConfig;
import tech.manajer.messaging.connection.ConnectionRegistry;

/**
 * Readiness of the messaging endpoint, with the current connection load.
 */
@ApplicationScoped
@Readiness
public class MessagingHealthCheck implements HealthCheck {

    @Inject
    ConnectionRegistry registry;

    @Inject
    MessagingConfig config;

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.builder()
                .name("Messaging")
                .up()
                .withData("channels", registry.channelCount())
                .withData("connections", registry.totalConnections())
                .withData("authenticationRequired", config.requireAuthentication())
                .withData("operationTimeoutMs", config.operationTimeout().toMillis())
                .build();
    }
}
