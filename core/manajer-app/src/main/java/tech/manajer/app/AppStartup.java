package tech.manajer.app;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.manajer.messaging.config.MessagingConfig;
import tech.manajer.messaging.dispatch.MessageOperationDispatcher;
import tech.manajer.platform.config.AuthConfig;

/**
 * Manajer App startup handler.
 *
 * This is the all-in-one deployment that includes:
 * - manajer-platform (token verification, activity log)
 * - manajer-messaging (real-time channel messaging)
 *
 * Open WebSocket connections are released on shutdown so peers see a clean close.
 */
@ApplicationScoped
public class AppStartup {

    private static final Logger LOG = Logger.getLogger(AppStartup.class);

    @Inject
    MessageOperationDispatcher dispatcher;

    @Inject
    AuthConfig authConfig;

    @Inject
    MessagingConfig messagingConfig;

    void onStart(@Observes StartupEvent event) {
        LOG.info("Manajer App starting...");

        if (AuthConfig.DEFAULT_SECRET.equals(authConfig.secret())) {
            LOG.warn("manajer.auth.secret is not set; using the development secret. Set JWT_SECRET_KEY in production.");
        }
        if (!messagingConfig.requireAuthentication()) {
            LOG.warn("messaging.require-authentication is false; anonymous WebSocket connections are accepted");
        }

        LOG.info("Manajer App started successfully");
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("Manajer App shutting down...");

        dispatcher.releaseAll();

        LOG.info("Manajer App shutdown complete");
    }
}
