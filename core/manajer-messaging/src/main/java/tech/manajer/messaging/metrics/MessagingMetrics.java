package tech.manajer.messaging.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import tech.manajer.messaging.connection.ConnectionRegistry;

/**
 * Metrics for real-time messaging.
 * Tracks inbound frames, operation outcomes, broadcast fan-out and open connections.
 */
@Singleton
public class MessagingMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_REJECTED = "rejected";
    public static final String OUTCOME_NOT_FOUND = "not_found";
    public static final String OUTCOME_TIMEOUT = "timeout";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry meterRegistry;
    private final Counter framesReceived;
    private final Counter broadcastDeliveries;
    private final Counter broadcastFailures;

    @Inject
    public MessagingMetrics(MeterRegistry meterRegistry, ConnectionRegistry connectionRegistry) {
        this.meterRegistry = meterRegistry;

        framesReceived = Counter.builder("messaging.frames.received")
                .description("Total inbound text frames")
                .register(meterRegistry);

        broadcastDeliveries = Counter.builder("messaging.broadcast.deliveries")
                .description("Frames written to peers by broadcasts")
                .register(meterRegistry);

        broadcastFailures = Counter.builder("messaging.broadcast.failures")
                .description("Broadcast writes that failed and pruned the peer")
                .register(meterRegistry);

        Gauge.builder("messaging.connections.open", connectionRegistry, ConnectionRegistry::totalConnections)
                .description("Currently registered connections")
                .register(meterRegistry);
    }

    /**
     * Record an inbound text frame
     */
    public void recordFrameReceived() {
        framesReceived.increment();
    }

    /**
     * Record the outcome of one operation, tagged by its wire type
     */
    public void recordOperation(String type, String outcome) {
        Counter.builder("messaging.operations")
                .description("Processed operations by type and outcome")
                .tag("type", type)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordBroadcast(int delivered, int failed) {
        broadcastDeliveries.increment(delivered);
        broadcastFailures.increment(failed);
    }
}
