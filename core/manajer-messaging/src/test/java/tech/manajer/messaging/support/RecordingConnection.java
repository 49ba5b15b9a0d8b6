package tech.manajer.messaging.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import tech.manajer.messaging.connection.AbstractChannelConnection;
import tech.manajer.platform.authentication.AuthenticatedUser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory connection that records every frame written to it.
 */
public class RecordingConnection extends AbstractChannelConnection {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> frames = new CopyOnWriteArrayList<>();
    private final AtomicInteger closeCount = new AtomicInteger();
    private volatile boolean failWrites;
    private volatile CountDownLatch writeGate;
    private volatile boolean blocked;

    public RecordingConnection(String channelId) {
        this(channelId, null);
    }

    public RecordingConnection(String channelId, AuthenticatedUser user) {
        super(channelId, user);
    }

    /**
     * Make every following write fail like a broken pipe.
     */
    public RecordingConnection failingWrites() {
        this.failWrites = true;
        return this;
    }

    /**
     * Make every following write wait until {@code gate} opens, like a peer
     * that stopped reading.
     */
    public RecordingConnection blockWritesUntil(CountDownLatch gate) {
        this.writeGate = gate;
        return this;
    }

    /**
     * Whether a write is currently waiting on the gate.
     */
    public boolean isBlocked() {
        return blocked;
    }

    @Override
    public String path() {
        return "/api/v1/ws/messages/" + channelId();
    }

    @Override
    public String remoteAddress() {
        return "127.0.0.1";
    }

    @Override
    protected void doSend(String frame) throws IOException {
        CountDownLatch gate = writeGate;
        if (gate != null) {
            blocked = true;
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while writing", e);
            } finally {
                blocked = false;
            }
        }
        if (failWrites) {
            throw new IOException("Broken pipe");
        }
        frames.add(frame);
    }

    @Override
    protected void doClose() {
        closeCount.incrementAndGet();
    }

    public List<String> frames() {
        return List.copyOf(frames);
    }

    /**
     * Recorded frames parsed as JSON envelopes.
     */
    public List<JsonNode> events() {
        return frames.stream().map(RecordingConnection::parse).toList();
    }

    public JsonNode lastEvent() {
        List<JsonNode> events = events();
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public List<String> eventTypes() {
        return events().stream().map(event -> event.path("type").asText()).toList();
    }

    public void clear() {
        frames.clear();
    }

    public int closeCount() {
        return closeCount.get();
    }

    private static JsonNode parse(String frame) {
        try {
            return MAPPER.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
