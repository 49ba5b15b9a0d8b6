package tech.manajer.messaging.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.manajer.messaging.broadcast.BroadcastEngine;
import tech.manajer.messaging.config.MessagingConfig;
import tech.manajer.messaging.connection.ConnectionRegistry;
import tech.manajer.messaging.connection.ConnectionState;
import tech.manajer.messaging.handler.AddReactionHandler;
import tech.manajer.messaging.handler.CreateMessageHandler;
import tech.manajer.messaging.handler.DeleteMessageHandler;
import tech.manajer.messaging.handler.MessageHistoryHandler;
import tech.manajer.messaging.handler.OperationHandlerFactory;
import tech.manajer.messaging.handler.OperationSupport;
import tech.manajer.messaging.handler.RemoveReactionHandler;
import tech.manajer.messaging.handler.UpdateMessageHandler;
import tech.manajer.messaging.metrics.MessagingMetrics;
import tech.manajer.messaging.model.Message;
import tech.manajer.messaging.protocol.EnvelopeCodec;
import tech.manajer.messaging.repository.MessageRepository;
import tech.manajer.messaging.repository.PersistenceExecutor;
import tech.manajer.messaging.support.InMemoryMessageRepository;
import tech.manajer.messaging.support.RecordingConnection;
import tech.manajer.platform.activitylog.ActivityLogService;
import tech.manajer.platform.authentication.AuthenticatedUser;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Drives the dispatcher with real handlers, registry and broadcast engine over
 * an in-memory message store.
 */
@ExtendWith(MockitoExtension.class)
class MessageOperationDispatcherTest {

    private static final ObjectId CHANNEL_ID = new ObjectId();
    private static final String CHANNEL = CHANNEL_ID.toHexString();
    private static final String THUMBS_UP = "👍";

    @Mock
    private MessagingConfig config;

    @Mock
    private ActivityLogService activityLogService;

    private InMemoryMessageRepository repository;
    private ConnectionRegistry registry;
    private SimpleMeterRegistry meterRegistry;
    private MessageOperationDispatcher dispatcher;

    private final ObjectId userA = new ObjectId();
    private final ObjectId userB = new ObjectId();

    @BeforeEach
    void setUp() {
        lenient().when(config.operationTimeout()).thenReturn(Duration.ofSeconds(5));
        lenient().when(config.historyDefaultLimit()).thenReturn(50);
        lenient().when(config.persistenceThreads()).thenReturn(4);
        lenient().when(config.persistenceQueueCapacity()).thenReturn(16);

        repository = new InMemoryMessageRepository();
        registry = new ConnectionRegistry();
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = newDispatcher(repository, new PersistenceExecutor(config));
    }

    // ========================================
    // Lifecycle TESTS
    // ========================================

    @Test
    @DisplayName("admit should register the connection and greet it with channel_joined")
    void admit_shouldRegisterAndGreet() {
        RecordingConnection connection = new RecordingConnection(CHANNEL);

        boolean admitted = dispatcher.admit(connection);

        assertThat(admitted).isTrue();
        assertThat(connection.state()).isEqualTo(ConnectionState.ACTIVE);
        assertThat(registry.isRegistered(CHANNEL, connection)).isTrue();
        assertThat(connection.frames()).containsExactly(
            "{\"type\":\"channel_joined\",\"payload\":{\"channelId\":\"" + CHANNEL + "\"}}");
    }

    @Test
    @DisplayName("admit should refuse a connection that is no longer CONNECTING")
    void admit_shouldRefuseClosedConnection() {
        RecordingConnection connection = new RecordingConnection(CHANNEL);
        connection.close();

        assertThat(dispatcher.admit(connection)).isFalse();
        assertThat(registry.hasChannel(CHANNEL)).isFalse();
    }

    @Test
    @DisplayName("release should unregister and close once, however often it is called")
    void release_shouldBeIdempotent() {
        RecordingConnection connection = connect();

        dispatcher.release(connection);
        dispatcher.release(connection);

        assertThat(connection.state()).isEqualTo(ConnectionState.CLOSED);
        assertThat(connection.closeCount()).isEqualTo(1);
        assertThat(registry.hasChannel(CHANNEL)).isFalse();
    }

    @Test
    @DisplayName("frames arriving after release should be ignored")
    void onTextFrame_shouldIgnoreFramesAfterRelease() {
        RecordingConnection connection = connect();
        dispatcher.release(connection);

        dispatcher.onTextFrame(connection, create(userA, "late"));

        assertThat(repository.size()).isZero();
    }

    @Test
    @DisplayName("releaseAll should release every connection of every channel")
    void releaseAll_shouldCloseEverything() {
        RecordingConnection first = connect();
        RecordingConnection second = new RecordingConnection(new ObjectId().toHexString());
        dispatcher.admit(second);

        dispatcher.releaseAll();

        assertThat(registry.totalConnections()).isZero();
        assertThat(first.state()).isEqualTo(ConnectionState.CLOSED);
        assertThat(second.state()).isEqualTo(ConnectionState.CLOSED);
    }

    @Test
    @DisplayName("binary frames should be skipped without a reply")
    void onBinaryFrame_shouldBeSkipped() {
        RecordingConnection connection = connect();

        dispatcher.onBinaryFrame(connection);

        assertThat(connection.frames()).isEmpty();
        assertThat(connection.state()).isEqualTo(ConnectionState.ACTIVE);
    }

    // ========================================
    // Envelope TESTS
    // ========================================

    @Test
    @DisplayName("an unknown type should produce one error and leave the connection usable")
    void onTextFrame_shouldReportUnknownType_andKeepProcessing() {
        RecordingConnection connection = connect();

        dispatcher.onTextFrame(connection, "{\"type\":\"typing\",\"payload\":{}}");

        assertThat(connection.events()).singleElement().satisfies(event -> {
            assertThat(event.path("type").asText()).isEqualTo("error");
            assertThat(event.path("payload").asText()).isEqualTo("Unknown message type: typing");
        });
        assertThat(connection.state()).isEqualTo(ConnectionState.ACTIVE);

        dispatcher.onTextFrame(connection, create(userA, "still here"));

        assertThat(connection.eventTypes()).containsExactly("error", "message_created");
    }

    @Test
    @DisplayName("a malformed frame should produce an error event")
    void onTextFrame_shouldReportMalformedFrame() {
        RecordingConnection connection = connect();

        dispatcher.onTextFrame(connection, "{oops");

        assertThat(connection.lastEvent().path("payload").asText()).isEqualTo("Invalid message format");
        assertThat(meterRegistry.get("messaging.operations")
            .tag("type", "unknown").tag("outcome", "rejected").counter().count()).isEqualTo(1.0);
    }

    // ========================================
    // create_message TESTS
    // ========================================

    @Test
    @DisplayName("create should persist an unpinned message without reactions, echo it and broadcast it")
    void create_shouldPersistReplyAndBroadcast() {
        // Arrange
        RecordingConnection sender = connect();
        RecordingConnection peer = connect();
        RecordingConnection otherPeer = connect();

        // Act
        dispatcher.onTextFrame(sender, create(userA, "hello"));

        // Assert
        List<Message> stored = repository.findByChannel(CHANNEL_ID, 10, 0);
        assertThat(stored).singleElement().satisfies(message -> {
            assertThat(message.content).isEqualTo("hello");
            assertThat(message.reactions).isEmpty();
            assertThat(message.isPinned).isFalse();
            assertThat(message.userId).isEqualTo(userA);
            assertThat(message.messageType).isEqualTo("text");
        });

        JsonNode reply = sender.lastEvent();
        assertThat(sender.eventTypes()).containsExactly("message_created");
        assertThat(reply.path("payload").path("content").asText()).isEqualTo("hello");
        assertThat(reply.path("payload").path("isPinned").asBoolean()).isFalse();
        assertThat(reply.path("payload").path("reactions").isArray()).isTrue();
        assertThat(reply.path("payload").path("reactions")).isEmpty();
        assertThat(reply.path("payload").path("channelId").asText()).isEqualTo(CHANNEL);

        for (RecordingConnection connection : List.of(peer, otherPeer)) {
            assertThat(connection.eventTypes()).containsExactly("new_message");
            assertThat(connection.lastEvent().path("payload").path("content").asText()).isEqualTo("hello");
        }
        assertThat(meterRegistry.get("messaging.operations")
            .tag("type", "client_message").tag("outcome", "success").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("create should reject a malformed user id without broadcasting")
    void create_shouldRejectInvalidUserId() {
        RecordingConnection sender = connect();
        RecordingConnection peer = connect();

        dispatcher.onTextFrame(sender, "{\"type\":\"client_message\",\"payload\":{\"userId\":\"bob\",\"content\":\"x\"}}");

        assertThat(sender.lastEvent().path("payload").asText()).isEqualTo("Invalid user ID");
        assertThat(peer.frames()).isEmpty();
        assertThat(repository.size()).isZero();
    }

    @Test
    @DisplayName("create should reject a channel whose id is not a valid id")
    void create_shouldRejectInvalidChannelId() {
        RecordingConnection sender = new RecordingConnection("general");
        dispatcher.admit(sender);
        sender.clear();

        dispatcher.onTextFrame(sender, create(userA, "x"));

        assertThat(sender.lastEvent().path("payload").asText()).isEqualTo("Invalid channel ID");
    }

    @Test
    @DisplayName("create should reject an unknown message type")
    void create_shouldRejectUnknownMessageType() {
        RecordingConnection sender = connect();

        dispatcher.onTextFrame(sender, """
            {"type":"client_message","payload":{"userId":"%s","content":"x","messageType":"gif"}}
            """.formatted(userA.toHexString()));

        assertThat(sender.lastEvent().path("payload").asText()).isEqualTo("Invalid message type: gif");
    }

    @Test
    @DisplayName("create should survive a failed reply to the sender and still broadcast")
    void create_shouldSwallowReplyFailure() {
        RecordingConnection sender = connect().failingWrites();
        RecordingConnection peer = connect();

        assertThatCode(() -> dispatcher.onTextFrame(sender, create(userA, "hello")))
            .doesNotThrowAnyException();

        assertThat(peer.eventTypes()).containsExactly("new_message");
    }

    // ========================================
    // Identity TESTS
    // ========================================

    @Test
    @DisplayName("an authenticated connection should act as its own user when the payload omits userId")
    void create_shouldUseAuthenticatedUser() {
        RecordingConnection sender = connectAs(userB);

        dispatcher.onTextFrame(sender, "{\"type\":\"client_message\",\"payload\":{\"content\":\"hi\"}}");

        assertThat(sender.lastEvent().path("payload").path("userId").asText()).isEqualTo(userB.toHexString());
    }

    @Test
    @DisplayName("an authenticated connection should not act for another user")
    void addReaction_shouldRejectImpersonation() {
        ObjectId messageId = seedMessage();
        RecordingConnection sender = connectAs(userB);

        dispatcher.onTextFrame(sender, reaction("add_reaction", messageId, userA, THUMBS_UP));

        assertThat(sender.lastEvent().path("payload").asText())
            .isEqualTo("User ID does not match the authenticated user");
        assertThat(repository.findByIdOptional(messageId).orElseThrow().reactions).isEmpty();
    }

    // ========================================
    // Reaction TESTS
    // ========================================

    @Test
    @DisplayName("two users reacting with the same emoji should share one bucket")
    void addReaction_shouldMergeIntoOneBucket() {
        // Arrange
        ObjectId messageId = seedMessage();
        RecordingConnection sender = connect();
        RecordingConnection peer = connect();

        // Act
        dispatcher.onTextFrame(sender, reaction("add_reaction", messageId, userA, THUMBS_UP));
        dispatcher.onTextFrame(sender, reaction("add_reaction", messageId, userB, THUMBS_UP));

        // Assert
        Message stored = repository.findByIdOptional(messageId).orElseThrow();
        assertThat(stored.reactions).singleElement().satisfies(bucket -> {
            assertThat(bucket.emoji).isEqualTo(THUMBS_UP);
            assertThat(bucket.userIds).containsExactly(userA, userB);
        });

        JsonNode reactions = sender.lastEvent().path("payload").path("reactions");
        assertThat(reactions).hasSize(1);
        assertThat(reactions.get(0).path("userIds").get(1).asText()).isEqualTo(userB.toHexString());
        assertThat(peer.eventTypes()).containsExactly("reaction_added", "reaction_added");
    }

    @Test
    @DisplayName("removing the last reaction should prune the bucket entirely")
    void removeReaction_shouldPruneBucket() {
        ObjectId messageId = seedMessage();
        RecordingConnection sender = connect();
        RecordingConnection peer = connect();

        dispatcher.onTextFrame(sender, reaction("add_reaction", messageId, userA, THUMBS_UP));
        dispatcher.onTextFrame(sender, reaction("remove_reaction", messageId, userA, THUMBS_UP));

        assertThat(repository.findByIdOptional(messageId).orElseThrow().reactions).isEmpty();
        assertThat(sender.lastEvent().path("type").asText()).isEqualTo("reaction_removed");
        assertThat(sender.lastEvent().path("payload").path("reactions")).isEmpty();
        assertThat(peer.eventTypes()).containsExactly("reaction_added", "reaction_removed");
    }

    @Test
    @DisplayName("reacting to a missing message should report not found")
    void addReaction_shouldReportMissingMessage() {
        RecordingConnection sender = connect();

        dispatcher.onTextFrame(sender, reaction("add_reaction", new ObjectId(), userA, THUMBS_UP));

        assertThat(sender.lastEvent().path("payload").asText()).isEqualTo("Message not found");
    }

    @Test
    @DisplayName("reacting without an emoji should be rejected")
    void addReaction_shouldRequireEmoji() {
        ObjectId messageId = seedMessage();
        RecordingConnection sender = connect();

        dispatcher.onTextFrame(sender, reaction("add_reaction", messageId, userA, ""));

        assertThat(sender.lastEvent().path("payload").asText()).isEqualTo("Emoji is required");
    }

    // ========================================
    // update_message TESTS
    // ========================================

    @Test
    @DisplayName("updating a missing message should send one error and no broadcast")
    void update_shouldReportMissingMessage() {
        RecordingConnection sender = connect();
        RecordingConnection peer = connect();

        dispatcher.onTextFrame(sender, """
            {"type":"update_message","payload":{"id":"%s","content":"edited"}}
            """.formatted(new ObjectId().toHexString()));

        assertThat(sender.events()).singleElement().satisfies(event -> {
            assertThat(event.path("type").asText()).isEqualTo("error");
            assertThat(event.path("payload").asText()).isEqualTo("Message not found for update");
        });
        assertThat(peer.frames()).isEmpty();
    }

    @Test
    @DisplayName("an update without any field should be rejected")
    void update_shouldRejectEmptyChange() {
        RecordingConnection sender = connect();

        dispatcher.onTextFrame(sender, """
            {"type":"update_message","payload":{"id":"%s"}}
            """.formatted(seedMessage().toHexString()));

        assertThat(sender.lastEvent().path("payload").asText()).isEqualTo("No data to update");
    }

    @Test
    @DisplayName("update should apply present fields only, stamp updatedAt and broadcast")
    void update_shouldApplyPartialChange() {
        // Arrange
        ObjectId messageId = seedMessage();
        RecordingConnection sender = connect();
        RecordingConnection peer = connect();

        // Act
        dispatcher.onTextFrame(sender, """
            {"type":"update_message","payload":{"id":"%s","content":"edited"}}
            """.formatted(messageId.toHexString()));

        // Assert
        Message stored = repository.findByIdOptional(messageId).orElseThrow();
        assertThat(stored.content).isEqualTo("edited");
        assertThat(stored.messageType).isEqualTo("text");
        assertThat(stored.updatedAt).isNotNull();

        assertThat(sender.lastEvent().path("type").asText()).isEqualTo("message_updated");
        assertThat(sender.lastEvent().path("payload").path("updatedAt").isTextual()).isTrue();
        assertThat(peer.eventTypes()).containsExactly("message_updated");
        verifyNoInteractions(activityLogService);
    }

    @Test
    @DisplayName("pinning and unpinning should be recorded in the activity log")
    void update_shouldLogPinChanges() {
        ObjectId messageId = seedMessage();
        RecordingConnection sender = connectAs(userA);

        dispatcher.onTextFrame(sender, "{\"type\":\"update_message\",\"payload\":{\"id\":\""
            + messageId.toHexString() + "\",\"isPinned\":true}}");
        assertThat(repository.findByIdOptional(messageId).orElseThrow().isPinned).isTrue();

        dispatcher.onTextFrame(sender, "{\"type\":\"update_message\",\"payload\":{\"id\":\""
            + messageId.toHexString() + "\",\"isPinned\":false}}");
        assertThat(repository.findByIdOptional(messageId).orElseThrow().isPinned).isFalse();

        verify(activityLogService).logActivity(userA, "message.pinned", "WS", sender.path(), 200, "127.0.0.1");
        verify(activityLogService).logActivity(userA, "message.unpinned", "WS", sender.path(), 200, "127.0.0.1");
    }

    // ========================================
    // delete_message TESTS
    // ========================================

    @Test
    @DisplayName("delete should remove the message, announce its id and log the action")
    void delete_shouldRemoveAndBroadcast() {
        ObjectId messageId = seedMessage();
        RecordingConnection sender = connect();
        RecordingConnection peer = connect();

        dispatcher.onTextFrame(sender, "{\"type\":\"delete_message\",\"payload\":{\"id\":\""
            + messageId.toHexString() + "\"}}");

        assertThat(repository.size()).isZero();
        String expected = "{\"type\":\"message_deleted\",\"payload\":{\"id\":\"" + messageId.toHexString() + "\"}}";
        assertThat(sender.frames()).containsExactly(expected);
        assertThat(peer.frames()).containsExactly(expected);
        verify(activityLogService).logActivity(null, "message.deleted", "WS", sender.path(), 200, "127.0.0.1");
    }

    @Test
    @DisplayName("deleting a missing message should report not found without logging")
    void delete_shouldReportMissingMessage() {
        RecordingConnection sender = connect();

        dispatcher.onTextFrame(sender, "{\"type\":\"delete_message\",\"payload\":{\"id\":\""
            + new ObjectId().toHexString() + "\"}}");

        assertThat(sender.lastEvent().path("payload").asText()).isEqualTo("Message not found");
        verify(activityLogService, never()).logActivity(any(), anyString(), anyString(), any(), anyInt(), any());
    }

    // ========================================
    // get_message_history TESTS
    // ========================================

    @Test
    @DisplayName("history with limit 0 should return the default 50, newest first, to the sender only")
    void history_shouldDefaultLimitAndOrderNewestFirst() {
        // Arrange
        for (int i = 0; i < 55; i++) {
            seedMessage();
        }
        RecordingConnection sender = connect();
        RecordingConnection peer = connect();

        // Act
        dispatcher.onTextFrame(sender, "{\"type\":\"get_message_history\",\"payload\":{\"limit\":0}}");

        // Assert
        JsonNode payload = sender.lastEvent().path("payload");
        assertThat(sender.lastEvent().path("type").asText()).isEqualTo("message_history");
        assertThat(payload).hasSize(50);

        List<Instant> createdAt = new ArrayList<>();
        payload.forEach(message -> createdAt.add(Instant.parse(message.path("createdAt").asText())));
        for (int i = 1; i < createdAt.size(); i++) {
            assertThat(createdAt.get(i)).isBefore(createdAt.get(i - 1));
        }
        assertThat(peer.frames()).isEmpty();
    }

    @Test
    @DisplayName("history should honour limit and skip")
    void history_shouldPage() {
        List<ObjectId> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(seedMessage());
        }
        RecordingConnection sender = connect();

        dispatcher.onTextFrame(sender, "{\"type\":\"get_message_history\",\"payload\":{\"limit\":2,\"skip\":1}}");

        JsonNode payload = sender.lastEvent().path("payload");
        assertThat(payload).hasSize(2);
        assertThat(payload.get(0).path("id").asText()).isEqualTo(ids.get(3).toHexString());
        assertThat(payload.get(1).path("id").asText()).isEqualTo(ids.get(2).toHexString());
    }

    @Test
    @DisplayName("history should reject a negative limit")
    void history_shouldRejectNegativeLimit() {
        RecordingConnection sender = connect();

        dispatcher.onTextFrame(sender, "{\"type\":\"get_message_history\",\"payload\":{\"limit\":-1}}");

        assertThat(sender.lastEvent().path("type").asText()).isEqualTo("error");
        assertThat(sender.lastEvent().path("payload").asText()).isEqualTo("limit and skip must not be negative");
    }

    // ========================================
    // Backend failure TESTS
    // ========================================

    @Test
    @DisplayName("a slow store should time out the operation but let the write finish")
    void create_shouldTimeOut_whenStoreIsSlow() {
        // Arrange
        when(config.operationTimeout()).thenReturn(Duration.ofMillis(50));
        dispatcher = newDispatcher(repository, new PersistenceExecutor(config));
        repository.setLatency(Duration.ofMillis(300));
        RecordingConnection sender = connect();

        // Act
        dispatcher.onTextFrame(sender, create(userA, "slow"));

        // Assert
        assertThat(sender.lastEvent().path("payload").asText()).isEqualTo("Create message timed out");
        assertThat(sender.state()).isEqualTo(ConnectionState.ACTIVE);
        await().atMost(Duration.ofSeconds(5)).until(() -> repository.size() == 1);
    }

    @Test
    @DisplayName("an unexpected store failure should be reported generically")
    void delete_shouldReportGenericFailure() {
        MessageRepository failing = new InMemoryMessageRepository() {
            @Override
            public boolean deleteById(ObjectId id) {
                throw new IllegalStateException("socket reset");
            }
        };
        dispatcher = newDispatcher(failing, new PersistenceExecutor(config));
        RecordingConnection sender = connect();

        dispatcher.onTextFrame(sender, "{\"type\":\"delete_message\",\"payload\":{\"id\":\""
            + new ObjectId().toHexString() + "\"}}");

        assertThat(sender.lastEvent().path("payload").asText()).isEqualTo("Failed to delete message");
        assertThat(sender.state()).isEqualTo(ConnectionState.ACTIVE);
    }

    // ========================================
    // Helpers
    // ========================================

    private MessageOperationDispatcher newDispatcher(MessageRepository repo, PersistenceExecutor persistence) {
        EnvelopeCodec codec = new EnvelopeCodec(new ObjectMapper());
        MessagingMetrics metrics = new MessagingMetrics(meterRegistry, registry);
        BroadcastEngine broadcastEngine = new BroadcastEngine(registry, codec, metrics);
        OperationSupport support = new OperationSupport(persistence, broadcastEngine, codec);
        OperationHandlerFactory handlers = new OperationHandlerFactory(
            new CreateMessageHandler(repo, support),
            new MessageHistoryHandler(repo, support, config),
            new UpdateMessageHandler(repo, support, activityLogService),
            new DeleteMessageHandler(repo, support, activityLogService),
            new AddReactionHandler(repo, support),
            new RemoveReactionHandler(repo, support));
        return new MessageOperationDispatcher(registry, codec, handlers, support, metrics);
    }

    private RecordingConnection connect() {
        RecordingConnection connection = new RecordingConnection(CHANNEL);
        dispatcher.admit(connection);
        connection.clear();
        return connection;
    }

    private RecordingConnection connectAs(ObjectId userId) {
        AuthenticatedUser user = new AuthenticatedUser(userId.toHexString(), "user@example.com", Map.of());
        RecordingConnection connection = new RecordingConnection(CHANNEL, user);
        dispatcher.admit(connection);
        connection.clear();
        return connection;
    }

    private ObjectId seedMessage() {
        Message message = new Message();
        message.channelId = CHANNEL_ID;
        message.userId = userA;
        message.content = "seed";
        message.messageType = "text";
        return repository.create(message).id;
    }

    private static String create(ObjectId userId, String content) {
        return """
            {"type":"client_message","payload":{"userId":"%s","content":"%s"}}
            """.formatted(userId.toHexString(), content);
    }

    private static String reaction(String type, ObjectId messageId, ObjectId userId, String emoji) {
        return """
            {"type":"%s","payload":{"messageId":"%s","userId":"%s","emoji":"%s"}}
            """.formatted(type, messageId.toHexString(), userId.toHexString(), emoji);
    }
}
