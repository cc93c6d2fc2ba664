package me.golemcore.biblebot.adapter.inbound.matrix;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.biblebot.adapter.outbound.matrix.MatrixApiException;
import me.golemcore.biblebot.adapter.outbound.matrix.MatrixRestClient;
import me.golemcore.biblebot.domain.model.Credentials;
import me.golemcore.biblebot.domain.model.DecryptionFailureEvent;
import me.golemcore.biblebot.domain.model.OutgoingMessage;
import me.golemcore.biblebot.domain.model.RoomMessageEvent;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.port.inbound.DuplicateKeyRequestException;
import me.golemcore.biblebot.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class MatrixClientAdapterTest {

    private static final String HOMESERVER = "https://matrix.test";
    private static final String ROOM = "!bible:matrix.test";
    private static final Credentials CREDENTIALS = new Credentials(HOMESERVER, "@biblebot:matrix.test",
            "syt_token", "BOTDEVICE");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();

    private OkHttpMockEngine httpEngine;
    private BotProperties properties;
    private ApplicationEventPublisher eventPublisher;
    private MatrixClientAdapter adapter;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        properties = new BotProperties();
        properties.getMatrix().getRateLimit().setJitter(0);
        properties.getMatrix().setSyncTimeout(1000);
        eventPublisher = mock(ApplicationEventPublisher.class);
        adapter = new MatrixClientAdapter(properties, new MatrixRestClient(client, objectMapper),
                new MatrixSyncParser(), eventPublisher) {
            @Override
            void sleep(long millis) {
                sleeps.add(millis);
            }
        };
    }

    @AfterEach
    void tearDown() {
        adapter.stop();
    }

    private void connect() {
        httpEngine.enqueueJson(200, "{\"user_id\":\"@biblebot:matrix.test\",\"device_id\":\"SERVERDEVICE\"}");
        adapter.connect(CREDENTIALS);
        httpEngine.takeRequest();
    }

    @Test
    void shouldVerifyTokenOnConnect() {
        httpEngine.enqueueJson(200, "{\"user_id\":\"@biblebot:matrix.test\",\"device_id\":\"SERVERDEVICE\"}");

        adapter.connect(CREDENTIALS);

        assertEquals("@biblebot:matrix.test", adapter.getUserId());
        assertEquals("BOTDEVICE", adapter.getDeviceId());
        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("/_matrix/client/v3/account/whoami", request.target());
        assertEquals("Bearer syt_token", request.header("Authorization"));
        assertFalse(adapter.isRunning());
    }

    @Test
    void shouldTakeDeviceFromServerWhenNotSaved() {
        httpEngine.enqueueJson(200, "{\"user_id\":\"@biblebot:matrix.test\",\"device_id\":\"SERVERDEVICE\"}");

        adapter.connect(new Credentials(HOMESERVER, "@biblebot:matrix.test", "syt_token", null));

        assertEquals("SERVERDEVICE", adapter.getDeviceId());
    }

    @Test
    void shouldFailConnectWithRejectedToken() {
        httpEngine.enqueueMatrixError(401, "M_UNKNOWN_TOKEN", null);

        MatrixApiException error = assertThrows(MatrixApiException.class, () -> adapter.connect(CREDENTIALS));
        assertTrue(error.isUnauthorized());
        assertThrows(IllegalStateException.class, () -> adapter.startSync());
    }

    @Test
    void shouldSendHtmlMessage() throws Exception {
        connect();
        httpEngine.enqueueJson(200, "{\"event_id\":\"$sent\"}");

        adapter.sendMessage(ROOM, new OutgoingMessage("a < b", "a &lt; b")).join();

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("PUT", request.method());
        assertTrue(request.target().startsWith("/_matrix/client/v3/rooms/!bible:matrix.test/send/m.room.message/"));
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("m.text", body.path("msgtype").asText());
        assertEquals("a < b", body.path("body").asText());
        assertEquals("org.matrix.custom.html", body.path("format").asText());
        assertEquals("a &lt; b", body.path("formatted_body").asText());
    }

    @Test
    void shouldSendPlainMessageWithoutFormat() throws Exception {
        connect();
        httpEngine.enqueueJson(200, "{\"event_id\":\"$sent\"}");

        adapter.sendMessage(ROOM, OutgoingMessage.plain("hello")).join();

        JsonNode body = objectMapper.readTree(httpEngine.takeRequest().body());
        assertTrue(body.path("format").isMissingNode());
    }

    @Test
    void shouldUseFreshTransactionIds() {
        connect();
        httpEngine.enqueueJson(200, "{}");
        httpEngine.enqueueJson(200, "{}");

        adapter.sendMessage(ROOM, OutgoingMessage.plain("one")).join();
        adapter.sendMessage(ROOM, OutgoingMessage.plain("two")).join();

        List<OkHttpMockEngine.CapturedRequest> requests = httpEngine.takeAll();
        assertNotEquals(requests.get(0).target(), requests.get(1).target());
    }

    @Test
    void shouldSendAnnotationReaction() throws Exception {
        connect();
        httpEngine.enqueueJson(200, "{\"event_id\":\"$reaction\"}");

        adapter.sendReaction(ROOM, "$msg", "✅").join();

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertTrue(request.target().contains("/send/m.reaction/"));
        JsonNode relation = objectMapper.readTree(request.body()).path("m.relates_to");
        assertEquals("m.annotation", relation.path("rel_type").asText());
        assertEquals("$msg", relation.path("event_id").asText());
        assertEquals("✅", relation.path("key").asText());
    }

    @Test
    void shouldRetryRateLimitedRequestAfterServerDelay() {
        connect();
        httpEngine.enqueueMatrixError(429, "M_LIMIT_EXCEEDED", 1500L);
        httpEngine.enqueueJson(200, "{}");

        adapter.sendMessage(ROOM, OutgoingMessage.plain("hi")).join();

        assertEquals(List.of(1500L), sleeps);
        assertEquals(3, httpEngine.getRequestCount());
    }

    @Test
    void shouldBackOffExponentiallyWithoutServerDelay() {
        properties.getMatrix().getRateLimit().setDefaultRetryAfter(100);
        connect();
        httpEngine.enqueueMatrixError(429, "M_LIMIT_EXCEEDED", null);
        httpEngine.enqueueMatrixError(429, "M_LIMIT_EXCEEDED", null);
        httpEngine.enqueueJson(200, "{}");

        adapter.sendReaction(ROOM, "$msg", "✅").join();

        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        properties.getMatrix().getRateLimit().setMaxRetries(1);
        connect();
        httpEngine.enqueueMatrixError(429, "M_LIMIT_EXCEEDED", 10L);
        httpEngine.enqueueMatrixError(429, "M_LIMIT_EXCEEDED", 10L);

        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.sendMessage(ROOM, OutgoingMessage.plain("hi")).join());

        MatrixApiException cause = assertInstanceOf(MatrixApiException.class, error.getCause());
        assertTrue(cause.isRateLimited());
        assertEquals(1, sleeps.size());
    }

    @Test
    void shouldNotRetryOtherErrors() {
        connect();
        httpEngine.enqueueMatrixError(403, "M_FORBIDDEN", null);

        assertThrows(CompletionException.class,
                () -> adapter.sendMessage(ROOM, OutgoingMessage.plain("hi")).join());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldResolveAlias() {
        connect();
        httpEngine.enqueueJson(200, "{\"room_id\":\"!study:matrix.test\",\"servers\":[\"matrix.test\"]}");

        assertEquals(Optional.of("!study:matrix.test"), adapter.resolveAlias("#study:matrix.test").join());
        assertEquals("/_matrix/client/v3/directory/room/%23study:matrix.test", httpEngine.takeRequest().target());
    }

    @Test
    void shouldReturnEmptyForUnknownAlias() {
        connect();
        httpEngine.enqueueMatrixError(404, "M_NOT_FOUND", null);

        assertTrue(adapter.resolveAlias("#gone:matrix.test").join().isEmpty());
    }

    @Test
    void shouldListJoinedRooms() {
        connect();
        httpEngine.enqueueJson(200, "{\"joined_rooms\":[\"!a:matrix.test\",\"!b:matrix.test\"]}");

        assertEquals(Set.of("!a:matrix.test", "!b:matrix.test"), adapter.getJoinedRooms().join());
    }

    @Test
    void shouldJoinRoom() {
        connect();
        httpEngine.enqueueJson(200, "{\"room_id\":\"!bible:matrix.test\"}");

        adapter.joinRoom(ROOM).join();

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/_matrix/client/v3/join/!bible:matrix.test", request.target());
    }

    @Test
    void shouldSendRoomKeyRequestToDevices() throws Exception {
        connect();
        httpEngine.enqueueJson(200, "{}");
        DecryptionFailureEvent event = new DecryptionFailureEvent(ROOM, "$enc", "@alice:matrix.test", "curve",
                "sess-1", "m.megolm.v1.aes-sha2");

        adapter.requestRoomKey(event).join();

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertTrue(request.target().startsWith("/_matrix/client/v3/sendToDevice/m.room_key_request/"));
        JsonNode content = objectMapper.readTree(request.body())
                .path("messages").path("@biblebot:matrix.test").path("*");
        assertEquals("request", content.path("action").asText());
        assertEquals("BOTDEVICE", content.path("requesting_device_id").asText());
        assertEquals("sess-1", content.path("request_id").asText());
        assertEquals("sess-1", content.path("body").path("session_id").asText());
        assertEquals(ROOM, content.path("body").path("room_id").asText());
        assertEquals("curve", content.path("body").path("sender_key").asText());
    }

    @Test
    void shouldRejectDuplicateKeyRequestWhileFirstIsInFlight() {
        connect();
        CountDownLatch gate = new CountDownLatch(1);
        httpEngine.enqueueJsonAfter(gate, 200, "{}");

        CompletableFuture<Void> first = adapter.requestRoomKey(encrypted("$enc1", "sess-1"));
        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.requestRoomKey(encrypted("$enc2", "sess-1")).join());
        gate.countDown();
        first.join();

        assertInstanceOf(DuplicateKeyRequestException.class, error.getCause());
        assertEquals(2, httpEngine.getRequestCount());
    }

    @Test
    void shouldAllowNewKeyRequestAfterPreviousCompleted() {
        connect();
        httpEngine.enqueueJson(200, "{}");
        httpEngine.enqueueJson(200, "{}");

        adapter.requestRoomKey(encrypted("$enc1", "sess-1")).join();
        adapter.requestRoomKey(encrypted("$enc2", "sess-1")).join();

        assertEquals(3, httpEngine.getRequestCount());
        assertEquals(0, adapter.pendingKeyRequestCount());
    }

    @Test
    void shouldForgetKeyRequestsOnceCompleted() {
        connect();
        for (int i = 0; i < 50; i++) {
            httpEngine.enqueueJson(200, "{}");
        }
        httpEngine.enqueueMatrixError(403, "M_FORBIDDEN", null);

        for (int i = 0; i < 50; i++) {
            adapter.requestRoomKey(encrypted("$enc" + i, "sess-" + i)).join();
        }
        assertThrows(CompletionException.class,
                () -> adapter.requestRoomKey(encrypted("$failed", "sess-failed")).join());

        assertEquals(0, adapter.pendingKeyRequestCount());
    }

    @Test
    void shouldPublishSyncedEventsUntilTokenIsRejected() throws Exception {
        connect();
        httpEngine.enqueueJson(200, """
                {"next_batch":"s1","rooms":{"join":{"!bible:matrix.test":{"timeline":{"events":[
                  {"type":"m.room.message","event_id":"$1","sender":"@alice:matrix.test",
                   "origin_server_ts":1700000000001,"content":{"msgtype":"m.text","body":"John 3:16"}}
                ]}}}}}
                """);
        httpEngine.enqueueMatrixError(401, "M_UNKNOWN_TOKEN", null);

        adapter.startSync();
        for (int i = 0; i < 100 && adapter.isRunning(); i++) {
            Thread.sleep(50);
        }

        assertFalse(adapter.isRunning());
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
        RoomMessageEvent event = assertInstanceOf(RoomMessageEvent.class, captor.getValue());
        assertEquals("John 3:16", event.body());

        List<OkHttpMockEngine.CapturedRequest> requests = httpEngine.takeAll();
        assertEquals("/_matrix/client/v3/sync?timeout=1000", requests.get(0).target());
        assertEquals("/_matrix/client/v3/sync?timeout=1000&since=s1", requests.get(1).target());
    }

    @Test
    void shouldKeepJitteredDelayWithinBounds() {
        BotProperties.RateLimitProperties rateLimit = new BotProperties.RateLimitProperties();
        rateLimit.setJitter(0.2);

        for (int i = 0; i < 50; i++) {
            long delay = MatrixClientAdapter.retryDelay(1000L, 0, rateLimit);
            assertTrue(delay >= 800 && delay <= 1200, "delay " + delay);
        }
    }

    private static DecryptionFailureEvent encrypted(String eventId, String sessionId) {
        return new DecryptionFailureEvent(ROOM, eventId, "@alice:matrix.test", "curve", sessionId,
                "m.megolm.v1.aes-sha2");
    }
}
