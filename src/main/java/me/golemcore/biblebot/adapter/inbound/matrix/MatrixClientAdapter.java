package me.golemcore.biblebot.adapter.inbound.matrix;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.adapter.outbound.matrix.MatrixApiException;
import me.golemcore.biblebot.adapter.outbound.matrix.MatrixRestClient;
import me.golemcore.biblebot.domain.model.Credentials;
import me.golemcore.biblebot.domain.model.DecryptionFailureEvent;
import me.golemcore.biblebot.domain.model.MatrixEvent;
import me.golemcore.biblebot.domain.model.OutgoingMessage;
import me.golemcore.biblebot.domain.model.RoomKeyRequest;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.port.inbound.DuplicateKeyRequestException;
import me.golemcore.biblebot.port.inbound.MatrixChannelPort;
import okhttp3.HttpUrl;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Matrix channel over the client-server API (v3).
 *
 * <p>
 * A dedicated non-daemon thread long-polls {@code /sync} and publishes every parsed
 * {@link MatrixEvent} through Spring's {@link ApplicationEventPublisher}.
 * Outbound calls run on the common pool and retry on {@code 429} with
 * exponential back-off, jitter and the server's {@code retry_after_ms}.
 */
@Component
@Slf4j
public class MatrixClientAdapter implements MatrixChannelPort {

    private static final String CLIENT_SYNC_THREAD = "matrix-sync";
    private static final long SYNC_READ_TIMEOUT_MARGIN_MS = 30_000L;

    private final BotProperties.MatrixProperties config;
    private final MatrixRestClient restClient;
    private final MatrixSyncParser syncParser;
    private final ApplicationEventPublisher eventPublisher;

    private final Object lifecycleLock = new Object();
    private final Set<String> pendingKeyRequests = ConcurrentHashMap.newKeySet();
    private final AtomicLong transactionCounter = new AtomicLong();

    private volatile Credentials credentials;
    private volatile String userId;
    private volatile String deviceId;
    private volatile boolean running = false;
    private volatile String nextBatch;
    private ExecutorService syncExecutor;

    public MatrixClientAdapter(BotProperties properties, MatrixRestClient restClient, MatrixSyncParser syncParser,
            ApplicationEventPublisher eventPublisher) {
        this.config = properties.getMatrix();
        this.restClient = restClient;
        this.syncParser = syncParser;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void connect(Credentials credentials) {
        synchronized (lifecycleLock) {
            this.credentials = credentials;
            JsonNode whoami;
            try {
                whoami = restClient.get(endpoint("account", "whoami").build(), credentials.accessToken());
            } catch (IOException e) {
                this.credentials = null;
                throw new UncheckedIOException("Cannot reach homeserver " + credentials.homeserver(), e);
            } catch (MatrixApiException e) {
                this.credentials = null;
                throw e;
            }
            String serverUserId = whoami.path("user_id").asText(credentials.userId());
            if (!serverUserId.equals(credentials.userId())) {
                log.warn("[Matrix] Access token belongs to {}, not {}", serverUserId, credentials.userId());
            }
            this.userId = serverUserId;
            this.deviceId = credentials.deviceId() != null
                    ? credentials.deviceId()
                    : whoami.path("device_id").asText(null);
            log.info("[Matrix] Connected to {} as {} (device {})", credentials.homeserver(), userId, deviceId);
        }
    }

    @Override
    public void startSync() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Matrix] Sync already running");
                return;
            }
            if (credentials == null) {
                throw new IllegalStateException("Not connected");
            }
            syncExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, CLIENT_SYNC_THREAD);
                thread.setDaemon(false);
                return thread;
            });
            running = true;
            MatrixRestClient syncClient = restClient.withReadTimeout(
                    config.getSyncTimeout() + SYNC_READ_TIMEOUT_MARGIN_MS);
            syncExecutor.submit(() -> syncLoop(syncClient));
            log.info("[Matrix] Sync started");
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            if (syncExecutor != null) {
                syncExecutor.shutdownNow();
                try {
                    if (!syncExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                        log.warn("[Matrix] Sync thread did not stop in time");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                syncExecutor = null;
            }
            pendingKeyRequests.clear();
            log.info("[Matrix] Stopped");
        }
    }

    @PreDestroy
    public void destroy() {
        if (running) {
            stop();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public String getUserId() {
        return userId;
    }

    @Override
    public String getDeviceId() {
        return deviceId;
    }

    @Override
    public CompletableFuture<Set<String>> getJoinedRooms() {
        return CompletableFuture.supplyAsync(() -> {
            JsonNode response = call(() -> restClient.get(endpoint("joined_rooms").build(), token()));
            Set<String> rooms = new LinkedHashSet<>();
            for (JsonNode roomId : response.path("joined_rooms")) {
                rooms.add(roomId.asText());
            }
            return rooms;
        });
    }

    @Override
    public CompletableFuture<Void> joinRoom(String roomIdOrAlias) {
        return CompletableFuture.runAsync(() -> {
            call(() -> restClient.post(endpoint("join", roomIdOrAlias).build(), token(), Map.of()));
            log.info("[Matrix] Joined {}", roomIdOrAlias);
        });
    }

    @Override
    public CompletableFuture<Optional<String>> resolveAlias(String alias) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                JsonNode response = call(
                        () -> restClient.get(endpoint("directory", "room", alias).build(), token()));
                String roomId = response.path("room_id").asText("");
                return roomId.isBlank() ? Optional.<String>empty() : Optional.of(roomId);
            } catch (MatrixApiException e) {
                if (e.getStatus() == 404) {
                    return Optional.<String>empty();
                }
                throw e;
            }
        });
    }

    @Override
    public CompletableFuture<Void> sendReaction(String roomId, String eventId, String emoji) {
        Map<String, Object> content = Map.of("m.relates_to", Map.of(
                "rel_type", "m.annotation",
                "event_id", eventId,
                "key", emoji));
        return sendRoomEvent(roomId, "m.reaction", content);
    }

    @Override
    public CompletableFuture<Void> sendMessage(String roomId, OutgoingMessage message) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("msgtype", "m.text");
        content.put("body", message.body());
        if (message.hasFormattedBody()) {
            content.put("format", "org.matrix.custom.html");
            content.put("formatted_body", message.formattedBody());
        }
        return sendRoomEvent(roomId, "m.room.message", content);
    }

    @Override
    public CompletableFuture<Void> requestRoomKey(DecryptionFailureEvent event) {
        if (!pendingKeyRequests.add(event.sessionId())) {
            return CompletableFuture.failedFuture(new DuplicateKeyRequestException(event.sessionId()));
        }
        return sendToDevice(RoomKeyRequest.forEvent(event, userId, deviceId))
                .whenComplete((ignored, error) -> pendingKeyRequests.remove(event.sessionId()));
    }

    int pendingKeyRequestCount() {
        return pendingKeyRequests.size();
    }

    @Override
    public CompletableFuture<Void> sendToDevice(RoomKeyRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("algorithm", request.algorithm());
        body.put("room_id", request.roomId());
        body.put("sender_key", request.senderKey());
        body.put("session_id", request.sessionId());

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("action", "request");
        content.put("body", body);
        content.put("request_id", request.requestId());
        content.put("requesting_device_id", request.requestingDeviceId());

        Map<String, Object> payload = Map.of("messages",
                Map.of(request.recipientUserId(), Map.of(request.recipientDeviceId(), content)));
        return CompletableFuture.runAsync(() -> call(() -> restClient.put(
                endpoint("sendToDevice", RoomKeyRequest.EVENT_TYPE, nextTransactionId()).build(),
                token(), payload)));
    }

    private CompletableFuture<Void> sendRoomEvent(String roomId, String eventType, Map<String, Object> content) {
        String txnId = nextTransactionId();
        return CompletableFuture.runAsync(() -> call(() -> restClient.put(
                endpoint("rooms", roomId, "send", eventType, txnId).build(), token(), content)));
    }

    private void syncLoop(MatrixRestClient syncClient) {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                HttpUrl.Builder url = endpoint("sync")
                        .addQueryParameter("timeout", String.valueOf(config.getSyncTimeout()));
                if (nextBatch != null) {
                    url.addQueryParameter("since", nextBatch);
                }
                JsonNode response = syncClient.get(url.build(), token());
                for (MatrixEvent event : syncParser.parse(response)) {
                    eventPublisher.publishEvent(event);
                }
                String batch = response.path("next_batch").asText("");
                if (!batch.isBlank()) {
                    nextBatch = batch;
                }
            } catch (MatrixApiException e) {
                if (e.isUnauthorized()) {
                    log.error("[Matrix] Access token rejected, stopping sync: {}", e.getMessage());
                    running = false;
                    return;
                }
                log.warn("[Matrix] Sync failed: {}", e.getMessage());
                backOff(e.isRateLimited() && e.getRetryAfterMs() != null
                        ? e.getRetryAfterMs()
                        : config.getSyncErrorBackoff());
            } catch (IOException e) {
                if (!running) {
                    return;
                }
                log.warn("[Matrix] Sync request failed: {}", e.getMessage());
                backOff(config.getSyncErrorBackoff());
            } catch (RuntimeException e) { // NOSONAR - keep the sync loop alive
                log.error("[Matrix] Unexpected error in sync loop", e);
                backOff(config.getSyncErrorBackoff());
            }
        }
    }

    private void backOff(long millis) {
        try {
            sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs a request, retrying rate limited responses up to
     * {@code rate-limit.max-retries} times.
     */
    <T> T call(MatrixCall<T> request) {
        BotProperties.RateLimitProperties rateLimit = config.getRateLimit();
        int attempt = 0;
        while (true) {
            try {
                return request.execute();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } catch (MatrixApiException e) {
                if (!e.isRateLimited() || attempt >= rateLimit.getMaxRetries()) {
                    throw e;
                }
                long delay = retryDelay(e.getRetryAfterMs(), attempt, rateLimit);
                attempt++;
                log.warn("[Matrix] Rate limited, retry {}/{} in {} ms", attempt, rateLimit.getMaxRetries(), delay);
                try {
                    sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    static long retryDelay(Long retryAfterMs, int attempt, BotProperties.RateLimitProperties rateLimit) {
        long base = retryAfterMs != null && retryAfterMs > 0
                ? retryAfterMs
                : rateLimit.getDefaultRetryAfter() * (1L << Math.min(attempt, 16));
        double jitter = Math.max(0.0, rateLimit.getJitter());
        double factor = jitter > 0 ? ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter) : 1.0;
        return Math.max(0L, Math.round(base * factor));
    }

    /**
     * Package-private for tests.
     */
    void sleep(long millis) throws InterruptedException {
        Thread.sleep(millis);
    }

    private HttpUrl.Builder endpoint(String... segments) {
        Credentials current = credentials;
        if (current == null) {
            throw new IllegalStateException("Not connected");
        }
        return restClient.endpoint(current.homeserver(), segments);
    }

    private String token() {
        Credentials current = credentials;
        return current != null ? current.accessToken() : null;
    }

    private String nextTransactionId() {
        return "biblebot-" + System.currentTimeMillis() + "-" + transactionCounter.incrementAndGet();
    }

    @FunctionalInterface
    interface MatrixCall<T> {
        T execute() throws IOException;
    }
}
