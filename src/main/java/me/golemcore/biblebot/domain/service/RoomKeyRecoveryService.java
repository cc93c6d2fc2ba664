package me.golemcore.biblebot.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.model.DecryptionFailureEvent;
import me.golemcore.biblebot.domain.model.KeyRequestOutcome;
import me.golemcore.biblebot.domain.model.RoomKeyRequest;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.port.inbound.DuplicateKeyRequestException;
import me.golemcore.biblebot.port.inbound.MatrixChannelPort;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Requests missing room keys for events that could not be decrypted.
 *
 * <p>
 * Each failed event gets exactly one request. The channel's key request path
 * is tried first; only when it reports a duplicate in flight (or is not
 * supported) is a raw to-device request sent instead. Event ids already
 * handled are remembered in a bounded set so a redelivered failure does not
 * trigger a second request. Must be called on the dispatch loop.
 */
@Service
@Slf4j
public class RoomKeyRecoveryService {

    private final MatrixChannelPort channel;
    private final boolean e2eeEnabled;
    private final Set<String> handledEventIds;

    public RoomKeyRecoveryService(BotProperties properties, MatrixChannelPort channel) {
        this.channel = channel;
        BotProperties.E2eeProperties e2ee = properties.getMatrix().getE2ee();
        this.e2eeEnabled = e2ee.isEnabled();
        int memory = Math.max(1, e2ee.getHandledEventMemory());
        this.handledEventIds = Collections.newSetFromMap(new LinkedHashMap<>(16, 0.75f, false) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > memory;
            }
        });
    }

    public CompletableFuture<KeyRequestOutcome> recover(DecryptionFailureEvent event) {
        if (!e2eeEnabled) {
            log.warn("[Keys] Encrypted message {} in room {} but E2EE is disabled; "
                    + "enable bot.matrix.e2ee.enabled to request keys", event.eventId(), event.roomId());
            return CompletableFuture.completedFuture(KeyRequestOutcome.SKIPPED);
        }
        if (!handledEventIds.add(event.eventId())) {
            log.debug("[Keys] Key request already made for {}", event.eventId());
            return CompletableFuture.completedFuture(KeyRequestOutcome.SKIPPED);
        }
        if (!event.hasSessionInfo()) {
            log.warn("[Keys] Event {} has no Megolm session info, cannot request keys", event.eventId());
            return CompletableFuture.completedFuture(KeyRequestOutcome.SKIPPED);
        }

        log.warn("[Keys] Failed to decrypt {} in room {}, requesting session {}",
                event.eventId(), event.roomId(), event.sessionId());
        CompletableFuture<KeyRequestOutcome> primary;
        try {
            primary = channel.requestRoomKey(event).thenApply(ignored -> KeyRequestOutcome.REQUESTED);
        } catch (UnsupportedOperationException e) {
            primary = CompletableFuture.failedFuture(e);
        }

        return primary.handle((outcome, error) -> {
            if (error == null) {
                log.info("[Keys] Requested keys for {}", event.eventId());
                return CompletableFuture.completedFuture(outcome);
            }
            Throwable cause = unwrap(error);
            if (cause instanceof DuplicateKeyRequestException duplicate) {
                log.debug("[Keys] Request for session {} already pending, sending to-device",
                        duplicate.getSessionId());
                return sendToDevice(event);
            }
            if (cause instanceof UnsupportedOperationException) {
                return sendToDevice(event);
            }
            log.error("[Keys] Key request for {} failed", event.eventId(), cause);
            return CompletableFuture.completedFuture(KeyRequestOutcome.FAILED);
        }).thenCompose(future -> future);
    }

    private CompletableFuture<KeyRequestOutcome> sendToDevice(DecryptionFailureEvent event) {
        RoomKeyRequest request = RoomKeyRequest.forEvent(event, channel.getUserId(), channel.getDeviceId());
        return channel.sendToDevice(request)
                .thenApply(ignored -> {
                    log.info("[Keys] Requested keys via to-device for {}", event.eventId());
                    return KeyRequestOutcome.REQUESTED_VIA_TO_DEVICE;
                })
                .exceptionally(e -> {
                    log.error("[Keys] To-device key request for {} failed", event.eventId(), unwrap(e));
                    return KeyRequestOutcome.FAILED;
                });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
