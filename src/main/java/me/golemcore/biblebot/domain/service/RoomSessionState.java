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
import me.golemcore.biblebot.domain.model.RoomMessageEvent;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.port.inbound.MatrixChannelPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * The bot's identity, the rooms it may act in and the start watermark.
 *
 * <p>
 * The authorized set holds resolved room ids only. It is rebuilt once by
 * {@link #resolveAliases()} during startup and read-only afterwards. Until
 * {@link #markStarted(String)} runs, every message is before the watermark.
 */
@Service
@Slf4j
public class RoomSessionState {

    private static final List<String> PLACEHOLDER_MARKERS = List.of(
            "your_room_id", "your_homeserver_domain", "example.org");

    private final BotProperties properties;
    private final MatrixChannelPort channel;
    private final Clock clock;

    private volatile Set<String> authorizedRooms = Set.of();
    private volatile long startWatermark = Long.MAX_VALUE;
    private volatile String ownUserId;

    public RoomSessionState(BotProperties properties, MatrixChannelPort channel, Clock clock) {
        this.properties = properties;
        this.channel = channel;
        this.clock = clock;
    }

    /**
     * Records the session user and captures the watermark from the clock.
     */
    public void markStarted(String userId) {
        this.ownUserId = userId;
        this.startWatermark = clock.millis();
        log.info("[Rooms] Start watermark {} for {}", startWatermark, userId);
    }

    /**
     * Resolves configured aliases to room ids. Unresolvable aliases and sample
     * config placeholders are dropped with a warning; duplicates collapse in
     * configuration order.
     */
    public CompletableFuture<Set<String>> resolveAliases() {
        List<CompletableFuture<Optional<String>>> resolutions = new ArrayList<>();
        for (String configured : properties.getMatrix().getRooms()) {
            resolutions.add(resolveOne(configured));
        }

        return CompletableFuture.allOf(resolutions.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Set<String> resolved = new LinkedHashSet<>();
                    for (CompletableFuture<Optional<String>> resolution : resolutions) {
                        resolution.join().ifPresent(resolved::add);
                    }
                    authorizedRooms = Collections.unmodifiableSet(resolved);
                    log.info("[Rooms] Authorized rooms: {}", authorizedRooms);
                    return authorizedRooms;
                });
    }

    /**
     * Joins every authorized room the homeserver does not list as joined.
     */
    public CompletableFuture<Void> ensureJoined() {
        return channel.getJoinedRooms()
                .exceptionally(e -> {
                    log.warn("[Rooms] Could not list joined rooms: {}", e.getMessage());
                    return Set.of();
                })
                .thenCompose(joined -> {
                    List<CompletableFuture<Void>> joins = new ArrayList<>();
                    for (String roomId : authorizedRooms) {
                        if (joined.contains(roomId)) {
                            log.debug("[Rooms] Already joined {}", roomId);
                            continue;
                        }
                        joins.add(channel.joinRoom(roomId)
                                .thenRun(() -> log.info("[Rooms] Joined {}", roomId))
                                .exceptionally(e -> {
                                    log.warn("[Rooms] Failed to join {}: {}", roomId, e.getMessage());
                                    return null;
                                }));
                    }
                    return CompletableFuture.allOf(joins.toArray(new CompletableFuture[0]));
                });
    }

    public boolean isAuthorized(String roomId) {
        return roomId != null && authorizedRooms.contains(roomId);
    }

    public boolean isOwnUser(String userId) {
        return userId != null && userId.equals(ownUserId);
    }

    /**
     * Strictly after the watermark; an event stamped exactly at startup is
     * history.
     */
    public boolean isAfterStart(long serverTimestamp) {
        return serverTimestamp > startWatermark;
    }

    public boolean accepts(RoomMessageEvent event) {
        return isAuthorized(event.roomId())
                && !isOwnUser(event.sender())
                && isAfterStart(event.serverTimestamp());
    }

    public Set<String> getAuthorizedRooms() {
        return authorizedRooms;
    }

    public long getStartWatermark() {
        return startWatermark;
    }

    public String getOwnUserId() {
        return ownUserId;
    }

    private CompletableFuture<Optional<String>> resolveOne(String configured) {
        if (configured == null || configured.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String room = configured.strip();
        if (isPlaceholder(room)) {
            log.warn("[Rooms] Skipping placeholder room from sample config: {}", room);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (room.startsWith("!")) {
            return CompletableFuture.completedFuture(Optional.of(room));
        }
        if (!room.startsWith("#")) {
            log.warn("[Rooms] Ignoring {}: not a room id or alias", room);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return channel.resolveAlias(room)
                .exceptionally(e -> {
                    log.warn("[Rooms] Failed to resolve alias {}: {}", room, e.getMessage());
                    return Optional.empty();
                })
                .thenApply(roomId -> {
                    if (roomId.isEmpty()) {
                        log.warn("[Rooms] Dropping unresolvable alias {}", room);
                    } else {
                        log.info("[Rooms] Resolved {} to {}", room, roomId.get());
                    }
                    return roomId;
                });
    }

    private static boolean isPlaceholder(String room) {
        return PLACEHOLDER_MARKERS.stream().anyMatch(room::contains);
    }
}
