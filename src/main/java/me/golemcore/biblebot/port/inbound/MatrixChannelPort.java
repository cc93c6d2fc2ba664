package me.golemcore.biblebot.port.inbound;

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

import me.golemcore.biblebot.domain.model.Credentials;
import me.golemcore.biblebot.domain.model.DecryptionFailureEvent;
import me.golemcore.biblebot.domain.model.OutgoingMessage;
import me.golemcore.biblebot.domain.model.RoomKeyRequest;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Bidirectional port to the Matrix homeserver. Inbound traffic is published as
 * {@link me.golemcore.biblebot.domain.model.MatrixEvent} application events
 * once {@link #startSync()} has been called; outbound calls complete
 * asynchronously and fail with the transport's exception.
 */
public interface MatrixChannelPort {

    /**
     * Restores a session from saved credentials and verifies the access token
     * with the homeserver. Does not start receiving events.
     */
    void connect(Credentials credentials);

    /**
     * Starts the sync loop that publishes inbound events.
     */
    void startSync();

    /**
     * Stops the sync loop and forgets the session.
     */
    void stop();

    boolean isRunning();

    /**
     * Fully qualified user id of the connected session, e.g.
     * {@code @biblebot:example.org}.
     */
    String getUserId();

    String getDeviceId();

    CompletableFuture<Set<String>> getJoinedRooms();

    CompletableFuture<Void> joinRoom(String roomIdOrAlias);

    /**
     * Resolves {@code #alias:server} to a room id; empty when the directory has
     * no such alias.
     */
    CompletableFuture<Optional<String>> resolveAlias(String alias);

    CompletableFuture<Void> sendReaction(String roomId, String eventId, String emoji);

    CompletableFuture<Void> sendMessage(String roomId, OutgoingMessage message);

    /**
     * Requests the Megolm session of an undecryptable event. Completes
     * exceptionally with {@link DuplicateKeyRequestException} when a request
     * for the same session is already outstanding.
     */
    CompletableFuture<Void> requestRoomKey(DecryptionFailureEvent event);

    /**
     * Sends a raw key request as a to-device message, bypassing the
     * outstanding-request bookkeeping of {@link #requestRoomKey}.
     */
    CompletableFuture<Void> sendToDevice(RoomKeyRequest request);
}
