package me.golemcore.biblebot.domain.model;

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

import java.util.Objects;

/**
 * {@code m.room_key_request} to-device message asking the bot's other devices
 * (and the sender) for a Megolm session.
 *
 * @param recipientUserId
 *            user whose devices receive the request
 * @param recipientDeviceId
 *            target device, {@code "*"} for all devices
 */
public record RoomKeyRequest(String requestId, String recipientUserId, String recipientDeviceId,
        String requestingDeviceId, String roomId, String algorithm, String senderKey, String sessionId) {

    public static final String EVENT_TYPE = "m.room_key_request";
    public static final String ALL_DEVICES = "*";

    public RoomKeyRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(recipientUserId, "recipientUserId");
        Objects.requireNonNull(roomId, "roomId");
        Objects.requireNonNull(sessionId, "sessionId");
    }

    /**
     * Builds the request for a failed event, addressed to all devices of
     * {@code userId}. The request id is derived from the session so that
     * repeated requests for the same session are recognisable as such.
     */
    public static RoomKeyRequest forEvent(DecryptionFailureEvent event, String userId, String deviceId) {
        return new RoomKeyRequest(
                event.sessionId(),
                userId,
                ALL_DEVICES,
                deviceId,
                event.roomId(),
                event.algorithm(),
                event.senderKey(),
                event.sessionId());
    }
}
