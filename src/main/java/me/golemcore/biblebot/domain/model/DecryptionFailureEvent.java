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

/**
 * Encrypted room event the bot could not decrypt. The Megolm session fields are
 * what a room key request needs.
 */
public record DecryptionFailureEvent(String roomId, String eventId, String sender, String senderKey,
        String sessionId, String algorithm) implements MatrixEvent {

    public DecryptionFailureEvent {
        MatrixEvent.requireText(roomId, "roomId");
        MatrixEvent.requireText(eventId, "eventId");
    }

    /**
     * Whether the event carries enough session information to build a key
     * request.
     */
    public boolean hasSessionInfo() {
        return sessionId != null && !sessionId.isBlank()
                && senderKey != null && !senderKey.isBlank()
                && algorithm != null && !algorithm.isBlank();
    }
}
