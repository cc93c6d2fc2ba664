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
 * Plain-text room message ({@code m.room.message} with {@code m.text} or
 * {@code m.notice}).
 *
 * @param serverTimestamp
 *            {@code origin_server_ts} in epoch milliseconds
 */
public record RoomMessageEvent(String roomId, String sender, String eventId, long serverTimestamp, String body)
        implements MatrixEvent {

    public RoomMessageEvent {
        MatrixEvent.requireText(roomId, "roomId");
        MatrixEvent.requireText(sender, "sender");
        MatrixEvent.requireText(eventId, "eventId");
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
    }
}
