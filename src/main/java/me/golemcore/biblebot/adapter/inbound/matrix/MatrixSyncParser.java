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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.model.DecryptionFailureEvent;
import me.golemcore.biblebot.domain.model.InviteEvent;
import me.golemcore.biblebot.domain.model.MatrixEvent;
import me.golemcore.biblebot.domain.model.RoomMessageEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Extracts the events the bot reacts to from a {@code /sync} response: text
 * messages and undecryptable encrypted events from joined rooms' timelines, and
 * pending invites. Everything else is ignored.
 */
@Component
@Slf4j
public class MatrixSyncParser {

    private static final String ROOM_MESSAGE = "m.room.message";
    private static final String ROOM_ENCRYPTED = "m.room.encrypted";
    private static final String ROOM_MEMBER = "m.room.member";
    private static final Set<String> TEXT_MSGTYPES = Set.of("m.text", "m.notice");

    public List<MatrixEvent> parse(JsonNode sync) {
        List<MatrixEvent> events = new ArrayList<>();
        JsonNode rooms = sync.path("rooms");

        Iterator<Map.Entry<String, JsonNode>> joined = rooms.path("join").fields();
        while (joined.hasNext()) {
            Map.Entry<String, JsonNode> room = joined.next();
            for (JsonNode event : room.getValue().path("timeline").path("events")) {
                parseTimelineEvent(room.getKey(), event, events);
            }
        }

        Iterator<Map.Entry<String, JsonNode>> invited = rooms.path("invite").fields();
        while (invited.hasNext()) {
            Map.Entry<String, JsonNode> room = invited.next();
            events.add(new InviteEvent(room.getKey(), inviter(room.getValue())));
        }
        return events;
    }

    private void parseTimelineEvent(String roomId, JsonNode event, List<MatrixEvent> out) {
        String type = event.path("type").asText("");
        JsonNode content = event.path("content");
        try {
            if (ROOM_MESSAGE.equals(type)) {
                String msgtype = content.path("msgtype").asText("");
                if (TEXT_MSGTYPES.contains(msgtype) && content.path("body").isTextual()) {
                    out.add(new RoomMessageEvent(
                            roomId,
                            event.path("sender").asText(null),
                            event.path("event_id").asText(null),
                            event.path("origin_server_ts").asLong(0),
                            content.path("body").asText()));
                }
            } else if (ROOM_ENCRYPTED.equals(type)) {
                out.add(new DecryptionFailureEvent(
                        roomId,
                        event.path("event_id").asText(null),
                        event.path("sender").asText(null),
                        textOrNull(content, "sender_key"),
                        textOrNull(content, "session_id"),
                        textOrNull(content, "algorithm")));
            }
        } catch (IllegalArgumentException e) {
            log.debug("[Sync] Skipping malformed {} event in {}: {}", type, roomId, e.getMessage());
        }
    }

    private static String inviter(JsonNode invitedRoom) {
        for (JsonNode event : invitedRoom.path("invite_state").path("events")) {
            if (ROOM_MEMBER.equals(event.path("type").asText())
                    && "invite".equals(event.path("content").path("membership").asText())) {
                return event.path("sender").asText(null);
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }
}
