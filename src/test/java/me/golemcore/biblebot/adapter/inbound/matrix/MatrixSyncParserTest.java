package me.golemcore.biblebot.adapter.inbound.matrix;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.biblebot.domain.model.DecryptionFailureEvent;
import me.golemcore.biblebot.domain.model.InviteEvent;
import me.golemcore.biblebot.domain.model.MatrixEvent;
import me.golemcore.biblebot.domain.model.RoomMessageEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatrixSyncParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MatrixSyncParser parser = new MatrixSyncParser();

    private List<MatrixEvent> parse(String json) throws Exception {
        return parser.parse(objectMapper.readTree(json));
    }

    @Test
    void shouldExtractTextMessagesAndNotices() throws Exception {
        List<MatrixEvent> events = parse("""
                {"next_batch":"s1","rooms":{"join":{"!bible:matrix.test":{"timeline":{"events":[
                  {"type":"m.room.message","event_id":"$1","sender":"@alice:matrix.test",
                   "origin_server_ts":1700000000001,"content":{"msgtype":"m.text","body":"John 3:16"}},
                  {"type":"m.room.message","event_id":"$2","sender":"@bot:matrix.test",
                   "origin_server_ts":1700000000002,"content":{"msgtype":"m.notice","body":"Psalm 23"}},
                  {"type":"m.room.message","event_id":"$3","sender":"@alice:matrix.test",
                   "origin_server_ts":1700000000003,"content":{"msgtype":"m.image","body":"cat.png"}},
                  {"type":"m.reaction","event_id":"$4","sender":"@alice:matrix.test","content":{}}
                ]}}}}}
                """);

        assertEquals(2, events.size());
        RoomMessageEvent first = assertInstanceOf(RoomMessageEvent.class, events.get(0));
        assertEquals("!bible:matrix.test", first.roomId());
        assertEquals("@alice:matrix.test", first.sender());
        assertEquals("$1", first.eventId());
        assertEquals(1_700_000_000_001L, first.serverTimestamp());
        assertEquals("John 3:16", first.body());
        assertEquals("Psalm 23", ((RoomMessageEvent) events.get(1)).body());
    }

    @Test
    void shouldReportEncryptedEventsWithSessionInfo() throws Exception {
        List<MatrixEvent> events = parse("""
                {"rooms":{"join":{"!bible:matrix.test":{"timeline":{"events":[
                  {"type":"m.room.encrypted","event_id":"$enc","sender":"@alice:matrix.test",
                   "origin_server_ts":1,"content":{"algorithm":"m.megolm.v1.aes-sha2",
                   "sender_key":"curve","session_id":"sess","ciphertext":"AAA"}}
                ]}}}}}
                """);

        DecryptionFailureEvent event = assertInstanceOf(DecryptionFailureEvent.class, events.get(0));
        assertEquals("$enc", event.eventId());
        assertEquals("sess", event.sessionId());
        assertEquals("curve", event.senderKey());
        assertTrue(event.hasSessionInfo());
    }

    @Test
    void shouldExtractInvitesWithInviter() throws Exception {
        List<MatrixEvent> events = parse("""
                {"rooms":{"invite":{"!new:matrix.test":{"invite_state":{"events":[
                  {"type":"m.room.name","sender":"@alice:matrix.test","content":{"name":"Study"}},
                  {"type":"m.room.member","sender":"@alice:matrix.test","state_key":"@bot:matrix.test",
                   "content":{"membership":"invite"}}
                ]}}}}}
                """);

        InviteEvent invite = assertInstanceOf(InviteEvent.class, events.get(0));
        assertEquals("!new:matrix.test", invite.roomId());
        assertEquals("@alice:matrix.test", invite.sender());
    }

    @Test
    void shouldTolerateInviteWithoutState() throws Exception {
        List<MatrixEvent> events = parse("{\"rooms\":{\"invite\":{\"!new:matrix.test\":{}}}}");

        assertNull(((InviteEvent) events.get(0)).sender());
    }

    @Test
    void shouldSkipMalformedEvents() throws Exception {
        List<MatrixEvent> events = parse("""
                {"rooms":{"join":{"!bible:matrix.test":{"timeline":{"events":[
                  {"type":"m.room.message","sender":"@alice:matrix.test","content":{"msgtype":"m.text","body":"x"}}
                ]}}}}}
                """);

        assertTrue(events.isEmpty());
    }

    @Test
    void shouldHandleEmptySync() throws Exception {
        assertTrue(parse("{\"next_batch\":\"s2\"}").isEmpty());
    }
}
