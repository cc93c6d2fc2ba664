package me.golemcore.biblebot.domain.service;

import me.golemcore.biblebot.domain.model.RoomMessageEvent;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.port.inbound.MatrixChannelPort;
import me.golemcore.biblebot.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RoomSessionStateTest {

    private static final String ROOM = "!bible:matrix.test";
    private static final String BOT = "@biblebot:matrix.test";
    private static final long START = Instant.parse("2024-01-01T00:00:00Z").toEpochMilli();

    private BotProperties properties;
    private MatrixChannelPort channel;
    private RoomSessionState state;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        channel = mock(MatrixChannelPort.class);
        state = new RoomSessionState(properties, channel, new MutableClock(Instant.ofEpochMilli(START)));
    }

    @Test
    void shouldResolveAliasesAndKeepConfigurationOrder() {
        properties.getMatrix().setRooms(List.of(
                "#study:matrix.test", ROOM, "#gone:matrix.test", "!abc:example.org", "not-a-room", ROOM));
        when(channel.resolveAlias("#study:matrix.test"))
                .thenReturn(CompletableFuture.completedFuture(Optional.of("!study:matrix.test")));
        when(channel.resolveAlias("#gone:matrix.test"))
                .thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        Set<String> rooms = state.resolveAliases().join();

        assertEquals(List.of("!study:matrix.test", ROOM), List.copyOf(rooms));
        assertTrue(state.isAuthorized("!study:matrix.test"));
        assertFalse(state.isAuthorized("#study:matrix.test"));
    }

    @Test
    void shouldDropAliasWhenResolutionFails() {
        properties.getMatrix().setRooms(List.of("#broken:matrix.test", ROOM));
        when(channel.resolveAlias("#broken:matrix.test"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("timeout")));

        Set<String> rooms = state.resolveAliases().join();

        assertEquals(Set.of(ROOM), rooms);
    }

    @Test
    void shouldJoinOnlyRoomsNotYetJoined() {
        properties.getMatrix().setRooms(List.of(ROOM, "!other:matrix.test"));
        state.resolveAliases().join();
        when(channel.getJoinedRooms()).thenReturn(CompletableFuture.completedFuture(Set.of(ROOM)));
        when(channel.joinRoom("!other:matrix.test")).thenReturn(CompletableFuture.completedFuture(null));

        state.ensureJoined().join();

        verify(channel).joinRoom("!other:matrix.test");
        verify(channel, never()).joinRoom(ROOM);
    }

    @Test
    void shouldSurviveJoinFailure() {
        properties.getMatrix().setRooms(List.of(ROOM));
        state.resolveAliases().join();
        when(channel.getJoinedRooms()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("x")));
        when(channel.joinRoom(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("forbidden")));

        state.ensureJoined().join();

        verify(channel).joinRoom(ROOM);
    }

    @Test
    void shouldRejectEverythingBeforeStart() {
        assertFalse(state.isAfterStart(Long.MAX_VALUE - 1));
    }

    @Test
    void shouldFilterByRoomSenderAndWatermark() {
        properties.getMatrix().setRooms(List.of(ROOM));
        state.resolveAliases().join();
        state.markStarted(BOT);

        assertEquals(START, state.getStartWatermark());
        assertEquals(BOT, state.getOwnUserId());
        assertTrue(state.accepts(message(ROOM, "@alice:matrix.test", START + 1)));
        assertFalse(state.accepts(message(ROOM, "@alice:matrix.test", START)));
        assertFalse(state.accepts(message(ROOM, BOT, START + 1)));
        assertFalse(state.accepts(message("!elsewhere:matrix.test", "@alice:matrix.test", START + 1)));
    }

    private static RoomMessageEvent message(String roomId, String sender, long timestamp) {
        return new RoomMessageEvent(roomId, sender, "$event", timestamp, "John 3:16");
    }
}
