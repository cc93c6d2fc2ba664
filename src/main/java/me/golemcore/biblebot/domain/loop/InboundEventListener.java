package me.golemcore.biblebot.domain.loop;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.model.DecryptionFailureEvent;
import me.golemcore.biblebot.domain.model.InviteEvent;
import me.golemcore.biblebot.domain.model.RoomMessageEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Moves inbound Matrix events from the sync thread onto the
 * {@link DispatchLoop} and hands them to {@link MessageDispatcher}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundEventListener {

    private final MessageDispatcher dispatcher;
    private final DispatchLoop loop;

    @EventListener
    public void onRoomMessage(RoomMessageEvent event) {
        log.debug("[Inbound] message {} in {} from {}", event.eventId(), event.roomId(), event.sender());
        loop.execute(() -> logFailure(dispatcher.onRoomMessage(event), "message", event.eventId()));
    }

    @EventListener
    public void onInvite(InviteEvent event) {
        log.debug("[Inbound] invite to {}", event.roomId());
        loop.execute(() -> logFailure(dispatcher.onInvite(event), "invite to", event.roomId()));
    }

    @EventListener
    public void onDecryptionFailure(DecryptionFailureEvent event) {
        log.debug("[Inbound] undecryptable {} in {}", event.eventId(), event.roomId());
        loop.execute(() -> logFailure(dispatcher.onDecryptionFailure(event), "undecryptable", event.eventId()));
    }

    private void logFailure(CompletableFuture<?> handling, String kind, String id) {
        handling.whenCompleteAsync((ignored, error) -> {
            if (error != null) {
                log.error("[Inbound] Handling {} {} failed", kind, id, error);
            }
        }, loop);
    }
}
