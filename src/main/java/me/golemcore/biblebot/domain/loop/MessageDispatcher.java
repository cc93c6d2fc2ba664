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
import me.golemcore.biblebot.domain.model.DispatchOutcome;
import me.golemcore.biblebot.domain.model.InviteEvent;
import me.golemcore.biblebot.domain.model.KeyRequestOutcome;
import me.golemcore.biblebot.domain.model.OutgoingMessage;
import me.golemcore.biblebot.domain.model.PassageFailureKind;
import me.golemcore.biblebot.domain.model.PassageResult;
import me.golemcore.biblebot.domain.model.RoomMessageEvent;
import me.golemcore.biblebot.domain.model.ScriptureReference;
import me.golemcore.biblebot.domain.service.PassageLookupService;
import me.golemcore.biblebot.domain.service.ReferenceResolver;
import me.golemcore.biblebot.domain.service.ReplyFormatter;
import me.golemcore.biblebot.domain.service.RoomKeyRecoveryService;
import me.golemcore.biblebot.domain.service.RoomSessionState;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.infrastructure.i18n.MessageService;
import me.golemcore.biblebot.port.inbound.MatrixChannelPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Per-event state machine for inbound Matrix traffic.
 *
 * <p>
 * Room messages: {@code Received -> Filtered -> (Discarded | Resolved) ->
 * (Delivered | Errored)}. A message is filtered out when its room is not
 * authorized, when the bot sent it, or when its timestamp is not strictly after
 * the start watermark. A body without a reference is discarded silently. On a
 * match the passage is looked up (cache, then provider), the reaction is sent
 * to the triggering event and then the reply. A failed lookup produces exactly
 * one generic error message and no reaction; provider details go to the log
 * only.
 *
 * <p>
 * Invites join only authorized rooms. Decryption failures are handed to
 * {@link RoomKeyRecoveryService}.
 *
 * <p>
 * All methods must be called on the {@link DispatchLoop}. Suspension points
 * are the passage lookup, the reaction send and each message send; after each
 * of them the handler resumes on the loop. Send failures are logged and never
 * retried here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageDispatcher {

    private final RoomSessionState sessionState;
    private final ReferenceResolver referenceResolver;
    private final PassageLookupService lookupService;
    private final ReplyFormatter replyFormatter;
    private final RoomKeyRecoveryService keyRecoveryService;
    private final MatrixChannelPort channel;
    private final MessageService messageService;
    private final BotProperties properties;
    private final DispatchLoop loop;

    public CompletableFuture<DispatchOutcome> onRoomMessage(RoomMessageEvent event) {
        if (!sessionState.accepts(event)) {
            log.trace("[Dispatch] Filtered {} in {}", event.eventId(), event.roomId());
            return CompletableFuture.completedFuture(DispatchOutcome.FILTERED);
        }

        Optional<ScriptureReference> match = referenceResolver.parse(event.body());
        if (match.isEmpty()) {
            return CompletableFuture.completedFuture(DispatchOutcome.NO_MATCH);
        }

        ScriptureReference reference = match.get();
        log.info("[Dispatch] Detected {} in room {}", reference, event.roomId());
        return lookupService.lookup(reference)
                .thenComposeAsync(result -> result.isFound()
                        ? deliver(event, result)
                        : reportFailure(event, reference, result), loop);
    }

    public CompletableFuture<Void> onInvite(InviteEvent event) {
        if (!sessionState.isAuthorized(event.roomId())) {
            log.warn("[Dispatch] Ignoring invite to non-configured room {} from {}", event.roomId(), event.sender());
            return CompletableFuture.completedFuture(null);
        }
        log.info("[Dispatch] Invite to configured room {}, joining", event.roomId());
        return channel.joinRoom(event.roomId())
                .exceptionally(e -> {
                    log.error("[Dispatch] Failed to join {}: {}", event.roomId(), e.getMessage());
                    return null;
                });
    }

    public CompletableFuture<KeyRequestOutcome> onDecryptionFailure(DecryptionFailureEvent event) {
        if (!sessionState.isAuthorized(event.roomId())) {
            log.debug("[Dispatch] Undecryptable event {} in non-configured room {}", event.eventId(), event.roomId());
            return CompletableFuture.completedFuture(KeyRequestOutcome.SKIPPED);
        }
        return keyRecoveryService.recover(event);
    }

    private CompletableFuture<DispatchOutcome> deliver(RoomMessageEvent event, PassageResult result) {
        List<OutgoingMessage> messages = replyFormatter.formatPassage(result.getPassage());
        if (messages.isEmpty()) {
            log.warn("[Dispatch] Empty passage text for {}", result.getPassage().reference());
            return CompletableFuture.completedFuture(DispatchOutcome.EMPTY_PASSAGE);
        }

        String reaction = properties.getBible().getReply().getReaction();
        CompletableFuture<Void> chain = channel.sendReaction(event.roomId(), event.eventId(), reaction)
                .exceptionally(e -> {
                    log.warn("[Dispatch] Failed to send reaction to {}: {}", event.eventId(), e.getMessage());
                    return null;
                });
        for (OutgoingMessage message : messages) {
            chain = chain.thenComposeAsync(ignored -> channel.sendMessage(event.roomId(), message), loop);
        }
        return chain.handle((ignored, error) -> {
            if (error != null) {
                log.error("[Dispatch] Failed to send passage to {}: {}", event.roomId(), error.getMessage());
            } else {
                log.info("[Dispatch] Sent {} in {} message(s)", result.getPassage().reference(), messages.size());
            }
            return DispatchOutcome.DELIVERED;
        });
    }

    private CompletableFuture<DispatchOutcome> reportFailure(RoomMessageEvent event, ScriptureReference reference,
            PassageResult result) {
        log.warn("[Dispatch] Lookup of {} failed ({}): {}", reference, result.getFailureKind(), result.getDetail());
        String text = errorText(reference, result.getFailureKind());
        return channel.sendMessage(event.roomId(), replyFormatter.formatNotice(text))
                .handle((ignored, error) -> {
                    if (error != null) {
                        log.error("[Dispatch] Failed to send error message to {}: {}", event.roomId(),
                                error.getMessage());
                    }
                    return DispatchOutcome.ERRORED;
                });
    }

    private String errorText(ScriptureReference reference, PassageFailureKind kind) {
        if (kind == PassageFailureKind.CREDENTIAL_MISSING) {
            return messageService.getMessage("reply.error.credential_missing",
                    reference.translation().toUpperCase(Locale.ROOT), reference.label());
        }
        return messageService.getMessage("reply.error.not_found");
    }
}
