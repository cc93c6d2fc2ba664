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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.model.Credentials;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.port.inbound.MatrixChannelPort;
import me.golemcore.biblebot.port.outbound.CredentialPort;
import me.golemcore.biblebot.port.outbound.MatrixAuthPort;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Brings the bot online: credentials, session restore, watermark, room
 * resolution and joins, then the sync loop.
 *
 * <p>
 * Saved credentials win. Without them a legacy access token from configuration
 * ({@code MATRIX_ACCESS_TOKEN}) is accepted together with the configured
 * homeserver; a corrupt credential file counts as absent. With neither the
 * start fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BotLifecycleService {

    private final CredentialPort credentialPort;
    private final MatrixAuthPort authPort;
    private final MatrixChannelPort channel;
    private final RoomSessionState sessionState;
    private final BotProperties properties;

    public void start() {
        Credentials credentials = resolveCredentials();
        log.info("[Lifecycle] Connecting to {} as {}", credentials.homeserver(), credentials.userId());
        channel.connect(credentials);
        sessionState.markStarted(channel.getUserId());

        sessionState.resolveAliases().join();
        if (sessionState.getAuthorizedRooms().isEmpty()) {
            log.warn("[Lifecycle] No usable rooms configured; the bot will not answer anywhere");
        }
        sessionState.ensureJoined().join();

        channel.startSync();
        log.info("[Lifecycle] BibleBot is running in {} room(s)", sessionState.getAuthorizedRooms().size());
    }

    public Credentials resolveCredentials() {
        Optional<Credentials> saved = credentialPort.load();
        if (saved.isPresent()) {
            return saved.get();
        }

        BotProperties.MatrixProperties matrix = properties.getMatrix();
        String token = matrix.getAccessToken();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException(
                    "No credentials found. Run 'auth login' or set MATRIX_ACCESS_TOKEN and bot.matrix.homeserver");
        }
        if (matrix.getHomeserver() == null || matrix.getHomeserver().isBlank()) {
            throw new IllegalStateException("MATRIX_ACCESS_TOKEN is set but bot.matrix.homeserver is not");
        }

        log.warn("[Lifecycle] Using legacy access token from configuration; run 'auth login' to save a session");
        String homeserver = matrix.getHomeserver();
        String userId = matrix.getUserId();
        if (userId == null || userId.isBlank()) {
            userId = authPort.whoami(homeserver, token);
        }
        return new Credentials(homeserver, userId, token, null);
    }

    @PreDestroy
    public void stop() {
        if (channel.isRunning()) {
            log.info("[Lifecycle] Stopping");
            channel.stop();
        }
    }
}
