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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.model.Credentials;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.port.outbound.CredentialPort;
import me.golemcore.biblebot.port.outbound.MatrixAuthPort;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Interactive session management behind the {@code auth} commands.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final MatrixAuthPort authPort;
    private final CredentialPort credentialPort;
    private final BotProperties properties;

    /**
     * Discovers the homeserver, logs in and replaces the saved credentials.
     */
    public Credentials login(String server, String user, String password) {
        String homeserver = authPort.discoverHomeserver(server);
        log.info("[Auth] Logging in to {} as {}", homeserver, user);
        Credentials credentials = authPort.login(homeserver, user, password,
                properties.getMatrix().getDeviceName());
        credentialPort.save(credentials);
        log.info("[Auth] Saved credentials for {} to {}", credentials.userId(), credentialPort.getCredentialsPath());
        return credentials;
    }

    /**
     * Invalidates the server session when possible and always removes local
     * credentials and key store.
     *
     * @return whether saved credentials existed
     */
    public boolean logout() {
        Optional<Credentials> saved = credentialPort.load();
        saved.ifPresent(credentials -> {
            try {
                authPort.logout(credentials);
                log.info("[Auth] Logged out {} on the server", credentials.userId());
            } catch (RuntimeException e) {
                log.warn("[Auth] Server logout failed, removing local credentials anyway: {}", e.getMessage());
            }
        });
        boolean existed = credentialPort.delete();
        return existed || saved.isPresent();
    }

    public Optional<Credentials> status() {
        return credentialPort.load();
    }
}
