package me.golemcore.biblebot.port.outbound;

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

import me.golemcore.biblebot.domain.model.Credentials;

/**
 * Matrix account operations used by the {@code auth} commands.
 */
public interface MatrixAuthPort {

    /**
     * Resolves a server name or URL to the client API base URL via
     * {@code /.well-known/matrix/client}; falls back to the input as
     * {@code https://} URL when discovery is unavailable.
     */
    String discoverHomeserver(String serverNameOrUrl);

    Credentials login(String homeserver, String user, String password, String deviceName);

    void logout(Credentials credentials);

    /**
     * User id the access token belongs to.
     */
    String whoami(String homeserver, String accessToken);
}
