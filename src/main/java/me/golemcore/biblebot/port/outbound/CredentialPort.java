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

import java.nio.file.Path;
import java.util.Optional;

/**
 * Durable storage for the Matrix session.
 */
public interface CredentialPort {

    /**
     * Replaces any stored credentials. Readers never see a partially written
     * file, and the file is readable by the owner only.
     *
     * @throws java.io.UncheckedIOException
     *             if the file cannot be written; a previous file stays intact
     */
    void save(Credentials credentials);

    /**
     * Stored credentials, or empty when there is no file or it cannot be
     * parsed.
     */
    Optional<Credentials> load();

    /**
     * Removes the credential file and the local key store directory.
     *
     * @return whether a credential file existed
     */
    boolean delete();

    boolean exists();

    Path getCredentialsPath();

    Path getStorePath();
}
