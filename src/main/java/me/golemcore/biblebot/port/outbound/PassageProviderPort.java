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

import me.golemcore.biblebot.domain.model.PassageResult;
import me.golemcore.biblebot.domain.model.ScriptureReference;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * External service that turns a reference into passage text.
 *
 * <p>
 * Implementations map every outcome to a {@link PassageResult}; the returned
 * future completes normally even when the provider is unreachable. Each call
 * carries the provider timeout.
 */
public interface PassageProviderPort {

    String getProviderName();

    /**
     * Lowercase translation codes this provider serves.
     */
    Set<String> getSupportedTranslations();

    boolean isEnabled();

    /**
     * Whether the provider needs an API key and none is configured.
     */
    boolean isCredentialMissing();

    CompletableFuture<PassageResult> fetch(ScriptureReference reference);
}
