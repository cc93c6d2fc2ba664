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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.model.PassageFailureKind;
import me.golemcore.biblebot.domain.model.PassageResult;
import me.golemcore.biblebot.domain.model.ScriptureReference;
import me.golemcore.biblebot.port.outbound.PassageProviderPort;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routes a reference to the one provider that serves its translation.
 *
 * <p>
 * The first enabled provider registered for a translation code owns it. There
 * is no fallback: a provider failure is returned as-is. A missing API key is
 * reported before any network call is made.
 */
@Service
@Slf4j
public class PassageGateway {

    private final Map<String, PassageProviderPort> providersByTranslation;

    public PassageGateway(List<PassageProviderPort> providers) {
        Map<String, PassageProviderPort> routes = new LinkedHashMap<>();
        for (PassageProviderPort provider : providers) {
            if (!provider.isEnabled()) {
                continue;
            }
            for (String translation : provider.getSupportedTranslations()) {
                String code = translation.toLowerCase(Locale.ROOT);
                PassageProviderPort existing = routes.putIfAbsent(code, provider);
                if (existing != null) {
                    log.warn("[Provider] Translation {} served by {}, ignoring {}",
                            code, existing.getProviderName(), provider.getProviderName());
                }
            }
        }
        this.providersByTranslation = Collections.unmodifiableMap(routes);
    }

    public Set<String> getSupportedTranslations() {
        return providersByTranslation.keySet();
    }

    public Optional<PassageProviderPort> findProvider(String translation) {
        if (translation == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providersByTranslation.get(translation.toLowerCase(Locale.ROOT)));
    }

    public CompletableFuture<PassageResult> fetch(ScriptureReference reference) {
        Optional<PassageProviderPort> provider = findProvider(reference.translation());
        if (provider.isEmpty()) {
            return CompletableFuture.completedFuture(
                    PassageResult.notFound("No provider for translation " + reference.translation()));
        }

        PassageProviderPort selected = provider.get();
        if (selected.isCredentialMissing()) {
            return CompletableFuture.completedFuture(PassageResult.failure(PassageFailureKind.CREDENTIAL_MISSING,
                    selected.getProviderName() + " API key is not configured"));
        }

        log.debug("[Provider] {} -> {}", reference, selected.getProviderName());
        return selected.fetch(reference)
                .exceptionally(e -> PassageResult.unavailable(
                        selected.getProviderName() + " failed: " + e.getMessage()));
    }
}
