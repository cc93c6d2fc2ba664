package me.golemcore.biblebot.adapter.outbound.provider;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.model.Passage;
import me.golemcore.biblebot.domain.model.PassageResult;
import me.golemcore.biblebot.domain.model.ScriptureReference;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.infrastructure.http.FeignClientFactory;
import me.golemcore.biblebot.port.outbound.PassageProviderPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * English Standard Version through the Crossway ESV API
 * ({@code /v3/passage/text/}).
 *
 * <p>
 * Requires an API key ({@code ESV_API_KEY}). Headings, footnotes, verse numbers,
 * copyright and passage references are switched off so the response is plain
 * passage text. An empty {@code passages} array means the reference does not
 * exist.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EsvPassageProvider implements PassageProviderPort {

    private static final String PROVIDER_NAME = "esv";
    private static final Set<String> TRANSLATIONS = Set.of("esv");
    private static final int HTTP_NOT_FOUND = 404;

    private final FeignClientFactory feignClientFactory;
    private final BotProperties properties;

    private EsvApi api;

    @PostConstruct
    public void init() {
        BotProperties.ProvidersProperties providers = properties.getProviders();
        api = feignClientFactory.create(EsvApi.class, providers.getEsv().getBaseUrl(), providers.getTimeout());
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public Set<String> getSupportedTranslations() {
        return TRANSLATIONS;
    }

    @Override
    public boolean isEnabled() {
        return properties.getProviders().getEsv().isEnabled();
    }

    @Override
    public boolean isCredentialMissing() {
        String apiKey = properties.getProviders().getEsv().getApiKey();
        return apiKey == null || apiKey.isBlank();
    }

    @Override
    public CompletableFuture<PassageResult> fetch(ScriptureReference reference) {
        return CompletableFuture.supplyAsync(() -> doFetch(reference));
    }

    private PassageResult doFetch(ScriptureReference reference) {
        String query = reference.label();
        try {
            EsvResponse response = api.passage("Token " + properties.getProviders().getEsv().getApiKey(), query);
            if (response == null || response.getPassages() == null || response.getPassages().isEmpty()
                    || response.getPassages().get(0) == null || response.getPassages().get(0).isBlank()) {
                return PassageResult.notFound("ESV returned no passage for " + query);
            }
            String canonical = response.getCanonical() != null && !response.getCanonical().isBlank()
                    ? response.getCanonical()
                    : query;
            return PassageResult.found(new Passage(response.getPassages().get(0).strip(), canonical));
        } catch (FeignException e) {
            if (e.status() == HTTP_NOT_FOUND) {
                return PassageResult.notFound("ESV 404 for " + query);
            }
            log.warn("[ESV] API error (status {}) for {}", e.status(), query);
            return PassageResult.unavailable("ESV API status " + e.status());
        } catch (RuntimeException e) { // NOSONAR - decoding and transport errors
            log.warn("[ESV] Request failed for {}: {}", query, e.getMessage());
            return PassageResult.unavailable("ESV request failed: " + e.getClass().getSimpleName());
        }
    }

    interface EsvApi {
        @RequestLine("GET /v3/passage/text/?q={query}&include-headings=false&include-footnotes=false"
                + "&include-verse-numbers=false&include-short-copyright=false&include-passage-references=false")
        @Headers({
                "Accept: application/json",
                "Authorization: {authorization}"
        })
        EsvResponse passage(
                @Param("authorization") String authorization,
                @Param("query") String query);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EsvResponse {
        private String canonical;
        private List<String> passages;
    }
}
