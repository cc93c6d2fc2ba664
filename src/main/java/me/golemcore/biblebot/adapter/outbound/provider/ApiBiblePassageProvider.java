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
import me.golemcore.biblebot.domain.model.Book;
import me.golemcore.biblebot.domain.model.Passage;
import me.golemcore.biblebot.domain.model.PassageResult;
import me.golemcore.biblebot.domain.model.ScriptureReference;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.infrastructure.http.FeignClientFactory;
import me.golemcore.biblebot.port.outbound.PassageProviderPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Licensed translations through API.Bible. Each configured translation code
 * maps to an API.Bible bible id; passages are addressed by USFM ids such as
 * {@code JHN.3.16-JHN.3.18}, so only known books can be fetched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiBiblePassageProvider implements PassageProviderPort {

    private static final String PROVIDER_NAME = "api-bible";
    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_BAD_REQUEST = 400;

    private final FeignClientFactory feignClientFactory;
    private final BotProperties properties;

    private ApiBibleApi api;
    private Map<String, String> bibleIds = Map.of();

    @PostConstruct
    public void init() {
        BotProperties.ProvidersProperties providers = properties.getProviders();
        Map<String, String> ids = new LinkedHashMap<>();
        providers.getApiBible().getBibles().forEach((code, id) -> ids.put(code.toLowerCase(Locale.ROOT), id));
        bibleIds = Map.copyOf(ids);
        api = feignClientFactory.create(ApiBibleApi.class, providers.getApiBible().getBaseUrl(),
                providers.getTimeout());
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public Set<String> getSupportedTranslations() {
        return bibleIds.keySet();
    }

    @Override
    public boolean isEnabled() {
        return properties.getProviders().getApiBible().isEnabled() && !bibleIds.isEmpty();
    }

    @Override
    public boolean isCredentialMissing() {
        String apiKey = properties.getProviders().getApiBible().getApiKey();
        return apiKey == null || apiKey.isBlank();
    }

    @Override
    public CompletableFuture<PassageResult> fetch(ScriptureReference reference) {
        return CompletableFuture.supplyAsync(() -> doFetch(reference));
    }

    /**
     * USFM passage id, e.g. {@code PSA.23}, {@code JHN.3.16} or
     * {@code JHN.3.16-JHN.3.18}.
     */
    static Optional<String> passageId(ScriptureReference reference) {
        return reference.knownBook().map(Book::getUsfmCode).map(code -> {
            String chapter = code + "." + reference.chapter();
            if (reference.isWholeChapter()) {
                return chapter;
            }
            String start = chapter + "." + reference.verseStart();
            return reference.verseEnd() != null
                    ? start + "-" + chapter + "." + reference.verseEnd()
                    : start;
        });
    }

    private PassageResult doFetch(ScriptureReference reference) {
        String bibleId = bibleIds.get(reference.translation());
        Optional<String> passageId = passageId(reference);
        if (bibleId == null || passageId.isEmpty()) {
            return PassageResult.notFound("API.Bible cannot address " + reference);
        }
        try {
            ApiBibleResponse response = api.passage(properties.getProviders().getApiBible().getApiKey(), bibleId,
                    passageId.get());
            PassageData data = response != null ? response.getData() : null;
            if (data == null || data.getContent() == null || data.getContent().isBlank()) {
                return PassageResult.notFound("API.Bible returned no content for " + passageId.get());
            }
            String canonical = data.getReference() != null && !data.getReference().isBlank()
                    ? data.getReference()
                    : reference.label();
            return PassageResult.found(new Passage(data.getContent().strip(), canonical));
        } catch (FeignException e) {
            if (e.status() == HTTP_NOT_FOUND || e.status() == HTTP_BAD_REQUEST) {
                return PassageResult.notFound("API.Bible " + e.status() + " for " + passageId.get());
            }
            log.warn("[ApiBible] API error (status {}) for {}", e.status(), passageId.get());
            return PassageResult.unavailable("API.Bible status " + e.status());
        } catch (RuntimeException e) { // NOSONAR - decoding and transport errors
            log.warn("[ApiBible] Request failed for {}: {}", passageId.get(), e.getMessage());
            return PassageResult.unavailable("API.Bible request failed: " + e.getClass().getSimpleName());
        }
    }

    interface ApiBibleApi {
        @RequestLine("GET /v1/bibles/{bibleId}/passages/{passageId}?content-type=text&include-notes=false"
                + "&include-titles=false&include-chapter-numbers=false&include-verse-numbers=false"
                + "&include-verse-spans=false")
        @Headers({
                "Accept: application/json",
                "api-key: {apiKey}"
        })
        ApiBibleResponse passage(
                @Param("apiKey") String apiKey,
                @Param("bibleId") String bibleId,
                @Param("passageId") String passageId);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ApiBibleResponse {
        private PassageData data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PassageData {
        private String id;
        private String reference;
        private String content;
    }
}
