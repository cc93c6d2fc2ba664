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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.model.Passage;
import me.golemcore.biblebot.domain.model.PassageResult;
import me.golemcore.biblebot.domain.model.ScriptureReference;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.port.outbound.PassageProviderPort;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Public-domain translations from bible-api.com
 * ({@code GET /{reference}?translation=kjv}). No API key.
 *
 * <p>
 * The reference goes into the path as one segment; OkHttp leaves {@code :}
 * unencoded, which the service requires. A 404 or a response without text
 * means the reference does not exist.
 */
@Component
@Slf4j
public class BibleApiPassageProvider implements PassageProviderPort {

    private static final String PROVIDER_NAME = "bible-api";
    private static final int HTTP_NOT_FOUND = 404;

    private final BotProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;
    private final Set<String> translations;

    public BibleApiPassageProvider(BotProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(properties.getProviders().getTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .build();
        Set<String> codes = new LinkedHashSet<>();
        for (String code : properties.getProviders().getBibleApi().getTranslations()) {
            codes.add(code.toLowerCase(Locale.ROOT));
        }
        this.translations = Set.copyOf(codes);
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public Set<String> getSupportedTranslations() {
        return translations;
    }

    @Override
    public boolean isEnabled() {
        return properties.getProviders().getBibleApi().isEnabled();
    }

    @Override
    public boolean isCredentialMissing() {
        return false;
    }

    @Override
    public CompletableFuture<PassageResult> fetch(ScriptureReference reference) {
        return CompletableFuture.supplyAsync(() -> doFetch(reference));
    }

    private PassageResult doFetch(ScriptureReference reference) {
        String query = reference.label();
        HttpUrl baseUrl = HttpUrl.parse(properties.getProviders().getBibleApi().getBaseUrl());
        if (baseUrl == null) {
            return PassageResult.unavailable("Invalid bible-api base URL");
        }
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment(query)
                .addQueryParameter("translation", reference.translation())
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == HTTP_NOT_FOUND) {
                return PassageResult.notFound("bible-api 404 for " + query);
            }
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                log.warn("[BibleApi] HTTP {} for {}", response.code(), query);
                return PassageResult.unavailable("bible-api status " + response.code());
            }
            return parse(body.string(), query);
        } catch (IOException e) {
            log.warn("[BibleApi] Request failed for {}: {}", query, e.getMessage());
            return PassageResult.unavailable("bible-api request failed: " + e.getClass().getSimpleName());
        }
    }

    private PassageResult parse(String json, String query) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        String text = root.path("text").asText("");
        if (text.isBlank()) {
            return PassageResult.notFound("bible-api returned no text for " + query);
        }
        String canonical = root.path("reference").asText("");
        return PassageResult.found(new Passage(text.strip(), canonical.isBlank() ? query : canonical));
    }
}
