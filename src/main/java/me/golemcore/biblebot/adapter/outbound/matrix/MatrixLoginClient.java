package me.golemcore.biblebot.adapter.outbound.matrix;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.model.Credentials;
import me.golemcore.biblebot.port.outbound.MatrixAuthPort;
import okhttp3.HttpUrl;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;

/**
 * Password login, logout and server discovery against the Matrix
 * client-server API.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MatrixLoginClient implements MatrixAuthPort {

    private static final String HTTPS = "https://";

    private final MatrixRestClient restClient;

    @Override
    public String discoverHomeserver(String serverNameOrUrl) {
        String candidate = normalize(serverNameOrUrl);
        HttpUrl url = HttpUrl.parse(candidate);
        if (url == null) {
            throw new IllegalArgumentException("Invalid homeserver: " + serverNameOrUrl);
        }
        HttpUrl wellKnown = url.newBuilder()
                .encodedPath("/.well-known/matrix/client")
                .build();
        try {
            JsonNode response = restClient.get(wellKnown, null);
            String baseUrl = response.path("m.homeserver").path("base_url").asText("");
            if (!baseUrl.isBlank()) {
                String discovered = stripTrailingSlash(baseUrl);
                log.info("[Auth] Discovered homeserver {} for {}", discovered, serverNameOrUrl);
                return discovered;
            }
        } catch (IOException | MatrixApiException e) {
            log.debug("[Auth] Server discovery failed for {}: {}", candidate, e.getMessage());
        }
        return candidate;
    }

    @Override
    public Credentials login(String homeserver, String user, String password, String deviceName) {
        HttpUrl url = restClient.endpoint(homeserver, "login").build();
        Map<String, Object> body = Map.of(
                "type", "m.login.password",
                "identifier", Map.of("type", "m.id.user", "user", user),
                "password", password,
                "initial_device_display_name", deviceName);
        try {
            JsonNode response = restClient.post(url, null, body);
            return new Credentials(
                    homeserver,
                    response.path("user_id").asText(null),
                    response.path("access_token").asText(null),
                    response.path("device_id").asText(null));
        } catch (IOException e) {
            throw new UncheckedIOException("Login request to " + homeserver + " failed", e);
        }
    }

    @Override
    public void logout(Credentials credentials) {
        HttpUrl url = restClient.endpoint(credentials.homeserver(), "logout").build();
        try {
            restClient.post(url, credentials.accessToken(), Map.of());
        } catch (IOException e) {
            throw new UncheckedIOException("Logout request to " + credentials.homeserver() + " failed", e);
        }
    }

    @Override
    public String whoami(String homeserver, String accessToken) {
        HttpUrl url = restClient.endpoint(homeserver, "account", "whoami").build();
        try {
            String userId = restClient.get(url, accessToken).path("user_id").asText("");
            if (userId.isBlank()) {
                throw new IllegalStateException("whoami returned no user_id");
            }
            return userId;
        } catch (IOException e) {
            throw new UncheckedIOException("whoami request to " + homeserver + " failed", e);
        }
    }

    private static String normalize(String serverNameOrUrl) {
        String value = serverNameOrUrl == null ? "" : serverNameOrUrl.strip();
        String lower = value.toLowerCase(Locale.ROOT);
        if (!lower.startsWith(HTTPS) && !lower.startsWith("http://")) {
            value = HTTPS + value;
        }
        return stripTrailingSlash(value);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
