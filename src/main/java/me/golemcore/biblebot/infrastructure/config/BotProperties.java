package me.golemcore.biblebot.infrastructure.config;

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

import lombok.Data;
import me.golemcore.biblebot.domain.model.UnknownBookPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the bot, bound from
 * application.yml.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix. This class
 * contains nested property classes for different subsystems:
 * <ul>
 * <li>{@link MatrixProperties} - homeserver, rooms, sync and E2EE flags</li>
 * <li>{@link CredentialsProperties} - location of the saved session</li>
 * <li>{@link BibleProperties} - reference detection, cache and replies</li>
 * <li>{@link ProvidersProperties} - passage providers and their keys</li>
 * <li>{@link HttpProperties} - shared HTTP client settings</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private String language = "en";
    private MatrixProperties matrix = new MatrixProperties();
    private CredentialsProperties credentials = new CredentialsProperties();
    private BibleProperties bible = new BibleProperties();
    private ProvidersProperties providers = new ProvidersProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== MATRIX ====================

    @Data
    public static class MatrixProperties {
        private boolean autoStart = true;
        private String homeserver;
        private String userId;
        /**
         * Legacy access token, used only when no saved credentials exist.
         */
        private String accessToken;
        private String deviceName = "biblebot";
        private List<String> rooms = new ArrayList<>();
        private long syncTimeout = 30000;
        private long syncErrorBackoff = 5000;
        private E2eeProperties e2ee = new E2eeProperties();
        private RateLimitProperties rateLimit = new RateLimitProperties();
    }

    @Data
    public static class E2eeProperties {
        private boolean enabled = false;
        private int handledEventMemory = 1024;
    }

    @Data
    public static class RateLimitProperties {
        private int maxRetries = 3;
        private long defaultRetryAfter = 1000;
        private double jitter = 0.2;
    }

    @Data
    public static class CredentialsProperties {
        private String directory = "${user.home}/.config/matrix-biblebot";
        private String fileName = "credentials.json";
        private String storeDirectory = "e2ee-store";
    }

    // ==================== BIBLE ====================

    @Data
    public static class BibleProperties {
        private String defaultTranslation = "kjv";
        private String commandPrefix = "!bible";
        private boolean detectReferencesAnywhere = false;
        private UnknownBookPolicy unknownBookPolicy = UnknownBookPolicy.TITLE_CASE;
        private CacheProperties cache = new CacheProperties();
        private ReplyProperties reply = new ReplyProperties();
    }

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private int maxEntries = 128;
        private Duration ttl = Duration.ofHours(12);
    }

    @Data
    public static class ReplyProperties {
        private int maxMessageLength = 2000;
        /**
         * Split long passages into several messages of at most this many
         * characters. Zero disables splitting.
         */
        private int splitMessageLength = 0;
        private boolean preservePoetryFormatting = false;
        private String reaction = "✅";
        private String suffix = " 🕊️✝️";
    }

    // ==================== PROVIDERS ====================

    @Data
    public static class ProvidersProperties {
        private Duration timeout = Duration.ofSeconds(10);
        private String userAgent = "matrix-biblebot";
        private EsvProperties esv = new EsvProperties();
        private BibleApiProperties bibleApi = new BibleApiProperties();
        private ApiBibleProperties apiBible = new ApiBibleProperties();
    }

    @Data
    public static class EsvProperties {
        private boolean enabled = true;
        private String baseUrl = "https://api.esv.org";
        private String apiKey;
    }

    @Data
    public static class BibleApiProperties {
        private boolean enabled = true;
        private String baseUrl = "https://bible-api.com";
        private List<String> translations = new ArrayList<>(List.of("kjv", "web", "asv", "bbe", "darby", "ylt"));
    }

    @Data
    public static class ApiBibleProperties {
        private boolean enabled = false;
        private String baseUrl = "https://api.scripture.api.bible";
        private String apiKey;
        /**
         * Translation code to API.Bible bible id.
         */
        private Map<String, String> bibles = new LinkedHashMap<>();
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
