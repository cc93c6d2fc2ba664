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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.infrastructure.i18n.MessageService;
import me.golemcore.biblebot.port.outbound.PassageProviderPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration with shared infrastructure beans and startup logging.
 *
 * <p>
 * The bot itself is started by
 * {@link me.golemcore.biblebot.adapter.inbound.cli.BibleBotRunner} once the
 * context is ready, so that the {@code auth} sub-commands can run without
 * connecting to the homeserver.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final MessageService messageService;
    private final List<PassageProviderPort> providers;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("Matrix BibleBot v{} starting...", version());
        messageService.setLanguage(properties.getLanguage());

        BotProperties.BibleProperties bible = properties.getBible();
        log.info("Default translation: {}", bible.getDefaultTranslation());
        log.info("Passage cache: enabled={}, maxEntries={}, ttl={}",
                bible.getCache().isEnabled(), bible.getCache().getMaxEntries(), bible.getCache().getTtl());
        for (PassageProviderPort provider : providers) {
            log.info("Provider {}: translations={}, enabled={}",
                    provider.getProviderName(), provider.getSupportedTranslations(), provider.isEnabled());
        }
    }

    /**
     * Version from {@code META-INF/build-info.properties}, written by the
     * {@code build-info} goal of the Spring Boot Maven plugin.
     */
    String version() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        return buildProps != null && buildProps.getVersion() != null ? buildProps.getVersion() : "dev";
    }
}
