package me.golemcore.biblebot.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for OkHttp client with connection pooling and timeouts.
 *
 * <p>
 * Creates a shared {@link OkHttpClient} bean configured from
 * {@link BotProperties}:
 * <ul>
 * <li>Connect timeout - time to establish connection</li>
 * <li>Read timeout - must exceed the Matrix sync long-poll timeout</li>
 * <li>Write timeout - time to send data</li>
 * <li>Connection pool - maintains idle connections for reuse</li>
 * <li>User-Agent - every request identifies the bot</li>
 * </ul>
 *
 * <p>
 * This client is used by Feign clients, the passage providers and the Matrix
 * adapters. Components that need a tighter deadline derive a client with
 * {@link OkHttpClient#newBuilder()}.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private static final String USER_AGENT_HEADER = "User-Agent";

    private final BotProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        BotProperties.HttpProperties http = properties.getHttp();
        String userAgent = properties.getProviders().getUserAgent();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                        .header(USER_AGENT_HEADER, userAgent)
                        .build()))
                .retryOnConnectionFailure(true)
                .build();
    }
}
