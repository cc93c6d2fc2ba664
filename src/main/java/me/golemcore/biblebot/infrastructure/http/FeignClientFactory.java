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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Factory for creating Feign HTTP clients with OkHttp transport and Jackson
 * JSON encoding.
 *
 * <p>
 * All clients share the OkHttp connection pool and the Jackson
 * {@link ObjectMapper}. Clients built with a timeout never retry on their own:
 * a failed call surfaces to the caller as a {@link feign.FeignException} or
 * {@link feign.RetryableException}.
 *
 * <pre>{@code
 * EsvApi client = factory.create(EsvApi.class, "https://api.esv.org", Duration.ofSeconds(10));
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a Feign client whose calls fail after {@code timeout} instead of
     * waiting for the shared client's read timeout.
     */
    public <T> T create(Class<T> apiType, String baseUrl, Duration timeout) {
        long millis = timeout.toMillis();
        return create(apiType, baseUrl, Feign.builder()
                .retryer(Retryer.NEVER_RETRY)
                .options(new Request.Options(millis, TimeUnit.MILLISECONDS, millis, TimeUnit.MILLISECONDS, true)));
    }

    /**
     * Create a Feign client with custom options.
     */
    public <T> T create(Class<T> apiType, String baseUrl, Feign.Builder builder) {
        return builder
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .target(apiType, baseUrl);
    }
}
