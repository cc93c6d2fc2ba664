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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Thin JSON client for the Matrix client-server API (v3).
 *
 * <p>
 * Every call returns the parsed response body or throws
 * {@link MatrixApiException} carrying the HTTP status, {@code errcode} and
 * {@code retry_after_ms}. I/O failures propagate as {@link IOException}.
 */
@Component
@Slf4j
public class MatrixRestClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String CLIENT_API_PREFIX = "_matrix/client/v3";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public MatrixRestClient(OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Client with a longer read timeout, for {@code /sync} long polls.
     */
    public MatrixRestClient withReadTimeout(long readTimeoutMs) {
        return new MatrixRestClient(httpClient.newBuilder()
                .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
                .build(), objectMapper);
    }

    /**
     * {@code <homeserver>/_matrix/client/v3/<segments...>}, each segment
     * percent-encoded.
     */
    public HttpUrl.Builder endpoint(String homeserver, String... segments) {
        HttpUrl base = HttpUrl.parse(homeserver);
        if (base == null) {
            throw new IllegalArgumentException("Invalid homeserver URL: " + homeserver);
        }
        HttpUrl.Builder builder = base.newBuilder().addPathSegments(CLIENT_API_PREFIX);
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    public JsonNode get(HttpUrl url, String accessToken) throws IOException {
        return execute(request(url, accessToken).get().build());
    }

    public JsonNode post(HttpUrl url, String accessToken, Object body) throws IOException {
        return execute(request(url, accessToken).post(jsonBody(body)).build());
    }

    public JsonNode put(HttpUrl url, String accessToken, Object body) throws IOException {
        return execute(request(url, accessToken).put(jsonBody(body)).build());
    }

    private Request.Builder request(HttpUrl url, String accessToken) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", "application/json");
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        return builder;
    }

    private RequestBody jsonBody(Object body) throws IOException {
        return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
    }

    private JsonNode execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            JsonNode json = text.isBlank() ? MissingNode.getInstance() : readJson(text);
            if (!response.isSuccessful()) {
                String errcode = json.path("errcode").isTextual() ? json.path("errcode").asText() : null;
                String error = json.path("error").isTextual() ? json.path("error").asText() : response.message();
                Long retryAfter = json.path("retry_after_ms").canConvertToLong()
                        ? json.path("retry_after_ms").asLong()
                        : null;
                log.debug("[Matrix] {} {} -> {} {}", request.method(), request.url().encodedPath(),
                        response.code(), errcode);
                throw new MatrixApiException(response.code(), errcode, error, retryAfter);
            }
            return json;
        }
    }

    private JsonNode readJson(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (IOException e) {
            log.debug("[Matrix] Non-JSON response body: {}", e.getMessage());
            return MissingNode.getInstance();
        }
    }
}
