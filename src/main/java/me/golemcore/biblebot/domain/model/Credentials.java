package me.golemcore.biblebot.domain.model;

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
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Long-lived Matrix session: homeserver, user, access token and optional
 * device id. Serialized with snake_case keys.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Credentials(
        @JsonProperty("homeserver") String homeserver,
        @JsonProperty("user_id") String userId,
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("device_id") String deviceId) {

    public Credentials {
        if (homeserver == null || homeserver.isBlank()) {
            throw new IllegalArgumentException("homeserver must not be blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("user_id must not be blank");
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("access_token must not be blank");
        }
        homeserver = homeserver.endsWith("/") ? homeserver.substring(0, homeserver.length() - 1) : homeserver;
    }

    @Override
    public String toString() {
        return "Credentials[homeserver=" + homeserver + ", userId=" + userId + ", deviceId=" + deviceId
                + ", accessToken=***]";
    }
}
