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

/**
 * Why a passage lookup produced no text.
 */
public enum PassageFailureKind {

    /**
     * The provider was reached but does not know the reference, or no provider
     * serves the requested translation.
     */
    NOT_FOUND,

    /**
     * The provider needs an API key that is not configured.
     */
    CREDENTIAL_MISSING,

    /**
     * Network error, timeout or non-2xx response.
     */
    UNAVAILABLE
}
