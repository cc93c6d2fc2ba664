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
 * Terminal state of one inbound room message.
 */
public enum DispatchOutcome {

    /**
     * Unauthorized room, own message, or timestamp at or before the start
     * watermark.
     */
    FILTERED,

    /**
     * No reference grammar matched; ordinary chat.
     */
    NO_MATCH,

    /**
     * The provider returned text that was empty after formatting.
     */
    EMPTY_PASSAGE,

    /**
     * Reaction and reply were handed to the transport.
     */
    DELIVERED,

    /**
     * The lookup failed and one error message was handed to the transport.
     */
    ERRORED
}
