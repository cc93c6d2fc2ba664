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
 * What happened to an undecryptable event.
 */
public enum KeyRequestOutcome {

    /** Requested through the channel's key request path. */
    REQUESTED,

    /** The primary path reported a duplicate, so a raw to-device request was sent. */
    REQUESTED_VIA_TO_DEVICE,

    /** E2EE disabled, already handled, or no session info. */
    SKIPPED,

    FAILED
}
