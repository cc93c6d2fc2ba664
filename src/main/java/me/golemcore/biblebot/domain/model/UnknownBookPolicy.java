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

import java.util.Optional;

/**
 * What the reference resolver does with a book name that is not in the
 * {@link Book} table.
 */
public enum UnknownBookPolicy {

    /**
     * Pass the name through title-cased ({@code "xyz"} becomes {@code "Xyz"}) and
     * let the provider decide whether it exists.
     */
    TITLE_CASE,

    /**
     * Treat the message as ordinary chat.
     */
    REJECT;

    public Optional<String> apply(String rawName) {
        if (this == REJECT || rawName == null || rawName.isBlank()) {
            return Optional.empty();
        }
        String cleaned = Book.clean(rawName);
        StringBuilder result = new StringBuilder(cleaned.length());
        boolean startOfWord = true;
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (Character.isLetter(c)) {
                result.append(startOfWord ? Character.toUpperCase(c) : c);
                startOfWord = false;
            } else {
                result.append(c);
                startOfWord = true;
            }
        }
        return Optional.of(result.toString());
    }
}
