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

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed scripture locator: book, chapter, optional verse or verse range, and
 * the translation it should be fetched in.
 *
 * @param book
 *            display name sent to providers, e.g. {@code "1 Corinthians"}
 * @param canonicalBook
 *            the matching {@link Book}, or {@code null} when the name was
 *            accepted by {@link UnknownBookPolicy#TITLE_CASE}
 * @param chapter
 *            chapter number, at least 1
 * @param verseStart
 *            first verse, or {@code null} for a whole chapter
 * @param verseEnd
 *            last verse of a range, or {@code null}
 * @param translation
 *            lowercase translation code
 */
public record ScriptureReference(String book, Book canonicalBook, int chapter, Integer verseStart,
        Integer verseEnd, String translation) {

    public ScriptureReference {
        if (book == null || book.isBlank()) {
            throw new IllegalArgumentException("book must not be blank");
        }
        if (chapter < 1) {
            throw new IllegalArgumentException("chapter must be positive: " + chapter);
        }
        if (verseStart != null && verseStart < 1) {
            throw new IllegalArgumentException("verse must be positive: " + verseStart);
        }
        if (verseEnd != null && (verseStart == null || verseEnd < verseStart)) {
            throw new IllegalArgumentException("invalid verse range: " + verseStart + "-" + verseEnd);
        }
        Objects.requireNonNull(translation, "translation");
        translation = translation.toLowerCase(Locale.ROOT);
    }

    public Optional<Book> knownBook() {
        return Optional.ofNullable(canonicalBook);
    }

    public boolean isWholeChapter() {
        return verseStart == null;
    }

    /**
     * Human readable locator without the translation, e.g. {@code John 3:16-18}.
     */
    public String label() {
        StringBuilder sb = new StringBuilder(book).append(' ').append(chapter);
        if (verseStart != null) {
            sb.append(':').append(verseStart);
            if (verseEnd != null && !verseEnd.equals(verseStart)) {
                sb.append('-').append(verseEnd);
            }
        }
        return sb.toString();
    }

    public ScriptureReference withTranslation(String otherTranslation) {
        return new ScriptureReference(book, canonicalBook, chapter, verseStart, verseEnd, otherTranslation);
    }

    @Override
    public String toString() {
        return label() + " (" + translation + ")";
    }
}
