package me.golemcore.biblebot.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.model.Book;
import me.golemcore.biblebot.domain.model.ScriptureReference;
import me.golemcore.biblebot.domain.model.UnknownBookPolicy;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds a scripture reference in a message body.
 *
 * <p>
 * Grammars, tried in order, first match wins:
 * <ol>
 * <li>command prefix ({@code !bible John 3:16}) followed by either of the next
 * two grammars</li>
 * <li>{@code Book C:V[-V] [translation]}</li>
 * <li>{@code Book C [translation]}, known books only</li>
 * </ol>
 * By default the whole (trimmed) body must match, so references inside a
 * sentence are ignored. With {@code detect-references-anywhere} the verse
 * grammar is searched at every word start instead, and only known books are
 * accepted.
 *
 * <p>
 * Matching is case-insensitive. Chapter and verse numbers have at most three
 * digits and must be positive; ranges must not run backwards. Anything else is
 * a non-match, never an error.
 */
@Component
@Slf4j
public class ReferenceResolver {

    static final int MAX_BODY_LENGTH = 1024;

    private static final String BOOK = "([\\p{L}\\p{N}][\\p{L}\\p{N}\\s.]*?)";
    private static final String BOOK_IN_TEXT = "((?:[1-3]\\s?)?\\p{L}[\\p{L}.]*(?:\\s+\\p{L}[\\p{L}.]*){0,2}?)";
    private static final String NUMBER = "(\\d{1,3})";
    private static final String RANGE = "(?:\\s*[-\\u2013]\\s*" + NUMBER + ")?";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final String defaultTranslation;
    private final UnknownBookPolicy unknownBookPolicy;
    private final boolean detectAnywhere;
    private final Pattern commandPattern;
    private final Pattern versePattern;
    private final Pattern chapterPattern;
    private final Pattern inTextPattern;

    public ReferenceResolver(BotProperties properties, PassageGateway gateway) {
        BotProperties.BibleProperties bible = properties.getBible();
        this.defaultTranslation = bible.getDefaultTranslation().toLowerCase(Locale.ROOT);
        this.unknownBookPolicy = bible.getUnknownBookPolicy() != null
                ? bible.getUnknownBookPolicy()
                : UnknownBookPolicy.TITLE_CASE;
        this.detectAnywhere = bible.isDetectReferencesAnywhere();

        Set<String> translations = new LinkedHashSet<>(gateway.getSupportedTranslations());
        translations.add(defaultTranslation);
        String tokens = translations.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|", "(", ")"));

        String prefix = bible.getCommandPrefix();
        this.commandPattern = prefix == null || prefix.isBlank()
                ? null
                : Pattern.compile("^" + Pattern.quote(prefix.strip()) + "\\s+(.+)$", FLAGS | Pattern.DOTALL);
        this.versePattern = Pattern.compile(
                "^" + BOOK + "\\s+" + NUMBER + ":" + NUMBER + RANGE + "(?:\\s*" + tokens + ")?$", FLAGS);
        this.chapterPattern = Pattern.compile(
                "^" + BOOK + "\\s+" + NUMBER + "(?:\\s*" + tokens + ")?$", FLAGS);
        this.inTextPattern = Pattern.compile(
                BOOK_IN_TEXT + "\\s+" + NUMBER + ":" + NUMBER + RANGE + "(?:\\s+" + tokens + ")?"
                        + "(?![\\p{L}\\p{N}:])",
                FLAGS);
        log.debug("[Resolver] translations={}, anywhere={}, unknownBooks={}",
                translations, detectAnywhere, unknownBookPolicy);
    }

    public Optional<ScriptureReference> parse(String body) {
        if (body == null || body.isBlank() || body.length() > MAX_BODY_LENGTH) {
            return Optional.empty();
        }
        String text = body.strip();

        if (commandPattern != null) {
            Matcher command = commandPattern.matcher(text);
            if (command.matches()) {
                return parseWhole(command.group(1).strip());
            }
        }
        return detectAnywhere ? parseInText(text) : parseWhole(text);
    }

    /**
     * Canonical display name for a book name or abbreviation, subject to the
     * unknown book policy.
     */
    public Optional<String> normalizeBook(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Book.lookup(name)
                .map(Book::getDisplayName)
                .or(() -> unknownBookPolicy.apply(name));
    }

    public String getDefaultTranslation() {
        return defaultTranslation;
    }

    private Optional<ScriptureReference> parseWhole(String text) {
        Matcher verse = versePattern.matcher(text);
        if (verse.matches()) {
            return build(verse.group(1), verse.group(2), verse.group(3), verse.group(4), verse.group(5), false);
        }
        Matcher chapter = chapterPattern.matcher(text);
        if (chapter.matches()) {
            return build(chapter.group(1), chapter.group(2), null, null, chapter.group(3), true);
        }
        return Optional.empty();
    }

    private Optional<ScriptureReference> parseInText(String text) {
        Matcher matcher = inTextPattern.matcher(text);
        for (int start = 0; start < text.length(); start++) {
            if (!isWordStart(text, start)) {
                continue;
            }
            matcher.region(start, text.length());
            if (matcher.lookingAt()) {
                Optional<ScriptureReference> reference = build(matcher.group(1), matcher.group(2),
                        matcher.group(3), matcher.group(4), matcher.group(5), true);
                if (reference.isPresent()) {
                    return reference;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<ScriptureReference> build(String rawBook, String chapter, String verseStart,
            String verseEnd, String translationToken, boolean knownBooksOnly) {
        String bookName = rawBook.strip();
        if (bookName.chars().noneMatch(Character::isLetter)) {
            return Optional.empty();
        }

        Optional<Book> known = Book.lookup(bookName);
        String display;
        if (known.isPresent()) {
            display = known.get().getDisplayName();
        } else if (knownBooksOnly) {
            return Optional.empty();
        } else {
            Optional<String> lenient = unknownBookPolicy.apply(bookName);
            if (lenient.isEmpty()) {
                return Optional.empty();
            }
            display = lenient.get();
        }

        int chapterNumber = Integer.parseInt(chapter);
        Integer start = verseStart != null ? Integer.valueOf(verseStart) : null;
        Integer end = verseEnd != null ? Integer.valueOf(verseEnd) : null;
        if (chapterNumber < 1 || (start != null && start < 1) || (end != null && end < start)) {
            return Optional.empty();
        }

        String translation = translationToken != null
                ? translationToken.toLowerCase(Locale.ROOT)
                : defaultTranslation;
        return Optional.of(new ScriptureReference(display, known.orElse(null), chapterNumber, start,
                end != null && end.equals(start) ? null : end, translation));
    }

    private static boolean isWordStart(String text, int index) {
        if (!Character.isLetterOrDigit(text.charAt(index))) {
            return false;
        }
        return index == 0 || !Character.isLetterOrDigit(text.charAt(index - 1));
    }
}
