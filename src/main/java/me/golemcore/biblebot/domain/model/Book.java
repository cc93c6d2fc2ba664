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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The 66 books of the Protestant canon with their display names, USFM codes
 * and the abbreviations people actually type.
 *
 * <p>
 * Lookups go through {@link #lookup(String)}, which accepts the canonical name,
 * the USFM code, any alias, and the same with spaces removed (so {@code 1cor}
 * and {@code 1 cor} both resolve). Input is cleaned first: lowercased, dots
 * dropped and whitespace collapsed.
 */
public enum Book {

    GENESIS("Genesis", "GEN", "gen", "ge", "gn"),
    EXODUS("Exodus", "EXO", "ex", "exod", "exo"),
    LEVITICUS("Leviticus", "LEV", "lev", "le", "lv"),
    NUMBERS("Numbers", "NUM", "num", "nu", "nm", "nb"),
    DEUTERONOMY("Deuteronomy", "DEU", "deut", "de", "dt"),
    JOSHUA("Joshua", "JOS", "josh", "jos", "jsh"),
    JUDGES("Judges", "JDG", "judg", "jdg", "jg", "jdgs"),
    RUTH("Ruth", "RUT", "rth", "ru"),
    FIRST_SAMUEL("1 Samuel", "1SA", "1 sam", "1 sa", "1 sm", "i samuel", "first samuel"),
    SECOND_SAMUEL("2 Samuel", "2SA", "2 sam", "2 sa", "2 sm", "ii samuel", "second samuel"),
    FIRST_KINGS("1 Kings", "1KI", "1 kgs", "1 ki", "1 kin", "i kings", "first kings"),
    SECOND_KINGS("2 Kings", "2KI", "2 kgs", "2 ki", "2 kin", "ii kings", "second kings"),
    FIRST_CHRONICLES("1 Chronicles", "1CH", "1 chron", "1 chr", "1 ch", "i chronicles", "first chronicles"),
    SECOND_CHRONICLES("2 Chronicles", "2CH", "2 chron", "2 chr", "2 ch", "ii chronicles", "second chronicles"),
    EZRA("Ezra", "EZR", "ezr", "ez"),
    NEHEMIAH("Nehemiah", "NEH", "neh", "ne"),
    ESTHER("Esther", "EST", "esth", "es"),
    JOB("Job", "JOB", "jb"),
    PSALMS("Psalms", "PSA", "ps", "psa", "psalm", "pslm", "psm", "pss"),
    PROVERBS("Proverbs", "PRO", "prov", "pro", "prv", "pr"),
    ECCLESIASTES("Ecclesiastes", "ECC", "eccles", "eccle", "ecc", "ec", "qoh"),
    SONG_OF_SOLOMON("Song of Solomon", "SNG", "song", "song of songs", "sos", "so", "canticles"),
    ISAIAH("Isaiah", "ISA", "isa", "is"),
    JEREMIAH("Jeremiah", "JER", "jer", "je", "jr"),
    LAMENTATIONS("Lamentations", "LAM", "lam", "la"),
    EZEKIEL("Ezekiel", "EZK", "ezek", "eze", "ezk"),
    DANIEL("Daniel", "DAN", "dan", "da", "dn"),
    HOSEA("Hosea", "HOS", "hos", "ho"),
    JOEL("Joel", "JOL", "jl"),
    AMOS("Amos", "AMO", "am"),
    OBADIAH("Obadiah", "OBA", "obad", "ob"),
    JONAH("Jonah", "JON", "jnh", "jon"),
    MICAH("Micah", "MIC", "mic", "mc"),
    NAHUM("Nahum", "NAM", "nah", "na"),
    HABAKKUK("Habakkuk", "HAB", "hab", "hb"),
    ZEPHANIAH("Zephaniah", "ZEP", "zeph", "zep", "zp"),
    HAGGAI("Haggai", "HAG", "hag", "hg"),
    ZECHARIAH("Zechariah", "ZEC", "zech", "zec", "zc"),
    MALACHI("Malachi", "MAL", "mal", "ml"),
    MATTHEW("Matthew", "MAT", "matt", "mt"),
    MARK("Mark", "MRK", "mrk", "mar", "mk", "mr"),
    LUKE("Luke", "LUK", "luk", "lk"),
    JOHN("John", "JHN", "joh", "jhn", "jn"),
    ACTS("Acts", "ACT", "act", "ac"),
    ROMANS("Romans", "ROM", "rom", "ro", "rm"),
    FIRST_CORINTHIANS("1 Corinthians", "1CO", "1 cor", "1 co", "i corinthians", "first corinthians"),
    SECOND_CORINTHIANS("2 Corinthians", "2CO", "2 cor", "2 co", "ii corinthians", "second corinthians"),
    GALATIANS("Galatians", "GAL", "gal", "ga"),
    EPHESIANS("Ephesians", "EPH", "eph", "ephes"),
    PHILIPPIANS("Philippians", "PHP", "phil", "php", "pp"),
    COLOSSIANS("Colossians", "COL", "col", "co"),
    FIRST_THESSALONIANS("1 Thessalonians", "1TH", "1 thess", "1 thes", "1 th", "i thessalonians",
            "first thessalonians"),
    SECOND_THESSALONIANS("2 Thessalonians", "2TH", "2 thess", "2 thes", "2 th", "ii thessalonians",
            "second thessalonians"),
    FIRST_TIMOTHY("1 Timothy", "1TI", "1 tim", "1 ti", "i timothy", "first timothy"),
    SECOND_TIMOTHY("2 Timothy", "2TI", "2 tim", "2 ti", "ii timothy", "second timothy"),
    TITUS("Titus", "TIT", "tit", "ti"),
    PHILEMON("Philemon", "PHM", "philem", "phm", "pm"),
    HEBREWS("Hebrews", "HEB", "heb"),
    JAMES("James", "JAS", "jas", "jm"),
    FIRST_PETER("1 Peter", "1PE", "1 pet", "1 pe", "1 pt", "i peter", "first peter"),
    SECOND_PETER("2 Peter", "2PE", "2 pet", "2 pe", "2 pt", "ii peter", "second peter"),
    FIRST_JOHN("1 John", "1JN", "1 jn", "1 jhn", "1 joh", "i john", "first john"),
    SECOND_JOHN("2 John", "2JN", "2 jn", "2 jhn", "2 joh", "ii john", "second john"),
    THIRD_JOHN("3 John", "3JN", "3 jn", "3 jhn", "3 joh", "iii john", "third john"),
    JUDE("Jude", "JUD", "jud", "jd"),
    REVELATION("Revelation", "REV", "rev", "re", "revelations", "the revelation");

    private static final Map<String, Book> BY_NAME = new HashMap<>();

    static {
        for (Book book : values()) {
            register(book.displayName, book);
            register(book.usfmCode, book);
            for (String alias : book.aliases) {
                register(alias, book);
            }
        }
    }

    private final String displayName;
    private final String usfmCode;
    private final String[] aliases;

    Book(String displayName, String usfmCode, String... aliases) {
        this.displayName = displayName;
        this.usfmCode = usfmCode;
        this.aliases = aliases;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Three-character USFM book code, as used by API.Bible passage ids.
     */
    public String getUsfmCode() {
        return usfmCode;
    }

    public static Optional<Book> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String cleaned = clean(name);
        Book book = BY_NAME.get(cleaned);
        if (book == null) {
            book = BY_NAME.get(cleaned.replace(" ", ""));
        }
        return Optional.ofNullable(book);
    }

    /**
     * Lowercases, drops dots and collapses whitespace.
     */
    public static String clean(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replace(".", "")
                .trim()
                .replaceAll("\\s+", " ");
    }

    private static void register(String name, Book book) {
        String key = clean(name);
        BY_NAME.putIfAbsent(key, book);
        BY_NAME.putIfAbsent(key.replace(" ", ""), book);
    }
}
