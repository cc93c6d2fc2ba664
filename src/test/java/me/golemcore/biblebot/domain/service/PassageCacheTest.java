package me.golemcore.biblebot.domain.service;

import me.golemcore.biblebot.domain.model.Passage;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PassageCacheTest {

    private static final Passage JOHN = new Passage("For God so loved the world", "John 3:16");

    private BotProperties properties;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getBible().getCache().setTtl(Duration.ofMinutes(10));
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void shouldReturnStoredPassageIgnoringCase() {
        PassageCache cache = new PassageCache(properties, clock);
        cache.put("John 3:16", "KJV", JOHN);

        Optional<Passage> hit = cache.get("john 3:16", "kjv");

        assertTrue(hit.isPresent());
        assertEquals(JOHN, hit.get());
    }

    @Test
    void shouldKeepTranslationsApart() {
        PassageCache cache = new PassageCache(properties, clock);
        cache.put("John 3:16", "kjv", JOHN);

        assertTrue(cache.get("John 3:16", "esv").isEmpty());
    }

    @Test
    void shouldExpireEntryExactlyAtTtl() {
        PassageCache cache = new PassageCache(properties, clock);
        cache.put("John 3:16", "kjv", JOHN);

        clock.advance(Duration.ofMinutes(10).minusMillis(1));
        assertTrue(cache.get("John 3:16", "kjv").isPresent());

        clock.advance(Duration.ofMinutes(10));
        assertTrue(cache.get("John 3:16", "kjv").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldRefreshTimestampOnHit() {
        PassageCache cache = new PassageCache(properties, clock);
        cache.put("John 3:16", "kjv", JOHN);

        clock.advance(Duration.ofMinutes(8));
        assertTrue(cache.get("John 3:16", "kjv").isPresent());
        clock.advance(Duration.ofMinutes(8));

        assertTrue(cache.get("John 3:16", "kjv").isPresent());
    }

    @Test
    void shouldEvictLeastRecentlyUsed() {
        properties.getBible().getCache().setMaxEntries(2);
        PassageCache cache = new PassageCache(properties, clock);
        cache.put("Genesis 1:1", "kjv", new Passage("In the beginning", "Genesis 1:1"));
        cache.put("John 3:16", "kjv", JOHN);

        cache.get("Genesis 1:1", "kjv");
        cache.put("Psalms 23:1", "kjv", new Passage("The LORD is my shepherd", "Psalms 23:1"));

        assertEquals(2, cache.size());
        assertTrue(cache.get("Genesis 1:1", "kjv").isPresent());
        assertTrue(cache.get("John 3:16", "kjv").isEmpty());
    }

    @Test
    void shouldIgnorePutsWhenDisabled() {
        properties.getBible().getCache().setEnabled(false);
        PassageCache cache = new PassageCache(properties, clock);

        cache.put("John 3:16", "kjv", JOHN);

        assertFalse(cache.isEnabled());
        assertEquals(0, cache.size());
        assertTrue(cache.get("John 3:16", "kjv").isEmpty());
    }
}
