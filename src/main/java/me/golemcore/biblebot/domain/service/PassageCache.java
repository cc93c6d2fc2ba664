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
import me.golemcore.biblebot.domain.model.Passage;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded LRU cache of resolved passages keyed by (reference, translation),
 * case-insensitively.
 *
 * <p>
 * Entries older than the configured TTL are dropped lazily when they are read.
 * A hit refreshes both the recency and the timestamp of the entry. When the
 * cache is disabled {@link #put} does nothing, so every lookup misses.
 *
 * <p>
 * Not thread-safe: all access happens on the dispatch loop thread.
 */
@Component
@Slf4j
public class PassageCache {

    private final Clock clock;
    private final boolean enabled;
    private final int maxEntries;
    private final long ttlMillis;
    private final Map<String, CacheEntry> entries;

    public PassageCache(BotProperties properties, Clock clock) {
        BotProperties.CacheProperties cache = properties.getBible().getCache();
        this.clock = clock;
        this.enabled = cache.isEnabled();
        this.maxEntries = Math.max(1, cache.getMaxEntries());
        Duration ttl = cache.getTtl();
        this.ttlMillis = ttl != null ? ttl.toMillis() : Long.MAX_VALUE;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                return size() > PassageCache.this.maxEntries;
            }
        };
    }

    public Optional<Passage> get(String reference, String translation) {
        if (!enabled) {
            return Optional.empty();
        }
        String key = key(reference, translation);
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        long now = clock.millis();
        if (now - entry.insertedAt() >= ttlMillis) {
            entries.remove(key);
            log.debug("[Cache] Expired: {}", key);
            return Optional.empty();
        }
        entries.put(key, new CacheEntry(entry.passage(), now));
        return Optional.of(entry.passage());
    }

    public void put(String reference, String translation, Passage passage) {
        if (!enabled) {
            return;
        }
        entries.put(key(reference, translation), new CacheEntry(passage, clock.millis()));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int size() {
        return entries.size();
    }

    static String key(String reference, String translation) {
        String ref = reference == null ? "" : reference.trim().toLowerCase(Locale.ROOT);
        String tr = translation == null ? "" : translation.trim().toLowerCase(Locale.ROOT);
        return ref + "|" + tr;
    }

    private record CacheEntry(Passage passage, long insertedAt) {
    }
}
