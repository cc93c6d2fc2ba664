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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.biblebot.domain.loop.DispatchLoop;
import me.golemcore.biblebot.domain.model.Passage;
import me.golemcore.biblebot.domain.model.PassageResult;
import me.golemcore.biblebot.domain.model.ScriptureReference;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Cache-first passage lookup with request coalescing.
 *
 * <p>
 * Must be called on the {@link DispatchLoop}. A miss starts one provider call
 * per (reference, translation); lookups for the same key that arrive while it
 * is in flight share its future instead of calling the provider again. The
 * provider result is written to the cache and the in-flight entry removed back
 * on the loop, before any waiting handler resumes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PassageLookupService {

    private final PassageCache cache;
    private final PassageGateway gateway;
    private final DispatchLoop loop;
    private final Map<String, CompletableFuture<PassageResult>> inFlight = new HashMap<>();

    public CompletableFuture<PassageResult> lookup(ScriptureReference reference) {
        String label = reference.label();
        String translation = reference.translation();

        Optional<Passage> cached = cache.get(label, translation);
        if (cached.isPresent()) {
            log.debug("[Lookup] Cache hit: {}", reference);
            return CompletableFuture.completedFuture(PassageResult.found(cached.get()));
        }

        String key = PassageCache.key(label, translation);
        CompletableFuture<PassageResult> pending = inFlight.get(key);
        if (pending != null) {
            log.debug("[Lookup] Joining in-flight request: {}", reference);
            return pending;
        }

        CompletableFuture<PassageResult> result = new CompletableFuture<>();
        inFlight.put(key, result);
        gateway.fetch(reference).whenCompleteAsync((fetched, error) -> {
            inFlight.remove(key);
            PassageResult outcome = error != null
                    ? PassageResult.unavailable("Lookup failed: " + error.getMessage())
                    : fetched;
            if (outcome.isFound()) {
                cache.put(label, translation, outcome.getPassage());
            }
            result.complete(outcome);
        }, loop);
        return result;
    }

    int inFlightCount() {
        return inFlight.size();
    }
}
