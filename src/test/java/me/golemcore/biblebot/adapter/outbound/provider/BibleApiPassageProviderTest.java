package me.golemcore.biblebot.adapter.outbound.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.biblebot.domain.model.Book;
import me.golemcore.biblebot.domain.model.PassageFailureKind;
import me.golemcore.biblebot.domain.model.PassageResult;
import me.golemcore.biblebot.domain.model.ScriptureReference;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BibleApiPassageProviderTest {

    private static final ScriptureReference JOHN = new ScriptureReference("John", Book.JOHN, 3, 16, null, "kjv");

    private OkHttpMockEngine httpEngine;
    private BotProperties properties;
    private OkHttpClient client;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        client = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        properties = new BotProperties();
        properties.getProviders().getBibleApi().setBaseUrl("https://bible-api.mock.local");
    }

    private BibleApiPassageProvider provider() {
        return new BibleApiPassageProvider(properties, client, new ObjectMapper());
    }

    @Test
    void shouldExposeConfiguredTranslationsLowercased() {
        properties.getProviders().getBibleApi().setTranslations(List.of("KJV", "web"));

        BibleApiPassageProvider provider = provider();

        assertEquals(Set.of("kjv", "web"), provider.getSupportedTranslations());
        assertFalse(provider.isCredentialMissing());
    }

    @Test
    void shouldFetchPassageByReferencePath() {
        httpEngine.enqueueJson(200, "{\"reference\":\"John 3:16\",\"text\":\"For God so loved the world\\n\","
                + "\"translation_id\":\"kjv\"}");

        PassageResult result = provider().fetch(JOHN).join();

        assertTrue(result.isFound());
        assertEquals("For God so loved the world", result.getPassage().text());
        assertEquals("John 3:16", result.getPassage().reference());
        assertEquals("/John%203:16?translation=kjv", httpEngine.takeRequest().target());
    }

    @Test
    void shouldFetchRangeInRequestedTranslation() {
        httpEngine.enqueueJson(200, "{\"reference\":\"Romans 8:28-30\",\"text\":\"And we know...\"}");
        ScriptureReference romans = new ScriptureReference("Romans", Book.ROMANS, 8, 28, 30, "web");

        provider().fetch(romans).join();

        assertEquals("/Romans%208:28-30?translation=web", httpEngine.takeRequest().target());
    }

    @Test
    void shouldMapNotFound() {
        httpEngine.enqueueJson(404, "{\"error\":\"not found\"}");

        assertEquals(PassageFailureKind.NOT_FOUND, provider().fetch(JOHN).join().getFailureKind());
    }

    @Test
    void shouldTreatBlankTextAsNotFound() {
        httpEngine.enqueueJson(200, "{\"reference\":\"John 3:16\",\"text\":\"  \"}");

        assertEquals(PassageFailureKind.NOT_FOUND, provider().fetch(JOHN).join().getFailureKind());
    }

    @Test
    void shouldMapServerErrorToUnavailable() {
        httpEngine.enqueueJson(503, "");

        assertEquals(PassageFailureKind.UNAVAILABLE, provider().fetch(JOHN).join().getFailureKind());
    }

    @Test
    void shouldMapTransportFailureToUnavailable() {
        httpEngine.enqueueFailure(new IOException("timeout"));

        assertEquals(PassageFailureKind.UNAVAILABLE, provider().fetch(JOHN).join().getFailureKind());
    }
}
