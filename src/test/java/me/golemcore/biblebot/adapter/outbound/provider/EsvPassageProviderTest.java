package me.golemcore.biblebot.adapter.outbound.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.biblebot.domain.model.Book;
import me.golemcore.biblebot.domain.model.PassageFailureKind;
import me.golemcore.biblebot.domain.model.PassageResult;
import me.golemcore.biblebot.domain.model.ScriptureReference;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.infrastructure.http.FeignClientFactory;
import me.golemcore.biblebot.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EsvPassageProviderTest {

    private static final ScriptureReference JOHN = new ScriptureReference("John", Book.JOHN, 3, 16, null, "esv");

    private OkHttpMockEngine httpEngine;
    private BotProperties properties;
    private EsvPassageProvider provider;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        properties = new BotProperties();
        properties.getProviders().getEsv().setBaseUrl("https://esv.mock.local");
        properties.getProviders().getEsv().setApiKey("test-key");
        provider = new EsvPassageProvider(new FeignClientFactory(client, new ObjectMapper()), properties);
        provider.init();
    }

    @Test
    void shouldServeEsvOnly() {
        assertEquals("esv", provider.getProviderName());
        assertEquals(Set.of("esv"), provider.getSupportedTranslations());
        assertTrue(provider.isEnabled());
        assertFalse(provider.isCredentialMissing());
    }

    @Test
    void shouldReportMissingKey() {
        properties.getProviders().getEsv().setApiKey(" ");

        assertTrue(provider.isCredentialMissing());
    }

    @Test
    void shouldFetchPlainPassageText() {
        httpEngine.enqueueJson(200, "{\"query\":\"John 3:16\",\"canonical\":\"John 3:16\","
                + "\"passages\":[\"  For God so loved the world... (ESV)\\n\"]}");

        PassageResult result = provider.fetch(JOHN).join();

        assertTrue(result.isFound());
        assertEquals("For God so loved the world... (ESV)", result.getPassage().text());
        assertEquals("John 3:16", result.getPassage().reference());

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("Token test-key", request.header("Authorization"));
        assertTrue(request.target().startsWith("/v3/passage/text/?q=John"));
        assertTrue(request.target().contains("include-headings=false"));
        assertTrue(request.target().contains("include-verse-numbers=false"));
    }

    @Test
    void shouldFallBackToLabelWithoutCanonical() {
        httpEngine.enqueueJson(200, "{\"passages\":[\"For God so loved the world\"]}");

        assertEquals("John 3:16", provider.fetch(JOHN).join().getPassage().reference());
    }

    @Test
    void shouldTreatEmptyPassagesAsNotFound() {
        httpEngine.enqueueJson(200, "{\"canonical\":\"\",\"passages\":[]}");

        PassageResult result = provider.fetch(JOHN).join();

        assertFalse(result.isFound());
        assertEquals(PassageFailureKind.NOT_FOUND, result.getFailureKind());
    }

    @Test
    void shouldMapNotFoundStatus() {
        httpEngine.enqueueJson(404, "{\"detail\":\"Not found\"}");

        assertEquals(PassageFailureKind.NOT_FOUND, provider.fetch(JOHN).join().getFailureKind());
    }

    @Test
    void shouldMapServerErrorToUnavailable() {
        httpEngine.enqueueJson(500, "{}");

        assertEquals(PassageFailureKind.UNAVAILABLE, provider.fetch(JOHN).join().getFailureKind());
    }

    @Test
    void shouldMapTransportFailureToUnavailable() {
        httpEngine.enqueueFailure(new IOException("connection reset"));

        assertEquals(PassageFailureKind.UNAVAILABLE, provider.fetch(JOHN).join().getFailureKind());
    }
}
