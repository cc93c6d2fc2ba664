package me.golemcore.biblebot.domain.service;

import me.golemcore.biblebot.domain.model.Credentials;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.port.outbound.CredentialPort;
import me.golemcore.biblebot.port.outbound.MatrixAuthPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthServiceTest {

    private static final Credentials CREDENTIALS = new Credentials("https://matrix-client.matrix.test",
            "@biblebot:matrix.test", "token", "DEVICE");

    private MatrixAuthPort authPort;
    private CredentialPort credentialPort;
    private AuthService service;

    @BeforeEach
    void setUp() {
        authPort = mock(MatrixAuthPort.class);
        credentialPort = mock(CredentialPort.class);
        service = new AuthService(authPort, credentialPort, new BotProperties());
    }

    @Test
    void shouldDiscoverLoginAndSave() {
        when(authPort.discoverHomeserver("matrix.test")).thenReturn("https://matrix-client.matrix.test");
        when(authPort.login("https://matrix-client.matrix.test", "biblebot", "secret", "biblebot"))
                .thenReturn(CREDENTIALS);

        Credentials result = service.login("matrix.test", "biblebot", "secret");

        assertEquals(CREDENTIALS, result);
        verify(credentialPort).save(CREDENTIALS);
    }

    @Test
    void shouldNotSaveWhenLoginFails() {
        when(authPort.discoverHomeserver("matrix.test")).thenReturn("https://matrix.test");
        when(authPort.login(any(), any(), any(), any())).thenThrow(new IllegalStateException("M_FORBIDDEN"));

        assertThrows(IllegalStateException.class, () -> service.login("matrix.test", "biblebot", "wrong"));
        verify(credentialPort, never()).save(any());
    }

    @Test
    void shouldLogoutOnServerAndDeleteLocally() {
        when(credentialPort.load()).thenReturn(Optional.of(CREDENTIALS));
        when(credentialPort.delete()).thenReturn(true);

        assertTrue(service.logout());
        verify(authPort).logout(CREDENTIALS);
        verify(credentialPort).delete();
    }

    @Test
    void shouldDeleteLocallyEvenWhenServerLogoutFails() {
        when(credentialPort.load()).thenReturn(Optional.of(CREDENTIALS));
        doThrow(new IllegalStateException("unreachable")).when(authPort).logout(CREDENTIALS);
        when(credentialPort.delete()).thenReturn(true);

        assertTrue(service.logout());
        verify(credentialPort).delete();
    }

    @Test
    void shouldReportNothingToLogout() {
        when(credentialPort.load()).thenReturn(Optional.empty());
        when(credentialPort.delete()).thenReturn(false);

        assertFalse(service.logout());
        verify(authPort, never()).logout(any());
    }

    @Test
    void shouldReturnSavedSessionAsStatus() {
        when(credentialPort.load()).thenReturn(Optional.of(CREDENTIALS));

        assertEquals(Optional.of(CREDENTIALS), service.status());
    }
}
