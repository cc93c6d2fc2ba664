package me.golemcore.biblebot.adapter.inbound.cli;

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
import me.golemcore.biblebot.domain.model.Credentials;
import me.golemcore.biblebot.domain.service.AuthService;
import me.golemcore.biblebot.domain.service.BotLifecycleService;
import me.golemcore.biblebot.infrastructure.config.BotProperties;
import me.golemcore.biblebot.infrastructure.i18n.MessageService;
import me.golemcore.biblebot.port.outbound.CredentialPort;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.Console;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * Command line entry point.
 *
 * <ul>
 * <li>{@code auth login <homeserver> <user> [password]} - password login,
 * prompts for the password when omitted</li>
 * <li>{@code auth logout} - server logout and removal of local session
 * data</li>
 * <li>{@code auth status} - shows the saved session</li>
 * </ul>
 * Without arguments the bot starts when {@code bot.matrix.auto-start} is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BibleBotRunner implements ApplicationRunner {

    private static final String AUTH = "auth";

    private final AuthService authService;
    private final BotLifecycleService lifecycleService;
    private final CredentialPort credentialPort;
    private final MessageService messageService;
    private final BotProperties properties;

    private PrintStream out = System.out;

    /**
     * Package-private for tests.
     */
    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> command = args.getNonOptionArgs();
        if (!command.isEmpty()) {
            runCommand(command);
            return;
        }
        if (!properties.getMatrix().isAutoStart()) {
            log.info("[Runner] Auto-start disabled, not connecting to Matrix");
            return;
        }
        lifecycleService.start();
    }

    void runCommand(List<String> command) {
        if (!AUTH.equals(command.get(0)) || command.size() < 2) {
            out.println(messageService.getMessage("auth.usage"));
            return;
        }
        switch (command.get(1)) {
            case "login" -> login(command);
            case "logout" -> logout();
            case "status" -> status();
            default -> out.println(messageService.getMessage("auth.usage"));
        }
    }

    private void login(List<String> command) {
        if (command.size() < 4) {
            out.println(messageService.getMessage("auth.usage"));
            return;
        }
        String server = command.get(2);
        String user = command.get(3);
        Optional<String> password = command.size() > 4
                ? Optional.of(command.get(4))
                : readPassword();
        if (password.isEmpty()) {
            out.println(messageService.getMessage("auth.usage"));
            return;
        }
        try {
            Credentials credentials = authService.login(server, user, password.get());
            out.println(messageService.getMessage("auth.login.success", credentials.userId(),
                    credentials.homeserver(), credentials.deviceId(), credentialPort.getCredentialsPath()));
        } catch (RuntimeException e) { // NOSONAR - report any login failure to the operator
            log.debug("[Runner] Login failed", e);
            out.println(messageService.getMessage("auth.login.failed", e.getMessage()));
            throw new IllegalStateException("Login failed", e);
        }
    }

    private void logout() {
        boolean existed = authService.logout();
        out.println(messageService.getMessage(existed ? "auth.logout.success" : "auth.logout.nothing"));
    }

    private void status() {
        Optional<Credentials> credentials = authService.status();
        if (credentials.isPresent()) {
            Credentials current = credentials.get();
            out.println(messageService.getMessage("auth.status.logged_in", current.userId(), current.homeserver(),
                    current.deviceId()));
        } else if (credentialPort.exists()) {
            out.println(messageService.getMessage("auth.status.unreadable", credentialPort.getCredentialsPath()));
        } else {
            out.println(messageService.getMessage("auth.status.logged_out"));
        }
    }

    private Optional<String> readPassword() {
        Console console = System.console();
        if (console == null) {
            return Optional.empty();
        }
        char[] password = console.readPassword("Password: ");
        return password == null || password.length == 0
                ? Optional.empty()
                : Optional.of(new String(password));
    }
}
