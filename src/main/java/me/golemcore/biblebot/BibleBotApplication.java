package me.golemcore.biblebot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Matrix BibleBot.
 *
 * <p>
 * BibleBot watches configured Matrix rooms for scripture references such as
 * {@code John 3:16} or {@code Psalm 23 esv}, resolves them through an external
 * passage provider and answers with the passage text plus a reaction on the
 * triggering message.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Reference detection</b> - conservative grammars with book aliases and
 * an optional translation token</li>
 * <li><b>Providers</b> - ESV API, bible-api.com and API.Bible, one provider
 * per translation</li>
 * <li><b>Passage cache</b> - bounded LRU with time-to-live</li>
 * <li><b>Replay safety</b> - start watermark and self-message filtering</li>
 * <li><b>Key recovery</b> - one room key request per undecryptable event</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters) with a single-threaded dispatch
 * loop:
 *
 * <pre>
 * Input Layer        → MatrixClientAdapter, BibleBotRunner
 * Domain Layer       → DispatchLoop, MessageDispatcher, Services
 * Infrastructure     → Passage providers, Credential store, HTTP
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under {@code bot.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BibleBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(BibleBotApplication.class, args);
    }

}
