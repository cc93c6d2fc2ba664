package me.golemcore.biblebot.domain.loop;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * The single thread on which every event handler and every continuation after
 * an I/O suspension point runs.
 *
 * <p>
 * Handlers never block on I/O: they start a call that completes on another
 * thread and resume here with {@code thenXxxAsync(..., loop)}. Two handler
 * bodies therefore never run at the same time, which is what keeps the passage
 * cache, the in-flight lookup table and the handled key request set free of
 * locks. The order in which suspended handlers resume is not defined.
 */
@Component
@Slf4j
public class DispatchLoop implements Executor {

    private static final String THREAD_NAME = "biblebot-loop";
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Executor executor;

    public DispatchLoop() {
        this(Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        }));
    }

    /**
     * Runs tasks on the given executor; it must execute tasks one at a time.
     */
    public DispatchLoop(Executor executor) {
        this.executor = executor;
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("[Dispatch] Unhandled error in loop task", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[Dispatch] Loop is shut down, dropping task");
        }
    }

    @PreDestroy
    public void shutdown() {
        if (!(executor instanceof ExecutorService service)) {
            return;
        }
        service.shutdown();
        try {
            if (!service.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                service.shutdownNow();
            }
        } catch (InterruptedException e) {
            service.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
