package me.golemcore.middleware.domain.model;

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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal handed to a dispatch by the orchestrating
 * caller. Listeners registered after cancellation run immediately on the
 * registering thread.
 */
@Slf4j
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Token that is never cancelled by anyone; safe to share.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared none() token cannot be cancelled");
        }
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable listener : listeners) {
                runListener(listener);
            }
        }
    }

    /**
     * Registers a listener and returns a handle that removes it again.
     */
    public Runnable onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            runListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("[Dispatch] Cancellation listener failed: {}", e.getMessage());
        }
    }
}
