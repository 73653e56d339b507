package me.golemcore.middleware.domain.service;

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
import me.golemcore.middleware.domain.component.ActionHandler;
import me.golemcore.middleware.domain.model.CancellationToken;
import me.golemcore.middleware.domain.model.HandlerExecutionResult;
import me.golemcore.middleware.infrastructure.config.MiddlewareProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a handler on a worker thread and waits for it no longer than a
 * deadline.
 *
 * <p>
 * The calling thread always returns by the deadline, whatever the handler
 * does. On overrun the worker is interrupted and the result is discarded; a
 * handler that ignores interruption keeps running in the background until it
 * finishes on its own. {@code TIMED_OUT} therefore means "result discarded",
 * not "work stopped".
 *
 * <p>
 * Exceptions thrown by the handler are returned as {@code FAILED} and never
 * propagate to the caller.
 */
@Component
@Slf4j
public class BoundedHandlerExecutor {

    private static final int TERMINATION_TIMEOUT_SECONDS = 2;

    private final Duration defaultTimeout;
    private final ExecutorService workerPool;

    public BoundedHandlerExecutor(MiddlewareProperties properties) {
        MiddlewareProperties.DispatchProperties dispatch = properties.getDispatch();
        this.defaultTimeout = dispatch.getDefaultTimeout();
        this.workerPool = createWorkerPool(dispatch.getWorkerThreads());
    }

    @PreDestroy
    void destroy() {
        workerPool.shutdownNow();
        try {
            if (!workerPool.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[Dispatch] Handler workers still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public HandlerExecutionResult run(ActionHandler handler, Map<String, Object> params, Duration timeout) {
        return run(handler, params, timeout, CancellationToken.none());
    }

    /**
     * Runs {@code handler} with {@code params}.
     *
     * @param timeout
     *            deadline for the invocation; {@code null} or non-positive uses the
     *            configured default
     * @param cancellationToken
     *            cancels the invocation when fired before or during the run
     */
    public HandlerExecutionResult run(ActionHandler handler, Map<String, Object> params, Duration timeout,
            CancellationToken cancellationToken) {
        Duration deadline = resolveTimeout(timeout);
        CancellationToken token = cancellationToken != null ? cancellationToken : CancellationToken.none();
        Map<String, Object> safeParams = params != null ? params : Map.of();
        long startNanos = System.nanoTime();

        if (token.isCancelled()) {
            return HandlerExecutionResult.cancelled(elapsedSince(startNanos));
        }

        Future<String> future;
        try {
            future = workerPool.submit(() -> handler.invoke(safeParams));
        } catch (RejectedExecutionException e) {
            log.error("[Dispatch] Handler worker pool rejected invocation", e);
            return HandlerExecutionResult.failed(e, elapsedSince(startNanos));
        }

        Runnable removeListener = token.onCancel(() -> future.cancel(true));
        try {
            String output = future.get(deadline.toNanos(), TimeUnit.NANOSECONDS);
            Duration elapsed = elapsedSince(startNanos);
            log.debug("[Dispatch] Action executed successfully in {} ms", elapsed.toMillis());
            return HandlerExecutionResult.ok(output, elapsed);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Dispatch] Action execution timed out after {} ms", deadline.toMillis());
            return HandlerExecutionResult.timedOut(elapsedSince(startNanos));
        } catch (CancellationException e) {
            return HandlerExecutionResult.cancelled(elapsedSince(startNanos));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Dispatch] Error executing action: {}", cause.toString());
            return HandlerExecutionResult.failed(cause, elapsedSince(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return HandlerExecutionResult.cancelled(elapsedSince(startNanos));
        } finally {
            removeListener.run();
        }
    }

    private Duration resolveTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return defaultTimeout;
        }
        return timeout;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ExecutorService createWorkerPool(int workerThreads) {
        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "handler-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        };
        if (workerThreads > 0) {
            return Executors.newFixedThreadPool(workerThreads, threadFactory);
        }
        return Executors.newCachedThreadPool(threadFactory);
    }
}
