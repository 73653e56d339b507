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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.middleware.domain.model.Action;
import me.golemcore.middleware.domain.model.ActionKind;
import me.golemcore.middleware.domain.model.ActivityTypes;
import me.golemcore.middleware.domain.model.CancellationToken;
import me.golemcore.middleware.domain.model.DispatchOptions;
import me.golemcore.middleware.domain.model.DispatchOutcome;
import me.golemcore.middleware.domain.model.DispatchSource;
import me.golemcore.middleware.domain.model.FaultKind;
import me.golemcore.middleware.domain.model.HandlerExecutionResult;
import me.golemcore.middleware.domain.model.HandlerRecord;
import me.golemcore.middleware.domain.model.ParseResult;
import me.golemcore.middleware.infrastructure.config.MiddlewareProperties;
import me.golemcore.middleware.port.inbound.DispatchPort;
import me.golemcore.middleware.port.outbound.ConversationPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routes agent input to a tool, a capability or the conversational fallback.
 *
 * <p>
 * One dispatch runs parse, resolve, execute under a deadline, record, return.
 * Input that is not an action goes to the {@link ConversationPort}. Input that
 * looks like an action but does not parse is recorded as an
 * {@code action_parse_failure} before it falls back. Unknown handler names are
 * answered with {@code "<Tool|Capability> '<name>' not found."}.
 *
 * <p>
 * Stateless across calls and safe for concurrent use. No action is retried.
 * {@link #dispatch(String, DispatchOptions)} never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchService implements DispatchPort {

    static final String MSG_TIMED_OUT = "The action timed out.";
    static final String MSG_CANCELLED = "The action was cancelled.";
    static final String MSG_ERROR_PREFIX = "An error occurred: ";
    static final String REASON_NO_ACTION = "no_action";
    static final String REASON_PARSE_FAILURE = "parse_failure";

    private static final String LOG_PREFIX = "[Dispatch]";
    private static final int MAX_LOGGED_INPUT = 200;

    private final ActionParser actionParser;
    private final HandlerRegistry handlerRegistry;
    private final BoundedHandlerExecutor executor;
    private final EventLogService eventLog;
    private final ConversationPort conversationPort;
    private final MiddlewareProperties properties;

    @Override
    public DispatchOutcome dispatch(String input, DispatchOptions options) {
        DispatchOptions safeOptions = options != null ? options : DispatchOptions.defaults();
        String safeInput = input != null ? input : "";
        String agentName = resolveAgentName(safeOptions);
        try {
            return route(safeInput, safeOptions, agentName);
        } catch (RuntimeException | Error e) { // NOSONAR - nothing may escape a dispatch
            log.error("{} Unexpected failure while routing input", LOG_PREFIX, e);
            return DispatchOutcome.failure(MSG_ERROR_PREFIX + safeCauseMessage(e), DispatchSource.FALLBACK,
                    Duration.ZERO, FaultKind.HANDLER_FAULT);
        }
    }

    private DispatchOutcome route(String input, DispatchOptions options, String agentName) {
        log.debug("{} Processing agent input: {}", LOG_PREFIX, abbreviate(input));

        ParseResult parsed = actionParser.parse(input);
        if (parsed.isFault()) {
            log.warn("{} Failed to parse action: {}", LOG_PREFIX, parsed.getFaultReason());
            recordParseFailure(input, parsed, agentName);
            return fallback(input, options, agentName, REASON_PARSE_FAILURE, FaultKind.PARSE_FAULT);
        }
        if (!parsed.isAction()) {
            log.debug("{} No action detected, forwarding input", LOG_PREFIX);
            return fallback(input, options, agentName, REASON_NO_ACTION, null);
        }
        return routeAction(parsed.getAction(), options, agentName);
    }

    private DispatchOutcome routeAction(Action action, DispatchOptions options, String agentName) {
        ActionKind kind = action.kind();
        Optional<HandlerRecord> handlerRecord = handlerRegistry.resolve(kind, action.name());
        if (handlerRecord.isEmpty()) {
            log.warn("{} Action not found: {} - {}", LOG_PREFIX, kind.getKeyword(), action.name());
            String message = kind.getDisplayName() + " '" + action.name() + "' not found.";
            DispatchOutcome outcome = DispatchOutcome.failure(message, kind.toSource(), Duration.ZERO,
                    FaultKind.NOT_FOUND);
            recordActionOutcome(action, agentName, outcome, null);
            return outcome;
        }

        log.info("{} Executing {}: {}", LOG_PREFIX, kind.getKeyword(), action.name());
        HandlerExecutionResult result = executor.run(handlerRecord.get().handler(), action.params(),
                options.getTimeout(), options.getCancellationToken());
        DispatchOutcome outcome = toOutcome(kind.toSource(), result);
        recordActionOutcome(action, agentName, outcome, result.getCause());
        return outcome;
    }

    private DispatchOutcome fallback(String input, DispatchOptions options, String agentName, String reason,
            FaultKind parseFault) {
        CancellationToken token = options.getCancellationToken();
        long startNanos = System.nanoTime();
        String response;
        FaultKind fault = parseFault;
        Throwable error = null;

        if (token != null && token.isCancelled()) {
            response = MSG_CANCELLED;
            fault = FaultKind.CANCELLED;
        } else {
            try {
                response = conversationPort.chat(input);
                if (response == null) {
                    response = "";
                }
            } catch (RuntimeException | Error e) { // NOSONAR - reported as a handler fault
                log.error("{} Conversational handler failed", LOG_PREFIX, e);
                response = MSG_ERROR_PREFIX + safeCauseMessage(e);
                fault = FaultKind.HANDLER_FAULT;
                error = e;
            }
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("input", input);
        details.put("response", response);
        details.put("reason", reason);
        if (fault != null) {
            details.put("fault", fault.name());
        }
        if (error != null) {
            details.put("error", safeCauseMessage(error));
        }
        eventLog.record(ActivityTypes.AGENT_FALLBACK, agentName, details, metadata(DispatchSource.FALLBACK, elapsed));

        return new DispatchOutcome(response, DispatchSource.FALLBACK, elapsed, fault);
    }

    private static DispatchOutcome toOutcome(DispatchSource source, HandlerExecutionResult result) {
        Duration elapsed = result.getElapsed();
        return switch (result.getStatus()) {
        case OK -> DispatchOutcome.success(result.getOutput() != null ? result.getOutput() : "", source, elapsed);
        case TIMED_OUT -> DispatchOutcome.failure(MSG_TIMED_OUT, source, elapsed, FaultKind.TIMED_OUT);
        case CANCELLED -> DispatchOutcome.failure(MSG_CANCELLED, source, elapsed, FaultKind.CANCELLED);
        case FAILED -> DispatchOutcome.failure(MSG_ERROR_PREFIX + safeCauseMessage(result.getCause()), source,
                elapsed, FaultKind.HANDLER_FAULT);
        };
    }

    private void recordActionOutcome(Action action, String agentName, DispatchOutcome outcome, Throwable cause) {
        ActionKind kind = action.kind();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(kind.getNameDetailKey(), action.name());
        details.put("params", action.params());
        details.put("result", outcome.result());
        outcome.faultKind().ifPresent(fault -> details.put("fault", fault.name()));
        if (cause != null) {
            details.put("error", safeCauseMessage(cause));
            details.put("error_type", cause.getClass().getName());
        }
        eventLog.record(kind.getActivityType(), agentName, details, metadata(outcome.source(), outcome.elapsed()));
    }

    private void recordParseFailure(String input, ParseResult parsed, String agentName) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("input", input);
        details.put("action_type", parsed.getAttemptedKind().getKeyword());
        details.put("reason", parsed.getFaultReason());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("level", "warning");
        metadata.put("fault", FaultKind.PARSE_FAULT.name());
        eventLog.record(ActivityTypes.ACTION_PARSE_FAILURE, agentName, details, metadata);
    }

    private static Map<String, Object> metadata(DispatchSource source, Duration elapsed) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", source.name().toLowerCase(Locale.ROOT));
        metadata.put("elapsed_ms", elapsed != null ? elapsed.toMillis() : 0L);
        return metadata;
    }

    private String resolveAgentName(DispatchOptions options) {
        String agentName = options.getAgentName();
        if (agentName != null && !agentName.isBlank()) {
            return agentName;
        }
        return properties.getAgentName();
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_LOGGED_INPUT ? text : text.substring(0, MAX_LOGGED_INPUT) + "...";
    }
}
