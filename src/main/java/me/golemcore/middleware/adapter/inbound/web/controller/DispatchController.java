package me.golemcore.middleware.adapter.inbound.web.controller;

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
import me.golemcore.middleware.adapter.inbound.web.dto.DispatchRequest;
import me.golemcore.middleware.adapter.inbound.web.dto.DispatchResponse;
import me.golemcore.middleware.domain.model.DispatchOptions;
import me.golemcore.middleware.domain.model.DispatchOutcome;
import me.golemcore.middleware.port.inbound.DispatchPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Locale;

/**
 * Dispatch endpoint: routes one piece of agent input and returns the outcome.
 */
@RestController
@RequestMapping("/api/dispatch")
@RequiredArgsConstructor
public class DispatchController {

    private final DispatchPort dispatchPort;

    @PostMapping
    public Mono<ResponseEntity<DispatchResponse>> dispatch(@RequestBody DispatchRequest request) {
        if (request == null || request.getInput() == null) {
            throw new IllegalArgumentException("input is required");
        }
        if (request.getTimeoutMs() != null && request.getTimeoutMs() <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }

        DispatchOptions options = DispatchOptions.builder()
                .timeout(request.getTimeoutMs() != null ? Duration.ofMillis(request.getTimeoutMs()) : null)
                .agentName(request.getAgentName())
                .build();

        // Dispatch blocks up to the handler deadline, keep it off the event loop
        return Mono.fromCallable(() -> dispatchPort.dispatch(request.getInput(), options))
                .subscribeOn(Schedulers.boundedElastic())
                .map(outcome -> ResponseEntity.ok(toResponse(outcome)));
    }

    private static DispatchResponse toResponse(DispatchOutcome outcome) {
        return DispatchResponse.builder()
                .result(outcome.result())
                .source(outcome.source().name().toLowerCase(Locale.ROOT))
                .elapsedMs(outcome.elapsed() != null ? outcome.elapsed().toMillis() : 0L)
                .fault(outcome.faultKind().map(Enum::name).orElse(null))
                .success(outcome.isSuccess())
                .build();
    }
}
