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
import me.golemcore.middleware.domain.model.EventQuery;
import me.golemcore.middleware.domain.model.LogEntry;
import me.golemcore.middleware.domain.service.EventLogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Event log endpoints: filtered retrieval of routing events, newest first.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventsController {

    private static final int MAX_LIMIT = 1000;

    private final EventLogService eventLogService;

    @GetMapping
    public Mono<ResponseEntity<List<LogEntry>>> getEvents(
            @RequestParam(required = false) String activityType,
            @RequestParam(required = false) String agentName,
            @RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        EventQuery query = EventQuery.builder()
                .activityType(blankToNull(activityType))
                .agentName(blankToNull(agentName))
                .build();
        return Mono.fromCallable(() -> eventLogService.query(query, limit))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
