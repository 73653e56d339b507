package me.golemcore.middleware.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.middleware.adapter.outbound.conversation.PassThroughConversationAdapter;
import me.golemcore.middleware.domain.model.ActionKind;
import me.golemcore.middleware.domain.service.HandlerRegistry;
import me.golemcore.middleware.port.outbound.ConversationPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for shared infrastructure beans and the startup summary.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the UTC {@link Clock} used to timestamp events</li>
 * <li>Provides the shared Jackson {@link ObjectMapper} (ISO-8601 dates)</li>
 * <li>Falls back to a pass-through conversational handler when the
 * application supplies none</li>
 * <li>Logs startup information via {@code @PostConstruct}</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final MiddlewareProperties properties;
    private final HandlerRegistry handlerRegistry;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean(ConversationPort.class)
    public static ConversationPort conversationPort() {
        return new PassThroughConversationAdapter();
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Middleware starting...");
        log.info("Agent name: {}", properties.getAgentName());
        log.info("Default handler timeout: {} ms", properties.getDispatch().getDefaultTimeout().toMillis());
        log.info("Event backend: {}", properties.getEvents().getBackend());
        log.info("Tools: {}", handlerRegistry.listNames(ActionKind.TOOL));
        log.info("Capabilities: {}", handlerRegistry.listNames(ActionKind.CAPABILITY));
    }
}
