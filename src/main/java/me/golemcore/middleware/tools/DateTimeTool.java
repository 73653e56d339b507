package me.golemcore.middleware.tools;

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

import me.golemcore.middleware.domain.component.HandlerComponent;
import me.golemcore.middleware.domain.model.ActionKind;
import me.golemcore.middleware.infrastructure.config.MiddlewareProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Tool for getting current date and time.
 *
 * <p>
 * Returns current date/time in a specified timezone (or UTC when omitted).
 *
 * <p>
 * Usage: {@code use tool: datetime {"timezone": "Europe/London"}}
 *
 * <p>
 * Enabled via {@code middleware.tools.datetime.enabled} (default true).
 */
@Component
public class DateTimeTool implements HandlerComponent {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;
    private final MiddlewareProperties properties;

    public DateTimeTool(Clock clock, MiddlewareProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    @Override
    public ActionKind getKind() {
        return ActionKind.TOOL;
    }

    @Override
    public String getName() {
        return "datetime";
    }

    @Override
    public boolean isEnabled() {
        return properties.getTools().getDatetime().isEnabled();
    }

    @Override
    public String invoke(Map<String, Object> params) {
        Object timezone = params.get("timezone");
        ZoneId zoneId;
        if (timezone == null || timezone.toString().isBlank()) {
            zoneId = clock.getZone();
        } else {
            try {
                zoneId = ZoneId.of(timezone.toString());
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
            }
        }
        return ZonedDateTime.now(clock.withZone(zoneId)).format(FORMATTER);
    }
}
