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

import lombok.Builder;
import lombok.Value;

/**
 * Conjunctive filter over log entries. A {@code null} field matches any value.
 */
@Value
@Builder
public class EventQuery {

    String activityType;
    String agentName;

    public static EventQuery any() {
        return EventQuery.builder().build();
    }

    public static EventQuery byActivityType(String activityType) {
        return EventQuery.builder().activityType(activityType).build();
    }

    public static EventQuery byAgentName(String agentName) {
        return EventQuery.builder().agentName(agentName).build();
    }

    public boolean matches(LogEntry entry) {
        if (entry == null) {
            return false;
        }
        if (activityType != null && !activityType.equals(entry.getActivityType())) {
            return false;
        }
        return agentName == null || agentName.equals(entry.getAgentName());
    }
}
