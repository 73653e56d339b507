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

/**
 * Activity types written to the event log. Consumers parse entries by these
 * values, so they must stay stable.
 */
public final class ActivityTypes {

    public static final String TOOL_USAGE = "tool_usage";
    public static final String CAPABILITY_USAGE = "capability_usage";
    public static final String AGENT_FALLBACK = "agent_fallback";
    public static final String ACTION_PARSE_FAILURE = "action_parse_failure";

    private ActivityTypes() {
    }
}
