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
 * Namespace of an invocable handler. Tools and capabilities share execution
 * semantics and differ only by the registration category they live in.
 */
public enum ActionKind {

    TOOL("tool", "Tool", ActivityTypes.TOOL_USAGE, "tool_name"),

    CAPABILITY("capability", "Capability", ActivityTypes.CAPABILITY_USAGE, "capability_name");

    private final String keyword;
    private final String displayName;
    private final String activityType;
    private final String nameDetailKey;

    ActionKind(String keyword, String displayName, String activityType, String nameDetailKey) {
        this.keyword = keyword;
        this.displayName = displayName;
        this.activityType = activityType;
        this.nameDetailKey = nameDetailKey;
    }

    /**
     * Keyword used in the {@code use <keyword>:} command prefix.
     */
    public String getKeyword() {
        return keyword;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Activity type recorded for dispatches routed into this namespace.
     */
    public String getActivityType() {
        return activityType;
    }

    /**
     * Key under which the handler name is stored in event details.
     */
    public String getNameDetailKey() {
        return nameDetailKey;
    }

    public DispatchSource toSource() {
        return this == TOOL ? DispatchSource.TOOL : DispatchSource.CAPABILITY;
    }

    public static ActionKind fromKeyword(String keyword) {
        for (ActionKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown action kind: " + keyword);
    }
}
