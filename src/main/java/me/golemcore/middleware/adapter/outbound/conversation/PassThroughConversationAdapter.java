package me.golemcore.middleware.adapter.outbound.conversation;

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
import me.golemcore.middleware.port.outbound.ConversationPort;

/**
 * Conversational fallback used when no agent is configured.
 *
 * <p>
 * Returns the input unchanged, so plain text passes through the middleware
 * untouched. Registered by {@code AutoConfiguration} only when the application
 * provides no other {@link ConversationPort} bean.
 */
@Slf4j
public class PassThroughConversationAdapter implements ConversationPort {

    @Override
    public String chat(String text) {
        log.debug("PassThroughConversationAdapter: chat() called - no agent configured, returning input");
        return text;
    }
}
