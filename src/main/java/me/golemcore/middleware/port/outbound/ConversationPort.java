package me.golemcore.middleware.port.outbound;

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
 * Port for the conversational fallback handler that receives input no tool or
 * capability claimed. Implementations may keep their own conversation memory;
 * the dispatcher treats them as an opaque function.
 */
public interface ConversationPort {

    /**
     * Submits text and returns the handler's reply.
     *
     * @param text
     *            raw agent input, unchanged
     * @return the reply text
     */
    String chat(String text);
}
