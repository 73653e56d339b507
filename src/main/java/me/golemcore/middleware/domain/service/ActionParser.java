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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.middleware.domain.model.Action;
import me.golemcore.middleware.domain.model.ActionKind;
import me.golemcore.middleware.domain.model.ParseResult;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw agent input into an {@link Action}.
 *
 * <p>
 * Grammar (keywords are case-sensitive and must start the input):
 *
 * <pre>
 * use tool: &lt;identifier&gt; &lt;json-object&gt;
 * use capability: &lt;identifier&gt; &lt;json-object&gt;
 * </pre>
 *
 * <p>
 * The identifier is one or more Unicode word characters (letters, digits,
 * underscore). The JSON object takes up the rest of the input; a repeated key
 * keeps its last value. Parameters are read as literal JSON only; nothing in them
 * is evaluated.
 *
 * <p>
 * Input without either prefix parses to {@link ParseResult#none()}. Input with
 * a prefix but a malformed remainder parses to a fault so the dispatcher can
 * record it before falling back.
 */
@Component
@Slf4j
public class ActionParser {

    private static final Pattern PREFIX_PATTERN = Pattern.compile("^use (tool|capability):");
    private static final Pattern BODY_PATTERN = Pattern.compile("^\\s+(\\w+)\\s+(\\{.*)$",
            Pattern.DOTALL | Pattern.UNICODE_CHARACTER_CLASS);
    private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper strictMapper;

    public ActionParser(ObjectMapper objectMapper) {
        this.strictMapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ParseResult parse(String input) {
        if (input == null) {
            return ParseResult.none();
        }

        Matcher prefix = PREFIX_PATTERN.matcher(input);
        if (!prefix.find()) {
            return ParseResult.none();
        }

        ActionKind kind = ActionKind.fromKeyword(prefix.group(1));
        String remainder = input.substring(prefix.end());

        Matcher body = BODY_PATTERN.matcher(remainder);
        if (!body.matches()) {
            return ParseResult.fault(kind, "Expected '" + kind.getKeyword()
                    + ": <name> {json}' but got: " + abbreviate(remainder.strip()));
        }

        String name = body.group(1);
        String json = body.group(2).strip();
        try {
            JsonNode node = strictMapper.readTree(json);
            if (node == null || !node.isObject()) {
                return ParseResult.fault(kind, "Parameters must be a JSON object");
            }
            Map<String, Object> params = strictMapper.convertValue(node, PARAMS_TYPE);
            return ParseResult.action(new Action(kind, name, params));
        } catch (JsonProcessingException e) {
            log.debug("[Dispatch] Malformed parameters for {} '{}': {}", kind.getKeyword(), name,
                    e.getOriginalMessage());
            return ParseResult.fault(kind, "Malformed JSON parameters: " + e.getOriginalMessage());
        }
    }

    private static String abbreviate(String text) {
        int max = 80;
        if (text.isEmpty()) {
            return "<empty>";
        }
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
