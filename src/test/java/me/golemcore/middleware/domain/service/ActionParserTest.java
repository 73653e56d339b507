package me.golemcore.middleware.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.middleware.domain.model.Action;
import me.golemcore.middleware.domain.model.ActionKind;
import me.golemcore.middleware.domain.model.ParseResult;
import me.golemcore.middleware.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionParserTest {

    private ObjectMapper objectMapper;
    private ActionParser parser;

    @BeforeEach
    void setUp() {
        objectMapper = AutoConfiguration.objectMapper();
        parser = new ActionParser(objectMapper);
    }

    // ==================== actions ====================

    @Test
    void shouldParseToolAction() {
        ParseResult result = parser.parse("use tool: search_tool {\"query\": \"AI trends\"}");

        assertTrue(result.isAction());
        Action action = result.getAction();
        assertEquals(ActionKind.TOOL, action.kind());
        assertEquals("search_tool", action.name());
        assertEquals(Map.of("query", "AI trends"), action.params());
    }

    @Test
    void shouldParseCapabilityAction() {
        ParseResult result = parser.parse("use capability: summarizer {\"length\": 3, \"strict\": true}");

        assertTrue(result.isAction());
        Action action = result.getAction();
        assertEquals(ActionKind.CAPABILITY, action.kind());
        assertEquals("summarizer", action.name());
        assertEquals(3, action.params().get("length"));
        assertEquals(Boolean.TRUE, action.params().get("strict"));
    }

    @Test
    void shouldParseNestedJsonAndNullValues() {
        ParseResult result = parser.parse(
                "use tool: t1 {\"filter\": {\"tags\": [\"a\", \"b\"], \"since\": null}, \"page\": 1.5}");

        assertTrue(result.isAction());
        Map<String, Object> params = result.getAction().params();
        @SuppressWarnings("unchecked")
        Map<String, Object> filter = (Map<String, Object>) params.get("filter");
        assertEquals(List.of("a", "b"), filter.get("tags"));
        assertTrue(filter.containsKey("since"));
        assertNull(filter.get("since"));
        assertEquals(1.5, params.get("page"));
    }

    @Test
    void shouldAcceptEmptyObjectAndMultilineJson() {
        assertTrue(parser.parse("use tool: ping {}").isAction());

        ParseResult multiline = parser.parse("use tool: notes {\n  \"text\": \"line\"\n}\n");
        assertTrue(multiline.isAction());
        assertEquals("line", multiline.getAction().params().get("text"));
    }

    @Test
    void shouldRoundTripParams() throws Exception {
        String json = "{\"query\":\"AI trends\",\"limit\":5,\"nested\":{\"flag\":false,\"items\":[1,2,3]}}";
        Action first = parser.parse("use tool: search_tool " + json).getAction();

        String reserialized = objectMapper.writeValueAsString(first.params());
        Action second = parser.parse("use tool: search_tool " + reserialized).getAction();

        assertEquals(first.params(), second.params());
    }

    @Test
    void shouldReturnImmutableParams() {
        Action action = parser.parse("use tool: t {\"a\": 1}").getAction();

        assertThrows(UnsupportedOperationException.class, () -> action.params().put("b", 2));
    }

    // ==================== plain input ====================

    @ParameterizedTest
    @ValueSource(strings = {
            "Tell me about AI.",
            "",
            "USE TOOL: search {\"q\": 1}",
            "Use tool: search {\"q\": 1}",
            "please use tool: search {\"q\": 1}",
            "use tools: search {}",
            "use plugin: search {}"
    })
    void shouldReturnNoneForConversationalInput(String input) {
        ParseResult result = parser.parse(input);

        assertEquals(ParseResult.Type.NONE, result.getType());
        assertNull(result.getAction());
    }

    @Test
    void shouldReturnNoneForNullInput() {
        assertEquals(ParseResult.Type.NONE, parser.parse(null).getType());
    }

    // ==================== faults ====================

    @ParameterizedTest
    @ValueSource(strings = {
            "use tool: search {\"query\": }",
            "use tool: search {'query': 'x'}",
            "use tool: search {\"query\": \"x\"",
            "use tool: search {\"query\": \"x\"} trailing",
            "use tool: search {\"a\": 1}{\"b\": 2}",
            "use tool: search",
            "use tool:",
            "use tool:search {}",
            "use tool: search [1, 2]",
            "use tool: my-tool {}",
            "use capability: search {__import__('os').system('rm -rf /')}"
    })
    void shouldReturnFaultForMalformedAction(String input) {
        ParseResult result = parser.parse(input);

        assertTrue(result.isFault(), "Expected fault for: " + input);
        assertFalse(result.isAction());
        assertNotNull(result.getFaultReason());
        assertNotNull(result.getAttemptedKind());
    }

    @Test
    void shouldRememberAttemptedKindOnFault() {
        assertEquals(ActionKind.CAPABILITY, parser.parse("use capability: x {oops}").getAttemptedKind());
        assertEquals(ActionKind.TOOL, parser.parse("use tool: x {oops}").getAttemptedKind());
    }

    @Test
    void shouldKeepLastValueForDuplicateKeys() {
        ParseResult result = parser.parse("use tool: t {\"a\": 1, \"a\": 2}");

        assertTrue(result.isAction());
        assertEquals(Map.of("a", 2), result.getAction().params());
    }

    @Test
    void shouldAcceptUnicodeIdentifier() {
        ParseResult result = parser.parse("use tool: café {}");

        assertTrue(result.isAction());
        assertEquals("café", result.getAction().name());
        assertEquals("数据_2", parser.parse("use capability: 数据_2 {\"x\": 1}").getAction().name());
    }
}
