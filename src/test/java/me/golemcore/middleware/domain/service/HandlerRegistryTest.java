package me.golemcore.middleware.domain.service;

import me.golemcore.middleware.domain.component.ActionHandler;
import me.golemcore.middleware.domain.component.HandlerComponent;
import me.golemcore.middleware.domain.exception.DuplicateHandlerException;
import me.golemcore.middleware.domain.model.ActionKind;
import me.golemcore.middleware.domain.model.FaultKind;
import me.golemcore.middleware.domain.model.HandlerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HandlerRegistryTest {

    private static final ActionHandler ECHO = params -> String.valueOf(params.get("text"));
    private static final ActionHandler SEARCH = params -> "Searching for: " + params.get("query");

    private HandlerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new HandlerRegistry(List.of());
    }

    @Test
    void shouldResolveRegisteredHandler() {
        registry.register(ActionKind.TOOL, "search_tool", SEARCH);

        Optional<HandlerRecord> resolved = registry.resolve(ActionKind.TOOL, "search_tool");

        assertTrue(resolved.isPresent());
        assertSame(SEARCH, resolved.get().handler());
        assertEquals("search_tool", resolved.get().name());
        assertEquals(ActionKind.TOOL, resolved.get().kind());
    }

    @Test
    void shouldReturnEmptyForUnknownName() {
        assertTrue(registry.resolve(ActionKind.TOOL, "missing").isEmpty());
        assertTrue(registry.resolve(ActionKind.CAPABILITY, "missing").isEmpty());
        assertTrue(registry.resolve(ActionKind.TOOL, null).isEmpty());
    }

    @Test
    void shouldKeepNamespacesSeparate() {
        registry.register(ActionKind.TOOL, "search", SEARCH);
        registry.register(ActionKind.CAPABILITY, "search", ECHO);

        assertSame(SEARCH, registry.resolve(ActionKind.TOOL, "search").orElseThrow().handler());
        assertSame(ECHO, registry.resolve(ActionKind.CAPABILITY, "search").orElseThrow().handler());
    }

    @Test
    void shouldRejectDuplicateAndKeepFirstHandler() {
        registry.register(ActionKind.TOOL, "search_tool", SEARCH);

        DuplicateHandlerException ex = assertThrows(DuplicateHandlerException.class,
                () -> registry.register(ActionKind.TOOL, "search_tool", ECHO));

        assertEquals("Tool 'search_tool' is already registered", ex.getMessage());
        assertEquals(ActionKind.TOOL, ex.getKind());
        assertEquals("search_tool", ex.getHandlerName());
        assertEquals(FaultKind.DUPLICATE_HANDLER, ex.getFaultKind());
        assertSame(SEARCH, registry.resolve(ActionKind.TOOL, "search_tool").orElseThrow().handler());
    }

    @Test
    void shouldRejectInvalidRegistration() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(ActionKind.TOOL, " ", ECHO));
        assertThrows(IllegalArgumentException.class, () -> registry.register(ActionKind.TOOL, null, ECHO));
        assertThrows(IllegalArgumentException.class, () -> registry.register(ActionKind.TOOL, "echo", null));
        assertThrows(IllegalArgumentException.class, () -> registry.register(null, "echo", ECHO));
    }

    @Test
    void shouldRejectNamesTheParserCannotAddress() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(ActionKind.TOOL, "my tool", ECHO));
        assertThrows(IllegalArgumentException.class, () -> registry.register(ActionKind.TOOL, "my-tool", ECHO));
        assertThrows(IllegalArgumentException.class, () -> registry.register(ActionKind.TOOL, "search:", ECHO));
        assertTrue(registry.listNames(ActionKind.TOOL).isEmpty());
    }

    @Test
    void shouldAcceptUnicodeWordNames() {
        registry.register(ActionKind.TOOL, "café", ECHO);

        assertTrue(registry.resolve(ActionKind.TOOL, "café").isPresent());
    }

    @Test
    void shouldUnregisterAndAllowReRegistration() {
        registry.register(ActionKind.CAPABILITY, "summarize", ECHO);

        assertTrue(registry.unregister(ActionKind.CAPABILITY, "summarize"));
        assertFalse(registry.unregister(ActionKind.CAPABILITY, "summarize"));
        assertTrue(registry.resolve(ActionKind.CAPABILITY, "summarize").isEmpty());

        registry.register(ActionKind.CAPABILITY, "summarize", SEARCH);
        assertSame(SEARCH, registry.resolve(ActionKind.CAPABILITY, "summarize").orElseThrow().handler());
    }

    @Test
    void shouldListNamesSortedPerNamespace() {
        registry.register(ActionKind.TOOL, "zeta", ECHO);
        registry.register(ActionKind.TOOL, "alpha", ECHO);
        registry.register(ActionKind.CAPABILITY, "beta", ECHO);

        assertEquals(List.of("alpha", "zeta"), registry.listNames(ActionKind.TOOL));
        assertEquals(List.of("beta"), registry.listNames(ActionKind.CAPABILITY));
    }

    // ==================== components ====================

    @Test
    void shouldRegisterEnabledComponentsAndSkipDisabled() {
        HandlerComponent enabled = component(ActionKind.TOOL, "datetime", true);
        HandlerComponent disabled = component(ActionKind.TOOL, "browser", false);
        HandlerComponent capability = component(ActionKind.CAPABILITY, "planner", true);

        HandlerRegistry fromComponents = new HandlerRegistry(List.of(enabled, disabled, capability));

        assertEquals(List.of("datetime"), fromComponents.listNames(ActionKind.TOOL));
        assertEquals(List.of("planner"), fromComponents.listNames(ActionKind.CAPABILITY));
        assertSame(enabled, fromComponents.resolve(ActionKind.TOOL, "datetime").orElseThrow().handler());
    }

    @Test
    void shouldFailStartupOnDuplicateComponents() {
        HandlerComponent first = component(ActionKind.TOOL, "datetime", true);
        HandlerComponent second = component(ActionKind.TOOL, "datetime", true);

        assertThrows(DuplicateHandlerException.class, () -> new HandlerRegistry(List.of(first, second)));
    }

    // ==================== concurrency ====================

    @Test
    void shouldAcceptExactlyOneOfConcurrentDuplicateRegistrations() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        registry.register(ActionKind.TOOL, "race", params -> "ok");
                        return true;
                    } catch (DuplicateHandlerException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int accepted = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    accepted++;
                }
            }
            assertEquals(1, accepted);
            assertEquals("ok", registry.resolve(ActionKind.TOOL, "race").orElseThrow().handler().invoke(Map.of()));
        } finally {
            pool.shutdownNow();
        }
    }

    private static HandlerComponent component(ActionKind kind, String name, boolean enabled) {
        HandlerComponent component = mock(HandlerComponent.class);
        when(component.getKind()).thenReturn(kind);
        when(component.getName()).thenReturn(name);
        when(component.isEnabled()).thenReturn(enabled);
        return component;
    }
}
