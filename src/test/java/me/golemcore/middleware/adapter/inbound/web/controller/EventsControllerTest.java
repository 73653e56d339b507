package me.golemcore.middleware.adapter.inbound.web.controller;

import me.golemcore.middleware.domain.exception.StorageUnavailableException;
import me.golemcore.middleware.domain.model.ActivityTypes;
import me.golemcore.middleware.domain.model.EventQuery;
import me.golemcore.middleware.domain.model.LogEntry;
import me.golemcore.middleware.domain.service.EventLogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventsControllerTest {

    private EventLogService eventLogService;
    private EventsController controller;

    @BeforeEach
    void setUp() {
        eventLogService = mock(EventLogService.class);
        controller = new EventsController(eventLogService);
    }

    @Test
    void shouldReturnFilteredEvents() {
        LogEntry entry = LogEntry.builder()
                .timestamp(Instant.parse("2026-03-01T12:00:00Z"))
                .activityType(ActivityTypes.TOOL_USAGE)
                .agentName("agent-a")
                .build();
        when(eventLogService.query(any(EventQuery.class), eq(20))).thenReturn(List.of(entry));

        StepVerifier.create(controller.getEvents(ActivityTypes.TOOL_USAGE, "agent-a", 20))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(List.of(entry), response.getBody());
                })
                .verifyComplete();

        ArgumentCaptor<EventQuery> captor = ArgumentCaptor.forClass(EventQuery.class);
        verify(eventLogService).query(captor.capture(), eq(20));
        assertEquals(ActivityTypes.TOOL_USAGE, captor.getValue().getActivityType());
        assertEquals("agent-a", captor.getValue().getAgentName());
    }

    @Test
    void shouldTreatBlankFiltersAsAbsent() {
        when(eventLogService.query(any(EventQuery.class), anyInt())).thenReturn(List.of());

        StepVerifier.create(controller.getEvents(" ", "", 50))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<EventQuery> captor = ArgumentCaptor.forClass(EventQuery.class);
        verify(eventLogService).query(captor.capture(), eq(50));
        assertNull(captor.getValue().getActivityType());
        assertNull(captor.getValue().getAgentName());
    }

    @Test
    void shouldRejectLimitOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> controller.getEvents(null, null, 0));
        assertThrows(IllegalArgumentException.class, () -> controller.getEvents(null, null, 1001));
    }

    @Test
    void shouldPropagateStorageFailure() {
        when(eventLogService.query(any(EventQuery.class), anyInt()))
                .thenThrow(new StorageUnavailableException("unreadable"));

        StepVerifier.create(controller.getEvents(null, null, 10))
                .expectError(StorageUnavailableException.class)
                .verify();
    }
}
