package me.golemcore.middleware.adapter.inbound.web;

import me.golemcore.middleware.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.middleware.domain.exception.DuplicateHandlerException;
import me.golemcore.middleware.domain.exception.StorageUnavailableException;
import me.golemcore.middleware.domain.model.ActionKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("input is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("input is required", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapDuplicateHandlerToConflict() {
        DuplicateHandlerException ex = new DuplicateHandlerException(ActionKind.CAPABILITY, "planner");

        StepVerifier.create(handler.handleDuplicateHandler(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertEquals("Capability 'planner' is already registered", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapStorageUnavailableToServiceUnavailable() {
        StepVerifier.create(handler.handleStorageUnavailable(new StorageUnavailableException("disk gone")))
                .assertNext(response -> assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new IllegalStateException("secret internals")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
