package me.golemcore.handoff.adapter.inbound.web;

import me.golemcore.handoff.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.handoff.domain.session.GenerationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import reactor.test.StepVerifier;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.BAD_REQUEST, "messages are required");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("messages are required", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleIllegalArgumentException() {
        IllegalArgumentException ex = new IllegalArgumentException("Unsupported message role: system");

        StepVerifier.create(handler.handleIllegalArgument(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("Unsupported message role: system", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideGenerationFailureDetails() {
        GenerationException ex = new GenerationException("Model call failed: invalid x-api-key", null);

        StepVerifier.create(handler.handleGeneration(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Failed to process customer chat", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleIllegalStateAsConflict() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("busy")))
                .assertNext(response -> assertEquals(HttpStatus.CONFLICT, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHandleGenericException() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("boom")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
