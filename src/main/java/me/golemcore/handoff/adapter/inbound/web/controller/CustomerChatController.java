package me.golemcore.handoff.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.handoff.adapter.inbound.web.dto.CustomerChatRequest;
import me.golemcore.handoff.domain.loop.HandoffLoopController;
import me.golemcore.handoff.domain.model.OutputEvent;
import me.golemcore.handoff.domain.model.TenantContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;

/**
 * Customer chat endpoint. Streams the orchestrator output as Server-Sent
 * Events, one event per {@link OutputEvent}, named after its type.
 */
@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
@Slf4j
public class CustomerChatController {

    private static final String USER_ID_HEADER = "X-User-Id";

    private final HandoffLoopController handoffLoopController;

    @PostMapping(value = "/{customerId}/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<OutputEvent>> chat(
            @PathVariable String customerId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId,
            @RequestBody CustomerChatRequest request) {
        if (request == null || request.getMessages() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "messages are required");
        }
        if (request.getScreenContext() != null && !request.getScreenContext().isEmpty()) {
            log.debug("[API] Chat for customer {} with screen context keys {}", customerId,
                    request.getScreenContext().keySet());
        }
        TenantContext tenant = TenantContext.builder()
                .customerId(customerId)
                .userId(userId)
                .build();

        return handoffLoopController.runHandoffLoop(request.getMessages(), tenant)
                .map(event -> ServerSentEvent.<OutputEvent>builder()
                        .event(event.getType().getWireValue())
                        .data(event)
                        .build());
    }
}
