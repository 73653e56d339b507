package me.golemcore.middleware.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.middleware.adapter.inbound.web.dto.HandlersResponse;
import me.golemcore.middleware.domain.model.ActionKind;
import me.golemcore.middleware.domain.service.HandlerRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Lists registered tool and capability names.
 */
@RestController
@RequestMapping("/api/handlers")
@RequiredArgsConstructor
public class HandlersController {

    private final HandlerRegistry handlerRegistry;

    @GetMapping
    public Mono<ResponseEntity<HandlersResponse>> listHandlers() {
        HandlersResponse response = HandlersResponse.builder()
                .tools(handlerRegistry.listNames(ActionKind.TOOL))
                .capabilities(handlerRegistry.listNames(ActionKind.CAPABILITY))
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
