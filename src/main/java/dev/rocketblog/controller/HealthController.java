package dev.rocketblog.controller;

import dev.rocketblog.dto.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Liveness only. Database connectivity is reported by the actuator health endpoint.
 */
@RestController
@Tag(name = "Health", description = "Liveness endpoints")
public class HealthController {

    @GetMapping({"/", "/api/v1/health"})
    @Operation(summary = "Liveness check")
    public Mono<HealthResponse> health() {
        return Mono.just(HealthResponse.ok());
    }
}
