package ch.wordchain.wordchainbackend.web.api.controller;

import ch.wordchain.wordchainbackend.service.SystemStatusService;
import ch.wordchain.wordchainbackend.web.api.dto.SystemStatusDto;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health and status endpoints.
 *
 * <p>{@code /api/health} only confirms that the application context is alive.
 * {@code /api/status} returns a snapshot of rooms, load and metrics for operations.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final SystemStatusService statusService;

    /**
     * Health check endpoint.
     *
     * @return static string {@code "OK"} if the service is up
     */
    @GetMapping("/health")
    public String health() {
        return "OK";
    }

    @Operation(summary = "Get a snapshot of rooms, load and metrics")
    @GetMapping("/status")
    public SystemStatusDto status() {
        return statusService.snapshot();
    }
}
