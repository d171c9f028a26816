package com.example.orchestrator.infrastructure.config;

import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * {@code GET /actuator/activerequests}: order requests currently in flight.
 */
@Component
@Endpoint(id = "activerequests")
public class ActiveRequestsEndpoint {

    private final GracefulShutdownConfig gracefulShutdownConfig;

    public ActiveRequestsEndpoint(GracefulShutdownConfig gracefulShutdownConfig) {
        this.gracefulShutdownConfig = gracefulShutdownConfig;
    }

    @ReadOperation
    public Map<String, Object> inFlightOrders() {
        int inFlight = gracefulShutdownConfig.getInFlightOrderCount();
        return Map.of(
                "activeRequests", inFlight,
                "status", inFlight == 0 ? "IDLE" : "BUSY"
        );
    }
}
