package com.example.orchestrator.integration;

import com.example.orchestrator.support.WireMockTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * Integration tests for the {@code activerequests} actuator endpoint.
 */
@DisplayName("Active Requests Endpoint Integration Tests")
class ActiveRequestsEndpointIntegrationTest extends WireMockTestSupport {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    @DisplayName("should_report_idle_without_order_requests")
    void should_report_idle_without_order_requests() {
        webTestClient.get()
                .uri("/actuator/activerequests")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.activeRequests").isEqualTo(0)
                .jsonPath("$.status").isEqualTo("IDLE");
    }
}
