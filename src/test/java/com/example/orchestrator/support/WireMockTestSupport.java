package com.example.orchestrator.support;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import static com.github.tomakehurst.wiremock.client.WireMock.*;

/**
 * Base class for integration tests that use WireMock and H2 in-memory database.
 * Provides WireMock servers standing in for the user service and the payment service.
 *
 * Note: For Testcontainers PostgreSQL tests, extend PostgresTestContainerSupport instead.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@ActiveProfiles("test")
public abstract class WireMockTestSupport {

    // Static servers initialized at class loading time (before @DynamicPropertySource)
    protected static WireMockServer userServer;
    protected static WireMockServer paymentServer;

    static {
        userServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        paymentServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());

        userServer.start();
        paymentServer.start();

        // Ensure servers are stopped when JVM exits
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            userServer.stop();
            paymentServer.stop();
        }));
    }

    @BeforeEach
    void resetStateBeforeTest() {
        userServer.resetAll();
        paymentServer.resetAll();
    }

    @AfterEach
    void resetWireMockServers() {
        userServer.resetAll();
        paymentServer.resetAll();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        // WireMock service URLs
        registry.add("services.user.base-url", () -> userServer.baseUrl());
        registry.add("services.payment.base-url", () -> paymentServer.baseUrl());

        // H2 in-memory database configuration (for portability)
        registry.add("spring.datasource.url", () -> "jdbc:h2:mem:orderdb_test;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE");
        registry.add("spring.datasource.username", () -> "sa");
        registry.add("spring.datasource.password", () -> "");
        registry.add("spring.datasource.driver-class-name", () -> "org.h2.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
        registry.add("spring.jpa.properties.hibernate.dialect", () -> "org.hibernate.dialect.H2Dialect");
    }

    // ==================== User Service Stubs ====================

    /**
     * Stubs user service to confirm the user exists (200).
     */
    protected void stubUserExists(long userId) {
        userServer.stubFor(get(urlPathEqualTo("/users/get"))
                .withQueryParam("id", equalTo(String.valueOf(userId)))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "id": %d,
                                    "name": "Alice"
                                }
                                """.formatted(userId))));
    }

    /**
     * Stubs user service to report an unknown user (404).
     */
    protected void stubUserNotFound(long userId) {
        userServer.stubFor(get(urlPathEqualTo("/users/get"))
                .withQueryParam("id", equalTo(String.valueOf(userId)))
                .willReturn(aResponse()
                        .withStatus(404)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "error": "user not found"
                                }
                                """)));
    }

    /**
     * Stubs user service with a delay (for timeout testing).
     */
    protected void stubUserWithDelay(long userId, int delayMs) {
        userServer.stubFor(get(urlPathEqualTo("/users/get"))
                .withQueryParam("id", equalTo(String.valueOf(userId)))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withFixedDelay(delayMs)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "id": %d,
                                    "name": "Alice"
                                }
                                """.formatted(userId))));
    }

    // ==================== Payment Stubs ====================

    /**
     * Stubs payment service to accept the charge (200).
     */
    protected void stubPaymentSuccess() {
        paymentServer.stubFor(post(urlEqualTo("/payments"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "status": "ok"
                                }
                                """)));
    }

    /**
     * Stubs payment service to reject the charge with the given status.
     */
    protected void stubPaymentRejected(int status) {
        paymentServer.stubFor(post(urlEqualTo("/payments"))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "error": "payment declined"
                                }
                                """)));
    }

    /**
     * Stubs payment service with a delay (for timeout testing).
     */
    protected void stubPaymentWithDelay(int delayMs) {
        paymentServer.stubFor(post(urlEqualTo("/payments"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withFixedDelay(delayMs)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "status": "ok"
                                }
                                """)));
    }

    // ==================== Verification Helpers ====================

    /**
     * Verifies that user service was called exactly n times.
     */
    protected void verifyUserLookupCalledTimes(int count) {
        userServer.verify(count, getRequestedFor(urlPathEqualTo("/users/get")));
    }

    /**
     * Verifies that payment service was called exactly n times.
     */
    protected void verifyPaymentCalledTimes(int count) {
        paymentServer.verify(count, postRequestedFor(urlEqualTo("/payments")));
    }

    /**
     * Verifies that payment service was charged for the given order and amount.
     */
    protected void verifyPaymentCalledFor(long orderId, String amount) {
        paymentServer.verify(postRequestedFor(urlEqualTo("/payments"))
                .withHeader("Content-Type", containing("application/json"))
                .withRequestBody(equalToJson("""
                        {
                            "order_id": %d,
                            "amount": %s
                        }
                        """.formatted(orderId, amount))));
    }
}
