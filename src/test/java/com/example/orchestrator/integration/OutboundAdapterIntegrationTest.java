package com.example.orchestrator.integration;

import com.example.orchestrator.application.port.out.PaymentPort;
import com.example.orchestrator.application.port.out.PaymentPort.PaymentResult;
import com.example.orchestrator.application.port.out.PaymentPort.PaymentStatus;
import com.example.orchestrator.application.port.out.UserDirectoryPort;
import com.example.orchestrator.application.port.out.UserDirectoryPort.UserLookupResult;
import com.example.orchestrator.application.port.out.UserDirectoryPort.UserLookupStatus;
import com.example.orchestrator.domain.model.Money;
import com.example.orchestrator.domain.model.OrderId;
import com.example.orchestrator.domain.model.UserId;
import com.example.orchestrator.support.WireMockTestSupport;
import com.github.tomakehurst.wiremock.http.Fault;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the user directory and payment adapters, including
 * their TimeLimiter protection (1s in the test profile).
 */
@DisplayName("Outbound Adapter Integration Tests")
class OutboundAdapterIntegrationTest extends WireMockTestSupport {

    @Autowired
    private UserDirectoryPort userDirectoryPort;

    @Autowired
    private PaymentPort paymentPort;

    @Test
    @DisplayName("should_report_existing_user_on_200")
    void should_report_existing_user_on_200() throws Exception {
        // Given
        stubUserExists(5);

        // When
        UserLookupResult result = userDirectoryPort.lookupUser(UserId.of(5)).get();

        // Then
        assertThat(result.exists()).isTrue();
        userServer.verify(getRequestedFor(urlPathEqualTo("/users/get"))
                .withQueryParam("id", equalTo("5")));
    }

    @Test
    @DisplayName("should_report_missing_user_on_non_200")
    void should_report_missing_user_on_non_200() throws Exception {
        // Given
        stubUserNotFound(5);

        // When
        UserLookupResult result = userDirectoryPort.lookupUser(UserId.of(5)).get();

        // Then
        assertThat(result.status()).isEqualTo(UserLookupStatus.NOT_FOUND);
        assertThat(result.message()).isEqualTo("user not found");
    }

    @Test
    @DisplayName("should_report_unavailable_directory_on_connection_fault")
    void should_report_unavailable_directory_on_connection_fault() throws Exception {
        // Given
        userServer.stubFor(get(urlPathEqualTo("/users/get"))
                .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        // When
        UserLookupResult result = userDirectoryPort.lookupUser(UserId.of(5)).get();

        // Then
        assertThat(result.status()).isEqualTo(UserLookupStatus.UNAVAILABLE);
        assertThat(result.exists()).isFalse();
    }

    @Test
    @DisplayName("should_timeout_slow_user_lookup")
    void should_timeout_slow_user_lookup() throws Exception {
        // Given
        stubUserWithDelay(5, 3000);

        // When
        long startTime = System.currentTimeMillis();
        UserLookupResult result = userDirectoryPort.lookupUser(UserId.of(5)).get();
        long elapsed = System.currentTimeMillis() - startTime;

        // Then
        assertThat(elapsed).isLessThan(2500);
        assertThat(result.status()).isEqualTo(UserLookupStatus.UNAVAILABLE);
    }

    @Test
    @DisplayName("should_send_order_id_and_amount_to_payment")
    void should_send_order_id_and_amount_to_payment() throws Exception {
        // Given
        stubPaymentSuccess();

        // When
        PaymentResult result = paymentPort.processPayment(
                OrderId.of(17), Money.of(new BigDecimal("12.5"))).get();

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.httpStatus()).isEqualTo(200);
        verifyPaymentCalledFor(17, "12.50");
    }

    @Test
    @DisplayName("should_treat_non_200_payment_as_rejected")
    void should_treat_non_200_payment_as_rejected() throws Exception {
        // Given
        stubPaymentRejected(201);

        // When
        PaymentResult result = paymentPort.processPayment(OrderId.of(17), Money.of(BigDecimal.TEN)).get();

        // Then
        assertThat(result.status()).isEqualTo(PaymentStatus.REJECTED);
        assertThat(result.httpStatus()).isEqualTo(201);
        verifyPaymentCalledTimes(1);
    }

    @Test
    @DisplayName("should_timeout_slow_payment")
    void should_timeout_slow_payment() throws Exception {
        // Given
        stubPaymentWithDelay(3000);

        // When
        long startTime = System.currentTimeMillis();
        PaymentResult result = paymentPort.processPayment(OrderId.of(17), Money.of(BigDecimal.TEN)).get();
        long elapsed = System.currentTimeMillis() - startTime;

        // Then
        assertThat(elapsed).isLessThan(2500);
        assertThat(result.status()).isEqualTo(PaymentStatus.UNAVAILABLE);
        assertThat(result.message()).contains("timeout");
    }
}
