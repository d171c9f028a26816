package com.example.orchestrator.infrastructure.adapter.out.payment.mapper;

import com.example.orchestrator.application.port.out.PaymentPort.PaymentResult;
import com.example.orchestrator.domain.model.Money;
import com.example.orchestrator.domain.model.OrderId;
import com.example.orchestrator.infrastructure.adapter.out.payment.dto.PaymentRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;

/**
 * Mapper between domain objects and payment processor messages.
 */
@Component
public class PaymentMapper {

    public PaymentRequest toRequest(OrderId orderId, Money amount) {
        return PaymentRequest.of(orderId.getValue(), amount.getAmount());
    }

    /**
     * Only 200 counts as a successful charge.
     */
    public PaymentResult toResult(HttpStatusCode statusCode) {
        int value = statusCode.value();
        return value == HttpStatus.OK.value()
                ? PaymentResult.success(value)
                : PaymentResult.rejected(value);
    }
}
