package com.example.orchestrator.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8082}")
    private int serverPort;

    @Bean
    public OpenAPI orderServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Order Service API")
                        .description("""
                                Order service of the user / order / payment example.

                                ## Order creation flow

                                `validate user → insert pending order → charge payment → store final status`

                                - Unknown user or unreachable user service: 400, nothing stored
                                - Store failure: 500, no payment attempted
                                - Payment rejected, unreachable or timed out: 200 with status `payment_failed`
                                - Outbound calls are bounded by timeouts and never retried
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:" + serverPort).description("Local Development")
                ));
    }
}
