package com.example.orchestrator.infrastructure.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configuration for the WebClient instances used to reach downstream services.
 */
@Configuration
public class WebClientConfig {

    @Value("${services.user.base-url:http://localhost:8081}")
    private String userServiceBaseUrl;

    @Value("${services.user.timeout-ms:3000}")
    private int userServiceTimeoutMs;

    @Value("${services.payment.base-url:http://localhost:8083}")
    private String paymentServiceBaseUrl;

    @Value("${services.payment.timeout-ms:5000}")
    private int paymentServiceTimeoutMs;

    @Value("${services.connect-timeout-ms:2000}")
    private int connectTimeoutMs;

    @Bean
    public WebClient userDirectoryWebClient(WebClient.Builder builder) {
        return createWebClient(builder, userServiceBaseUrl, userServiceTimeoutMs);
    }

    @Bean
    public WebClient paymentWebClient(WebClient.Builder builder) {
        return createWebClient(builder, paymentServiceBaseUrl, paymentServiceTimeoutMs);
    }

    private WebClient createWebClient(WebClient.Builder builder, String baseUrl, int timeoutMs) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .responseTimeout(Duration.ofMillis(timeoutMs))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS)));

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
