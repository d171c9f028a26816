package com.example.orchestrator.infrastructure.adapter.out.user;

import com.example.orchestrator.application.port.out.UserDirectoryPort;
import com.example.orchestrator.domain.model.UserId;
import io.github.resilience4j.timelimiter.annotation.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Adapter for the user directory: {@code GET /users/get?id=<id>}.
 * A 200 means the user exists; any other status means it does not.
 * Transport errors and timeouts are reported as an unavailable directory.
 */
@Component
public class UserDirectoryAdapter implements UserDirectoryPort {

    private static final Logger log = LoggerFactory.getLogger(UserDirectoryAdapter.class);

    private final WebClient webClient;

    public UserDirectoryAdapter(@Qualifier("userDirectoryWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @TimeLimiter(name = "userDirectoryTL", fallbackMethod = "lookupUserTimeoutFallback")
    public CompletableFuture<UserLookupResult> lookupUser(UserId userId) {
        log.debug("Looking up user: {}", userId);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/users/get")
                        .queryParam("id", userId.getValue())
                        .build())
                .exchangeToMono(response -> {
                    int statusCode = response.statusCode().value();
                    UserLookupResult result = statusCode == HttpStatus.OK.value()
                            ? UserLookupResult.found()
                            : UserLookupResult.notFound();
                    log.debug("User directory answered {} for user {}", statusCode, userId);
                    return response.releaseBody().thenReturn(result);
                })
                .onErrorResume(throwable -> {
                    log.warn("User directory call failed for user {}: {}", userId, throwable.toString());
                    return Mono.just(UserLookupResult.unavailable(throwable.getClass().getSimpleName()));
                })
                .toFuture();
    }

    /**
     * Fallback when the lookup exceeds the time limit.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<UserLookupResult> lookupUserTimeoutFallback(UserId userId, TimeoutException ex) {
        log.warn("User directory timed out for user: {}", userId);
        return CompletableFuture.completedFuture(UserLookupResult.unavailable("timeout"));
    }
}
