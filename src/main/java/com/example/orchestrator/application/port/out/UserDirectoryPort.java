package com.example.orchestrator.application.port.out;

import com.example.orchestrator.domain.model.UserId;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for the user directory.
 */
public interface UserDirectoryPort {

    /**
     * Looks up a user by id.
     * Implementations report unreachable directories and timeouts as
     * {@link UserLookupStatus#UNAVAILABLE} rather than failing the future.
     *
     * @param userId the user to look up
     * @return future containing the lookup result
     */
    CompletableFuture<UserLookupResult> lookupUser(UserId userId);

    /**
     * Result of a user lookup.
     */
    record UserLookupResult(
            UserLookupStatus status,
            String message
    ) {
        public static UserLookupResult found() {
            return new UserLookupResult(UserLookupStatus.FOUND, null);
        }

        public static UserLookupResult notFound() {
            return new UserLookupResult(UserLookupStatus.NOT_FOUND, "user not found");
        }

        public static UserLookupResult unavailable(String reason) {
            return new UserLookupResult(UserLookupStatus.UNAVAILABLE, "user service unavailable: " + reason);
        }

        public boolean exists() {
            return status == UserLookupStatus.FOUND;
        }
    }

    enum UserLookupStatus {
        FOUND,
        NOT_FOUND,
        UNAVAILABLE
    }
}
