package com.microshop.orderservice.client;

import com.microshop.common.dto.UserResponse;
import com.microshop.orderservice.config.UserServiceProperties;
import com.microshop.orderservice.exception.ExternalServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Blocking HTTP client for {@code GET /users/{id}} on user-service.
 * A 404 means the user does not exist, every other failure means "unknown".
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserServiceClient implements UserLookup {

    private final WebClient userServiceWebClient;
    private final UserServiceProperties properties;

    @Override
    public Optional<UserResponse> findUserById(Long userId) {
        log.debug("Looking up user in user-service: userId={}", userId);
        Optional<UserResponse> user;
        try {
            user = userServiceWebClient.get()
                    .uri("/users/{id}", userId)
                    .<UserResponse>exchangeToMono(response -> {
                        if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            return response.releaseBody().then(Mono.empty());
                        }
                        if (response.statusCode().is2xxSuccessful()) {
                            return response.bodyToMono(UserResponse.class)
                                    .switchIfEmpty(Mono.error(new IllegalStateException("Empty response body")));
                        }
                        return response.createError();
                    })
                    .timeout(properties.getTimeout())
                    .blockOptional();
        } catch (RuntimeException e) {
            log.error("user-service lookup failed: userId={}, error={}", userId, e.getMessage());
            throw new ExternalServiceException("User service is unavailable, could not validate user " + userId, e);
        }

        if (user.isPresent() && !userId.equals(user.get().getId())) {
            log.error("user-service returned a mismatched user: requested={}, received={}",
                    userId, user.get().getId());
            throw new ExternalServiceException("User service returned an invalid response for user " + userId);
        }

        return user;
    }
}
