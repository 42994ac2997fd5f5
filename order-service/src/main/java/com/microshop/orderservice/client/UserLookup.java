package com.microshop.orderservice.client;

import com.microshop.common.dto.UserResponse;

import java.util.Optional;

/**
 * Read access to users owned by user-service.
 * order-service depends on this contract only, so tests can swap in a fake.
 */
public interface UserLookup {

    /**
     * Looks up a user by id.
     *
     * @return the user, or empty when user-service answered that it does not exist
     * @throws com.microshop.orderservice.exception.ExternalServiceException when
     *         the answer could not be obtained (unreachable, timeout, error status, bad payload)
     */
    Optional<UserResponse> findUserById(Long userId);
}
