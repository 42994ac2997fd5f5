package com.microshop.userservice.service;

import com.microshop.common.dto.UserResponse;
import com.microshop.userservice.dto.CreateUserRequest;

import java.util.List;

public interface UserService {

    /**
     * Lists every known user. No ordering, no pagination.
     */
    List<UserResponse> listUsers();

    /**
     * Retrieves a single user.
     * Throws ResourceNotFoundException when no user has the given id.
     */
    UserResponse getUser(Long userId);

    /**
     * Creates a user and returns it with its newly assigned id.
     */
    UserResponse createUser(CreateUserRequest request);
}
