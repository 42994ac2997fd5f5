package com.microshop.userservice.service;

import com.microshop.common.dto.UserResponse;
import com.microshop.common.exception.ResourceNotFoundException;
import com.microshop.userservice.dto.CreateUserRequest;
import com.microshop.userservice.mapper.UserMapper;
import com.microshop.userservice.model.User;
import com.microshop.userservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserServiceImpl implements UserService {

    private final UserRepository userRepository;
    private final UserMapper userMapper;

    @Override
    @Transactional(readOnly = true)
    public List<UserResponse> listUsers() {
        return userRepository.findAll().stream()
                .map(userMapper::toUserResponse)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public UserResponse getUser(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> {
                    log.debug("User not found: userId={}", userId);
                    return new ResourceNotFoundException("User not found with id: " + userId);
                });
        return userMapper.toUserResponse(user);
    }

    @Override
    @Transactional
    public UserResponse createUser(CreateUserRequest request) {
        User user = userMapper.toUser(request);

        // duplicate emails are rejected by the unique constraint on insert
        User savedUser = userRepository.save(user);
        log.info("User created: id={}", savedUser.getId());
        return userMapper.toUserResponse(savedUser);
    }
}
