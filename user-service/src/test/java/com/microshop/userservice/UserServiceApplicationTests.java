package com.microshop.userservice;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.microshop.userservice.controller.UserController;
import com.microshop.userservice.mapper.UserMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Starts the full application against the Postgres container.
 */
class UserServiceApplicationTests extends AbstractIntegrationTest {

	@Autowired
	private UserController userController;

	@Autowired
	private UserMapper userMapper;

	@Autowired
	private ObjectMapper objectMapper;

	@Test
	void contextLoads() {
		assertThat(userController).isNotNull();
		assertThat(userMapper).isNotNull();
	}

	@Test
	void sharedJacksonSettingsAreApplied() {
		assertThat(objectMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)).isFalse();
		assertThat(objectMapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)).isFalse();
	}
}
