package com.microshop.userservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microshop.userservice.dto.CreateUserRequest;
import com.microshop.userservice.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class UserApiIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetTable() {
        // restart the identity so the first user of every test gets id 1
        jdbcTemplate.execute("TRUNCATE TABLE users RESTART IDENTITY");
    }

    private JsonNode createUser(String firstName, String lastName, String email) throws Exception {
        CreateUserRequest request = CreateUserRequest.builder()
                .firstName(firstName)
                .lastName(lastName)
                .email(email)
                .build();

        MvcResult result = mockMvc.perform(post("/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn();

        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    void should_assign_id_1_to_first_user_and_return_it_on_lookup() throws Exception {
        JsonNode created = createUser("John", "Doe", "john@example.com");

        assertThat(created.get("id").asLong()).isEqualTo(1L);

        mockMvc.perform(get("/users/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.firstName").value("John"))
                .andExpect(jsonPath("$.lastName").value("Doe"))
                .andExpect(jsonPath("$.email").value("john@example.com"));
    }

    @Test
    void should_assign_unique_ids_for_distinct_emails() throws Exception {
        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            JsonNode created = createUser("User" + i, "Test", "user" + i + "@example.com");
            ids.add(created.get("id").asLong());
        }

        assertThat(ids).hasSize(5);
        assertThat(userRepository.count()).isEqualTo(5);

        mockMvc.perform(get("/users"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(5)));
    }

    @Test
    void should_return_404_for_unknown_user() throws Exception {
        mockMvc.perform(get("/users/999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"));
    }

    @Test
    void should_return_409_when_email_already_used() throws Exception {
        createUser("John", "Doe", "john@example.com");

        CreateUserRequest duplicate = CreateUserRequest.builder()
                .firstName("Johnny")
                .lastName("Doe")
                .email("john@example.com")
                .build();

        mockMvc.perform(post("/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(duplicate)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("DUPLICATE_RESOURCE"));

        assertThat(userRepository.count()).isEqualTo(1);
    }
}
