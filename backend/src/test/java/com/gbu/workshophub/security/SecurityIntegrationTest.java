package com.gbu.workshophub.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Security")
class SecurityIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @Test
    @DisplayName("a protected route without a header is 401 UNAUTHORIZED")
    void noHeader() throws Exception {
        mockMvc.perform(get("/api/workshops/my"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.error").value("Missing authorization token"))
                .andExpect(jsonPath("$.path").value("/api/workshops/my"));
    }

    @Test
    @DisplayName("a non-bearer scheme is 401 INVALID_AUTH_HEADER")
    void wrongScheme() throws Exception {
        mockMvc.perform(get("/api/workshops/joined").header(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwYXNz"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_AUTH_HEADER"));
    }

    @Test
    @DisplayName("a tampered token is 401 INVALID_TOKEN")
    void badToken() throws Exception {
        mockMvc.perform(post("/api/workshops/{id}/join", UUID.randomUUID())
                .header(HttpHeaders.AUTHORIZATION, "Bearer not.a.jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_TOKEN"));
    }

    @Test
    @DisplayName("public routes ignore a broken token")
    void publicRoute() throws Exception {
        mockMvc.perform(get("/api/workshops").header(HttpHeaders.AUTHORIZATION, "Bearer garbage"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/leaderboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.leaderboard").isArray())
                .andExpect(jsonPath("$.current_user_rank").doesNotExist());
    }

    @Test
    @DisplayName("a valid token for a deleted user fails inside the request, not at the filter")
    void validTokenUnknownUser() throws Exception {
        String token = jwtTokenProvider.generateAccessToken(UUID.randomUUID().toString(), "gone@example.com", "Gone");

        mockMvc.perform(get("/api/users/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
    }
}
