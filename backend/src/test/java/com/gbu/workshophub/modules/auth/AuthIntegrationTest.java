package com.gbu.workshophub.modules.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.UUID;
import java.util.stream.Stream;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Auth API")
class AuthIntegrationTest {

    private static final String PASSWORD = "Str0ng!Pass";

    @Autowired
    private MockMvc mockMvc;

    private ResultActions register(String name, String email, String password) throws Exception {
        return mockMvc.perform(post("/api/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"" + name + "\", \"email\": \"" + email + "\", \"password\": \"" + password
                        + "\"}"));
    }

    private ResultActions login(String email, String password) throws Exception {
        return mockMvc.perform(post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\": \"" + email + "\", \"password\": \"" + password + "\"}"));
    }

    private static String uniqueEmail(String local) {
        return local + "-" + UUID.randomUUID() + "@Example.com";
    }

    @Test
    @DisplayName("login ignores email casing and returns the email as registered")
    void login_caseInsensitive() throws Exception {
        String email = uniqueEmail("Mixed.Case");
        register("Mixed Case", email, PASSWORD).andExpect(status().isCreated());

        login(email.toLowerCase(), PASSWORD)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(email))
                .andExpect(jsonPath("$.token_type").value("Bearer"))
                .andExpect(jsonPath("$.access_token").isNotEmpty());

        login(email.toUpperCase(), "Wr0ng!Pass")
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    @DisplayName("registering the same email in another case conflicts")
    void register_duplicateInAnotherCase() throws Exception {
        String email = uniqueEmail("Dup");
        register("First", email, PASSWORD).andExpect(status().isCreated());

        register("Second", email.toUpperCase(), PASSWORD)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_EXISTS"));
    }

    static Stream<Arguments> weakPasswords() {
        return Stream.of(
                Arguments.of("lowercase1!", "at least one uppercase letter"),
                Arguments.of("UPPERCASE1!", "at least one lowercase letter"),
                Arguments.of("NoDigits!!", "at least one number"),
                Arguments.of("NoSpecial12", "at least one special character"),
                Arguments.of("Sh0rt!", "Password must be 8-128 characters"),
                Arguments.of("Aa1!" + "x".repeat(125), "Password must be 8-128 characters"));
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("weakPasswords")
    @DisplayName("register rejects passwords that break a strength rule")
    void register_weakPassword(String password, String message) throws Exception {
        register("Weak", uniqueEmail("weak"), password)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error", containsString(message)));
    }

    static Stream<Arguments> badEmails() {
        return Stream.of(
                Arguments.of("not-an-email", "Invalid email format"),
                Arguments.of("user@localhost", "Invalid email format"),
                Arguments.of("user@example.c", "Invalid email format"),
                Arguments.of("a".repeat(250) + "@example.com", "Email must be less than 255 characters"));
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("badEmails")
    @DisplayName("register rejects malformed or overlong emails")
    void register_badEmail(String email, String message) throws Exception {
        register("Bad Email", email, PASSWORD)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error", containsString(message)));
    }

    @Test
    @DisplayName("a password at exactly the bounds is accepted")
    void register_boundaryPasswords() throws Exception {
        register("Eight", uniqueEmail("eight"), "Ab1!efgh").andExpect(status().isCreated());
        register("Max", uniqueEmail("max"), "Ab1!" + "x".repeat(124)).andExpect(status().isCreated());
    }
}
