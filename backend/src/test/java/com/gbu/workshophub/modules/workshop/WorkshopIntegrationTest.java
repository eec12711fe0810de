package com.gbu.workshophub.modules.workshop;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Workshop API")
class WorkshopIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private String registerOwner() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Owner\", \"email\": \"owner-" + UUID.randomUUID()
                        + "@example.com\", \"password\": \"Str0ng!Pass\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        return "Bearer " + JsonPath.read(result.getResponse().getContentAsString(), "$.access_token");
    }

    @Test
    @DisplayName("a PATCH response carries the refreshed updated_at")
    void patch_refreshesUpdatedAt() throws Exception {
        String owner = registerOwner();
        MvcResult created = mockMvc.perform(post("/api/workshops")
                .header(HttpHeaders.AUTHORIZATION, owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"Docker\", \"description\": \"Images and layers\"}"))
                .andExpect(status().isCreated())
                .andReturn();
        String id = JsonPath.read(created.getResponse().getContentAsString(), "$.id");
        MvcResult stored = mockMvc.perform(get("/api/workshops/{id}", id))
                .andExpect(status().isOk())
                .andReturn();
        Instant storedUpdatedAt = Instant.parse(
                JsonPath.read(stored.getResponse().getContentAsString(), "$.updated_at"));

        Thread.sleep(20);

        MvcResult patched = mockMvc.perform(patch("/api/workshops/{id}", id)
                .header(HttpHeaders.AUTHORIZATION, owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"Docker in depth\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Docker in depth"))
                .andReturn();
        Instant patchedUpdatedAt = Instant.parse(
                JsonPath.read(patched.getResponse().getContentAsString(), "$.updated_at"));

        assertThat(patchedUpdatedAt).isAfter(storedUpdatedAt);
    }
}
