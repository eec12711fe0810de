package com.gbu.workshophub.modules.legacy;

import com.gbu.workshophub.security.JwtTokenProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LegacyWorkshopController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("LegacyWorkshopController")
class LegacyWorkshopControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LegacyWorkshopService legacyWorkshopService;

    @MockitoBean
    private JwtTokenProvider jwtTokenProvider;

    private static LegacyWorkshop workshop() {
        LegacyWorkshop w = new LegacyWorkshop();
        w.setId("w-1");
        w.setTitle("Testing");
        w.setCapacity(3);
        w.setDeliveryMode("online");
        return w;
    }

    @Test
    @DisplayName("successful calls are wrapped in a success envelope")
    void create_envelope() throws Exception {
        when(legacyWorkshopService.createWorkshop(anyMap())).thenReturn(workshop());

        mockMvc.perform(post("/api/workshop")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"Testing\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value("w-1"))
                .andExpect(jsonPath("$.data.registration_count").value(0))
                .andExpect(jsonPath("$.data.signup_enabled").value(true))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    @DisplayName("malformed JSON is a 400 failure envelope")
    void create_malformed() throws Exception {
        mockMvc.perform(post("/api/workshop")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Request body must be valid JSON"))
                .andExpect(jsonPath("$.data").isMap());
    }

    @Test
    @DisplayName("service errors keep their status in the envelope")
    void get_notFound() throws Exception {
        when(legacyWorkshopService.getWorkshop("missing")).thenThrow(LegacyApiException.workshopNotFound("missing"));

        mockMvc.perform(get("/api/workshop/{id}", "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Workshop with ID 'missing' does not exist"));
    }

    @Test
    @DisplayName("a full workshop is 409")
    void register_full() throws Exception {
        when(legacyWorkshopService.register(eq("w-1"), any()))
                .thenThrow(new LegacyApiException(HttpStatus.CONFLICT, LegacyWorkshopService.WORKSHOP_FULL));

        mockMvc.perform(post("/api/workshop/{id}/register", "w-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"participant_name\": \"Sam\", \"participant_email\": \"sam@example.com\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value(LegacyWorkshopService.WORKSHOP_FULL));
    }

    @Test
    @DisplayName("the email query parameter reaches the service")
    void challenges_passEmail() throws Exception {
        when(legacyWorkshopService.getChallengesForParticipant("w-1", "sam@example.com")).thenReturn(List.of());

        mockMvc.perform(get("/api/workshop/{id}/challenges", "w-1").param("email", "sam@example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    @DisplayName("unexpected failures become a generic 500 envelope")
    void list_unexpected() throws Exception {
        when(legacyWorkshopService.listWorkshops()).thenThrow(new IllegalStateException("disk on fire"));

        mockMvc.perform(get("/api/workshop"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("An unexpected error occurred. Please try again later."));
    }
}
