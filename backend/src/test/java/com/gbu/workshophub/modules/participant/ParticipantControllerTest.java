package com.gbu.workshophub.modules.participant;

import com.gbu.workshophub.exception.ConflictException;
import com.gbu.workshophub.modules.participant.ParticipantService.ParticipantDto;
import com.gbu.workshophub.security.JwtTokenProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ParticipantController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("ParticipantController")
class ParticipantControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ParticipantService participantService;

    @MockitoBean
    private JwtTokenProvider jwtTokenProvider;

    private static ParticipantDto participant(UUID workshopId, Participant.ParticipantStatus status) {
        return ParticipantDto.builder()
                .id(UUID.randomUUID())
                .workshopId(workshopId)
                .userId(UUID.randomUUID())
                .userName("Learner")
                .userEmail("learner@example.com")
                .status(status)
                .build();
    }

    @Test
    @DisplayName("POST /join returns 201 with a pending participation")
    void join_created() throws Exception {
        UUID workshopId = UUID.randomUUID();
        when(participantService.join(workshopId))
                .thenReturn(participant(workshopId, Participant.ParticipantStatus.PENDING));

        mockMvc.perform(post("/api/workshops/{id}/join", workshopId))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.workshop_id").value(workshopId.toString()));
    }

    @Test
    @DisplayName("POST /join twice is 409 ALREADY_JOINED")
    void join_conflict() throws Exception {
        UUID workshopId = UUID.randomUUID();
        when(participantService.join(workshopId)).thenThrow(new ConflictException("ALREADY_JOINED",
                "You have already joined this workshop with status: pending"));

        mockMvc.perform(post("/api/workshops/{id}/join", workshopId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_JOINED"))
                .andExpect(jsonPath("$.error").value("You have already joined this workshop with status: pending"));
    }

    @Test
    @DisplayName("GET /participants without a filter returns every status bucket")
    void list_grouped() throws Exception {
        UUID workshopId = UUID.randomUUID();
        Map<String, List<ParticipantDto>> grouped = new LinkedHashMap<>();
        grouped.put("pending", new ArrayList<>());
        grouped.put("joined", List.of(participant(workshopId, Participant.ParticipantStatus.JOINED)));
        grouped.put("rejected", new ArrayList<>());
        grouped.put("waitlisted", new ArrayList<>());
        when(participantService.getParticipantsGrouped(workshopId)).thenReturn(grouped);

        mockMvc.perform(get("/api/workshops/{id}/participants", workshopId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending").isEmpty())
                .andExpect(jsonPath("$.joined.length()").value(1))
                .andExpect(jsonPath("$.waitlisted").isArray());
    }

    @Test
    @DisplayName("GET /participants?status= returns a flat list")
    void list_filtered() throws Exception {
        UUID workshopId = UUID.randomUUID();
        when(participantService.getParticipantsByStatus(workshopId, "waitlisted"))
                .thenReturn(List.of(participant(workshopId, Participant.ParticipantStatus.WAITLISTED)));

        mockMvc.perform(get("/api/workshops/{id}/participants", workshopId).param("status", "waitlisted"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("waitlisted"));
    }

    @Test
    @DisplayName("PATCH /participants/{pid} passes the raw status to the service")
    void updateStatus_ok() throws Exception {
        UUID workshopId = UUID.randomUUID();
        UUID participantId = UUID.randomUUID();
        when(participantService.updateStatus(workshopId, participantId, "joined"))
                .thenReturn(participant(workshopId, Participant.ParticipantStatus.JOINED));

        mockMvc.perform(patch("/api/workshops/{w}/participants/{p}", workshopId, participantId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"joined\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("joined"));
    }

    @Test
    @DisplayName("DELETE /participants/{pid} returns 204")
    void remove_noContent() throws Exception {
        UUID workshopId = UUID.randomUUID();
        UUID participantId = UUID.randomUUID();

        mockMvc.perform(delete("/api/workshops/{w}/participants/{p}", workshopId, participantId))
                .andExpect(status().isNoContent());
        verify(participantService).remove(workshopId, participantId);
    }
}
