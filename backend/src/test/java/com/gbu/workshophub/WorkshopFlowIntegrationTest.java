package com.gbu.workshophub;

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

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives the authenticated API end to end on an in-memory database: owner creates a
 * workshop, a learner joins and is approved, then earns points through a lesson and an exam.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Workshop flow")
class WorkshopFlowIntegrationTest {

    private static final String PASSWORD = "Str0ng!Pass";

    @Autowired
    private MockMvc mockMvc;

    private String register(String name) throws Exception {
        String email = name.toLowerCase() + "-" + UUID.randomUUID() + "@example.com";
        MvcResult result = mockMvc.perform(post("/api/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"" + name + "\", \"email\": \"" + email + "\", \"password\": \"" + PASSWORD
                        + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.token_type").value("Bearer"))
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.access_token");
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    private String postJson(String token, String url, String body, Object... vars) throws Exception {
        MvcResult result = mockMvc.perform(post(url, vars)
                .header(HttpHeaders.AUTHORIZATION, bearer(token))
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
                .andExpect(status().isCreated())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
    }

    @Test
    @DisplayName("register, create, join, approve, learn and climb the leaderboard")
    void fullFlow() throws Exception {
        String owner = register("Owner");
        String learner = register("Learner");

        String workshopId = postJson(owner, "/api/workshops",
                "{\"title\": \"Java streams\", \"description\": \"Collectors in depth\", \"venue_type\": \"online\"}");

        // owners cannot join their own workshop
        mockMvc.perform(post("/api/workshops/{id}/join", workshopId).header(HttpHeaders.AUTHORIZATION, bearer(owner)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("OWNER_CANNOT_JOIN"));

        MvcResult joined = mockMvc.perform(post("/api/workshops/{id}/join", workshopId)
                .header(HttpHeaders.AUTHORIZATION, bearer(learner)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("pending"))
                .andReturn();
        String participantId = JsonPath.read(joined.getResponse().getContentAsString(), "$.id");

        mockMvc.perform(post("/api/workshops/{id}/join", workshopId).header(HttpHeaders.AUTHORIZATION, bearer(learner)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_JOINED"));

        // a pending participant may not start exams yet
        String examId = postJson(owner, "/api/workshops/{id}/exams",
                "{\"title\": \"Checkpoint\", \"passing_score\": 50, \"points\": 30}", workshopId);
        postJson(owner, "/api/exams/{id}/questions",
                "{\"question_text\": \"Terminal op?\", \"question_type\": \"short_answer\", \"correct_answer\": \"collect\"}",
                examId);
        mockMvc.perform(post("/api/exams/{id}/start", examId).header(HttpHeaders.AUTHORIZATION, bearer(learner)))
                .andExpect(status().isForbidden());

        mockMvc.perform(patch("/api/workshops/{w}/participants/{p}", workshopId, participantId)
                .header(HttpHeaders.AUTHORIZATION, bearer(owner))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"joined\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("joined"))
                .andExpect(jsonPath("$.approved_at").isNotEmpty());

        mockMvc.perform(get("/api/workshops/{id}", workshopId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.participant_count").value(1));

        String lessonId = postJson(owner, "/api/workshops/{id}/lessons",
                "{\"title\": \"Collectors\", \"points\": 15}", workshopId);

        mockMvc.perform(post("/api/lessons/{id}/complete", lessonId).header(HttpHeaders.AUTHORIZATION, bearer(learner)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Lesson completed"))
                .andExpect(jsonPath("$.points_earned").value(15))
                .andExpect(jsonPath("$.total_points").value(15));

        // completing again pays nothing more
        mockMvc.perform(post("/api/lessons/{id}/complete", lessonId).header(HttpHeaders.AUTHORIZATION, bearer(learner)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_points").value(15));

        MvcResult started = mockMvc.perform(post("/api/exams/{id}/start", examId)
                .header(HttpHeaders.AUTHORIZATION, bearer(learner)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.exam.questions[0].correct_answer").doesNotExist())
                .andReturn();
        String attemptId = JsonPath.read(started.getResponse().getContentAsString(), "$.id");
        String questionId = JsonPath.read(started.getResponse().getContentAsString(), "$.exam.questions[0].id");

        mockMvc.perform(post("/api/attempts/{id}/submit", attemptId)
                .header(HttpHeaders.AUTHORIZATION, bearer(learner))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"answers\": {\"" + questionId + "\": \"  Collect \"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(100))
                .andExpect(jsonPath("$.passed").value(true))
                .andExpect(jsonPath("$.points_earned").value(30));

        mockMvc.perform(get("/api/me/points").header(HttpHeaders.AUTHORIZATION, bearer(learner)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.points.total_points").value(45))
                .andExpect(jsonPath("$.points.lessons_completed").value(1))
                .andExpect(jsonPath("$.points.exams_passed").value(1));

        mockMvc.perform(get("/api/workshops/{id}/leaderboard", workshopId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.workshop_title").value("Java streams"))
                .andExpect(jsonPath("$.leaderboard[0].total_points").value(45))
                .andExpect(jsonPath("$.leaderboard[0].lessons_completed").value(1));

        mockMvc.perform(get("/api/leaderboard").header(HttpHeaders.AUTHORIZATION, bearer(learner)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_user_rank.rank").isNumber());
    }
}
