package com.gbu.workshophub.modules.challenge;

import com.gbu.workshophub.modules.challenge.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Challenges", description = "Challenges, submissions and reviews")
public class ChallengeController {

    private final ChallengeService challengeService;

    @PostMapping("/workshops/{workshopId}/challenges")
    @Operation(summary = "Create a challenge (owner only)")
    public ResponseEntity<ChallengeDto> createChallenge(@PathVariable UUID workshopId,
            @Valid @RequestBody CreateChallengeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(challengeService.createChallenge(workshopId, request));
    }

    @GetMapping("/workshops/{workshopId}/challenges")
    @Operation(summary = "List a workshop's challenges")
    public ResponseEntity<List<ChallengeDto>> getChallenges(@PathVariable UUID workshopId) {
        return ResponseEntity.ok(challengeService.getChallenges(workshopId));
    }

    @GetMapping("/challenges/{challengeId}")
    @Operation(summary = "Get a challenge")
    public ResponseEntity<ChallengeDto> getChallenge(@PathVariable UUID challengeId) {
        return ResponseEntity.ok(challengeService.getChallenge(challengeId));
    }

    @PatchMapping("/challenges/{challengeId}")
    @Operation(summary = "Update a challenge (owner only)")
    public ResponseEntity<ChallengeDto> updateChallenge(@PathVariable UUID challengeId,
            @Valid @RequestBody UpdateChallengeRequest request) {
        return ResponseEntity.ok(challengeService.updateChallenge(challengeId, request));
    }

    @DeleteMapping("/challenges/{challengeId}")
    @Operation(summary = "Delete a challenge (owner only)")
    public ResponseEntity<Map<String, String>> deleteChallenge(@PathVariable UUID challengeId) {
        challengeService.deleteChallenge(challengeId);
        return ResponseEntity.ok(Map.of("message", "Challenge deleted"));
    }

    @PostMapping("/challenges/{challengeId}/submit")
    @Operation(summary = "Submit (or resubmit) a solution as a joined participant")
    public ResponseEntity<SubmissionDto> submit(@PathVariable UUID challengeId,
            @Valid @RequestBody SubmitChallengeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(challengeService.submit(challengeId, request));
    }

    @GetMapping("/challenges/{challengeId}/submissions")
    @Operation(summary = "List submissions for a challenge (owner only)")
    public ResponseEntity<List<SubmissionDto>> getSubmissions(@PathVariable UUID challengeId) {
        return ResponseEntity.ok(challengeService.getSubmissions(challengeId));
    }

    @PostMapping("/submissions/{submissionId}/review")
    @Operation(summary = "Mark a submission passed or failed (owner only)")
    public ResponseEntity<SubmissionDto> review(@PathVariable UUID submissionId,
            @Valid @RequestBody ReviewSubmissionRequest request) {
        return ResponseEntity.ok(challengeService.review(submissionId, request));
    }
}
