package com.gbu.workshophub.modules.legacy;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/workshop")
@RequiredArgsConstructor
@Tag(name = "Legacy workshops", description = "File-backed workshop API without authentication")
public class LegacyWorkshopController {

    private final LegacyWorkshopService legacyWorkshopService;

    @PostMapping
    @Operation(summary = "Create a workshop")
    public ResponseEntity<LegacyResponse<LegacyWorkshop>> createWorkshop(
            @RequestBody(required = false) Map<String, Object> body) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(LegacyResponse.ok(legacyWorkshopService.createWorkshop(body)));
    }

    @GetMapping
    @Operation(summary = "List workshops")
    public ResponseEntity<LegacyResponse<List<LegacyWorkshop>>> listWorkshops() {
        return ResponseEntity.ok(LegacyResponse.ok(legacyWorkshopService.listWorkshops()));
    }

    @GetMapping("/registrations")
    @Operation(summary = "List all registrations")
    public ResponseEntity<LegacyResponse<List<LegacyRegistration>>> listRegistrations() {
        return ResponseEntity.ok(LegacyResponse.ok(legacyWorkshopService.listRegistrations()));
    }

    @GetMapping("/{workshopId}")
    @Operation(summary = "Get a workshop")
    public ResponseEntity<LegacyResponse<LegacyWorkshop>> getWorkshop(@PathVariable String workshopId) {
        return ResponseEntity.ok(LegacyResponse.ok(legacyWorkshopService.getWorkshop(workshopId)));
    }

    @PostMapping("/{workshopId}/challenge")
    @Operation(summary = "Add a challenge to a workshop")
    public ResponseEntity<LegacyResponse<LegacyChallenge>> createChallenge(@PathVariable String workshopId,
            @RequestBody(required = false) Map<String, Object> body) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(LegacyResponse.ok(legacyWorkshopService.createChallenge(workshopId, body)));
    }

    @GetMapping("/{workshopId}/challenges")
    @Operation(summary = "Challenges of an ongoing workshop, for a registered email")
    public ResponseEntity<LegacyResponse<List<LegacyChallenge>>> getChallenges(@PathVariable String workshopId,
            @RequestParam(required = false) String email) {
        return ResponseEntity.ok(LegacyResponse.ok(
                legacyWorkshopService.getChallengesForParticipant(workshopId, email)));
    }

    @PostMapping("/{workshopId}/register")
    @Operation(summary = "Register a participant")
    public ResponseEntity<LegacyResponse<LegacyRegistration>> register(@PathVariable String workshopId,
            @RequestBody(required = false) Map<String, Object> body) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(LegacyResponse.ok(legacyWorkshopService.register(workshopId, body)));
    }

    @PatchMapping("/{workshopId}/status")
    @Operation(summary = "Set workshop status")
    public ResponseEntity<LegacyResponse<LegacyWorkshop>> updateStatus(@PathVariable String workshopId,
            @RequestBody(required = false) Map<String, Object> body) {
        return ResponseEntity.ok(LegacyResponse.ok(legacyWorkshopService.updateStatus(workshopId, body)));
    }

    @PatchMapping("/{workshopId}/signup")
    @Operation(summary = "Enable or disable signups")
    public ResponseEntity<LegacyResponse<LegacyWorkshop>> updateSignup(@PathVariable String workshopId,
            @RequestBody(required = false) Map<String, Object> body) {
        return ResponseEntity.ok(LegacyResponse.ok(legacyWorkshopService.updateSignup(workshopId, body)));
    }
}
