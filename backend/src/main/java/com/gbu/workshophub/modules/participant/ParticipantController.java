package com.gbu.workshophub.modules.participant;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/workshops")
@RequiredArgsConstructor
@Tag(name = "Participants", description = "Join requests and participant management")
public class ParticipantController {

    private final ParticipantService participantService;

    @PostMapping("/{workshopId}/join")
    @Operation(summary = "Request to join a workshop")
    public ResponseEntity<ParticipantService.ParticipantDto> join(@PathVariable UUID workshopId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(participantService.join(workshopId));
    }

    @GetMapping("/joined")
    @Operation(summary = "List the caller's participations")
    public ResponseEntity<List<ParticipantService.JoinedWorkshopDto>> getJoinedWorkshops() {
        return ResponseEntity.ok(participantService.getMyParticipations());
    }

    @GetMapping("/{workshopId}/participants")
    @Operation(summary = "List participants grouped by status, or filtered by one status (owner only)")
    public ResponseEntity<?> getParticipants(@PathVariable UUID workshopId,
            @RequestParam(required = false) String status) {
        if (status == null) {
            return ResponseEntity.ok(participantService.getParticipantsGrouped(workshopId));
        }
        return ResponseEntity.ok(participantService.getParticipantsByStatus(workshopId, status));
    }

    @PatchMapping("/{workshopId}/participants/{participantId}")
    @Operation(summary = "Approve, reject or waitlist a participant (owner only)")
    public ResponseEntity<ParticipantService.ParticipantDto> updateStatus(@PathVariable UUID workshopId,
            @PathVariable UUID participantId,
            @RequestBody ParticipantService.UpdateStatusRequest request) {
        return ResponseEntity.ok(participantService.updateStatus(workshopId, participantId, request.getStatus()));
    }

    @DeleteMapping("/{workshopId}/participants/{participantId}")
    @Operation(summary = "Remove a participant (owner, or the participant themself)")
    public ResponseEntity<Void> remove(@PathVariable UUID workshopId, @PathVariable UUID participantId) {
        participantService.remove(workshopId, participantId);
        return ResponseEntity.noContent().build();
    }
}
