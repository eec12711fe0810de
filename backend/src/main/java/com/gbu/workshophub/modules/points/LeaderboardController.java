package com.gbu.workshophub.modules.points;

import com.gbu.workshophub.modules.points.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Leaderboard", description = "Points and rankings")
public class LeaderboardController {

    private final PointsService pointsService;

    @GetMapping("/leaderboard")
    @Operation(summary = "Global leaderboard; includes the caller's rank when authenticated")
    public ResponseEntity<LeaderboardResponse> getLeaderboard(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(pointsService.getLeaderboard(limit));
    }

    @GetMapping("/workshops/{workshopId}/leaderboard")
    @Operation(summary = "Leaderboard of a workshop's joined participants")
    public ResponseEntity<WorkshopLeaderboardDto> getWorkshopLeaderboard(@PathVariable UUID workshopId) {
        return ResponseEntity.ok(pointsService.getWorkshopLeaderboard(workshopId));
    }

    @GetMapping("/users/{userId}/points")
    @Operation(summary = "Points and rank of a user")
    public ResponseEntity<PointsSummaryDto> getUserPoints(@PathVariable UUID userId) {
        return ResponseEntity.ok(pointsService.getUserPoints(userId));
    }

    @GetMapping("/me/points")
    @Operation(summary = "Points and rank of the caller")
    public ResponseEntity<PointsSummaryDto> getMyPoints() {
        return ResponseEntity.ok(pointsService.getMyPoints());
    }

    @PostMapping("/leaderboard/update")
    @Operation(summary = "Recompute global rankings")
    public ResponseEntity<Map<String, String>> updateLeaderboard() {
        pointsService.recomputeRankings();
        return ResponseEntity.ok(Map.of("message", "Leaderboard updated"));
    }
}
