package com.gbu.workshophub.modules.workshop;

import com.gbu.workshophub.modules.workshop.dto.*;
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
@RequestMapping("/api/workshops")
@RequiredArgsConstructor
@Tag(name = "Workshops", description = "Workshop management endpoints")
public class WorkshopController {

    private final WorkshopService workshopService;

    @PostMapping
    @Operation(summary = "Create a workshop owned by the caller")
    public ResponseEntity<WorkshopDto> createWorkshop(@Valid @RequestBody CreateWorkshopRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workshopService.createWorkshop(request));
    }

    @GetMapping
    @Operation(summary = "List all workshops (public)")
    public ResponseEntity<List<WorkshopDto>> getWorkshops() {
        return ResponseEntity.ok(workshopService.getAllWorkshops());
    }

    @GetMapping("/my")
    @Operation(summary = "List workshops owned by the caller")
    public ResponseEntity<List<WorkshopDto>> getMyWorkshops() {
        return ResponseEntity.ok(workshopService.getMyWorkshops());
    }

    @GetMapping("/{workshopId}")
    @Operation(summary = "Get workshop details (public)")
    public ResponseEntity<WorkshopDto> getWorkshop(@PathVariable UUID workshopId) {
        return ResponseEntity.ok(workshopService.getWorkshop(workshopId));
    }

    @PatchMapping("/{workshopId}")
    @Operation(summary = "Update workshop fields (owner only)")
    public ResponseEntity<WorkshopDto> updateWorkshop(@PathVariable UUID workshopId,
            @Valid @RequestBody UpdateWorkshopRequest request) {
        return ResponseEntity.ok(workshopService.updateWorkshop(workshopId, request));
    }

    @DeleteMapping("/{workshopId}")
    @Operation(summary = "Delete workshop and all of its content (owner only)")
    public ResponseEntity<Map<String, String>> deleteWorkshop(@PathVariable UUID workshopId) {
        workshopService.deleteWorkshop(workshopId);
        return ResponseEntity.ok(Map.of("message", "Workshop deleted successfully"));
    }
}
