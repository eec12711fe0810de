package com.gbu.workshophub.modules.lesson;

import com.gbu.workshophub.modules.lesson.dto.*;
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
@Tag(name = "Lessons", description = "Lessons, materials and completion")
public class LessonController {

    private final LessonService lessonService;

    @PostMapping("/workshops/{workshopId}/lessons")
    @Operation(summary = "Add a lesson to a workshop (owner only)")
    public ResponseEntity<LessonDto> createLesson(@PathVariable UUID workshopId,
            @Valid @RequestBody CreateLessonRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(lessonService.createLesson(workshopId, request));
    }

    @GetMapping("/workshops/{workshopId}/lessons")
    @Operation(summary = "List a workshop's lessons in order, with materials")
    public ResponseEntity<List<LessonDto>> getLessons(@PathVariable UUID workshopId) {
        return ResponseEntity.ok(lessonService.getLessons(workshopId));
    }

    @GetMapping("/lessons/{lessonId}")
    @Operation(summary = "Get a lesson with its materials")
    public ResponseEntity<LessonDto> getLesson(@PathVariable UUID lessonId) {
        return ResponseEntity.ok(lessonService.getLesson(lessonId));
    }

    @PatchMapping("/lessons/{lessonId}")
    @Operation(summary = "Update a lesson (owner only)")
    public ResponseEntity<LessonDto> updateLesson(@PathVariable UUID lessonId,
            @Valid @RequestBody UpdateLessonRequest request) {
        return ResponseEntity.ok(lessonService.updateLesson(lessonId, request));
    }

    @DeleteMapping("/lessons/{lessonId}")
    @Operation(summary = "Delete a lesson (owner only)")
    public ResponseEntity<Map<String, String>> deleteLesson(@PathVariable UUID lessonId) {
        lessonService.deleteLesson(lessonId);
        return ResponseEntity.ok(Map.of("message", "Lesson deleted successfully"));
    }

    @PostMapping("/lessons/{lessonId}/complete")
    @Operation(summary = "Mark a lesson completed and collect its points")
    public ResponseEntity<LessonCompletionDto> completeLesson(@PathVariable UUID lessonId) {
        return ResponseEntity.ok(lessonService.completeLesson(lessonId));
    }

    @PostMapping("/lessons/{lessonId}/materials")
    @Operation(summary = "Attach a material to a lesson (owner only)")
    public ResponseEntity<MaterialDto> addMaterial(@PathVariable UUID lessonId,
            @Valid @RequestBody CreateMaterialRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(lessonService.addMaterial(lessonId, request));
    }

    @DeleteMapping("/materials/{materialId}")
    @Operation(summary = "Delete a material (owner only)")
    public ResponseEntity<Map<String, String>> deleteMaterial(@PathVariable UUID materialId) {
        lessonService.deleteMaterial(materialId);
        return ResponseEntity.ok(Map.of("message", "Material deleted successfully"));
    }
}
