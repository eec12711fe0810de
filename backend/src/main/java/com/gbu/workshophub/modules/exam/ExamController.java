package com.gbu.workshophub.modules.exam;

import com.gbu.workshophub.modules.exam.dto.*;
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
@Tag(name = "Exams", description = "Exams, questions and attempts")
public class ExamController {

    private final ExamService examService;
    private final ExamAttemptService attemptService;

    @PostMapping("/workshops/{workshopId}/exams")
    @Operation(summary = "Create an exam (owner only)")
    public ResponseEntity<ExamDto> createExam(@PathVariable UUID workshopId,
            @Valid @RequestBody CreateExamRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(examService.createExam(workshopId, request));
    }

    @GetMapping("/workshops/{workshopId}/exams")
    @Operation(summary = "List a workshop's exams")
    public ResponseEntity<List<ExamDto>> getExams(@PathVariable UUID workshopId) {
        return ResponseEntity.ok(examService.getExams(workshopId));
    }

    @GetMapping("/exams/{examId}")
    @Operation(summary = "Get an exam with its questions")
    public ResponseEntity<ExamDto> getExam(@PathVariable UUID examId) {
        return ResponseEntity.ok(examService.getExam(examId));
    }

    @PatchMapping("/exams/{examId}")
    @Operation(summary = "Update an exam (owner only)")
    public ResponseEntity<ExamDto> updateExam(@PathVariable UUID examId, @Valid @RequestBody UpdateExamRequest request) {
        return ResponseEntity.ok(examService.updateExam(examId, request));
    }

    @DeleteMapping("/exams/{examId}")
    @Operation(summary = "Delete an exam (owner only)")
    public ResponseEntity<Map<String, String>> deleteExam(@PathVariable UUID examId) {
        examService.deleteExam(examId);
        return ResponseEntity.ok(Map.of("message", "Exam deleted"));
    }

    @PostMapping("/exams/{examId}/questions")
    @Operation(summary = "Add a question (owner only)")
    public ResponseEntity<QuestionDto> addQuestion(@PathVariable UUID examId,
            @Valid @RequestBody CreateQuestionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(examService.addQuestion(examId, request));
    }

    @PatchMapping("/questions/{questionId}")
    @Operation(summary = "Update a question (owner only)")
    public ResponseEntity<QuestionDto> updateQuestion(@PathVariable UUID questionId,
            @Valid @RequestBody UpdateQuestionRequest request) {
        return ResponseEntity.ok(examService.updateQuestion(questionId, request));
    }

    @DeleteMapping("/questions/{questionId}")
    @Operation(summary = "Delete a question (owner only)")
    public ResponseEntity<Map<String, String>> deleteQuestion(@PathVariable UUID questionId) {
        examService.deleteQuestion(questionId);
        return ResponseEntity.ok(Map.of("message", "Question deleted"));
    }

    @PostMapping("/exams/{examId}/start")
    @Operation(summary = "Start an attempt as a joined participant")
    public ResponseEntity<AttemptDto> startAttempt(@PathVariable UUID examId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(attemptService.startAttempt(examId));
    }

    @PostMapping("/attempts/{attemptId}/submit")
    @Operation(summary = "Submit answers and get graded")
    public ResponseEntity<AttemptDto> submitAttempt(@PathVariable UUID attemptId,
            @RequestBody SubmitAttemptRequest request) {
        return ResponseEntity.ok(attemptService.submitAttempt(attemptId, request.getAnswers()));
    }

    @GetMapping("/exams/{examId}/attempts")
    @Operation(summary = "List the caller's attempts at an exam")
    public ResponseEntity<List<AttemptDto>> getMyAttempts(@PathVariable UUID examId) {
        return ResponseEntity.ok(attemptService.getMyAttempts(examId));
    }
}
