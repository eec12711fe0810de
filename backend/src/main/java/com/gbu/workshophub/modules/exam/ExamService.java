package com.gbu.workshophub.modules.exam;

import com.gbu.workshophub.exception.BusinessException;
import com.gbu.workshophub.exception.ResourceNotFoundException;
import com.gbu.workshophub.modules.exam.dto.*;
import com.gbu.workshophub.modules.workshop.Workshop;
import com.gbu.workshophub.modules.workshop.WorkshopService;
import com.gbu.workshophub.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Exam and question authoring. Correct answers leave this service only for the owner.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExamService {

    private final ExamRepository examRepository;
    private final ExamQuestionRepository questionRepository;
    private final ExamAttemptRepository attemptRepository;
    private final WorkshopService workshopService;
    private final SecurityUtils securityUtils;

    // ── Exams ────────────────────────────────────────────────────────────────

    @Transactional
    public ExamDto createExam(UUID workshopId, CreateExamRequest request) {
        Workshop workshop = workshopService.findWorkshop(workshopId);
        workshopService.requireOwner(workshop, "create exams");

        Exam exam = Exam.builder()
                .workshop(workshop)
                .title(requireText(request.getTitle(), "Title"))
                .description(request.getDescription())
                .durationMinutes(request.getDurationMinutes() != null ? request.getDurationMinutes() : 60)
                .passingScore(request.getPassingScore() != null ? request.getPassingScore() : 70)
                .points(request.getPoints() != null ? request.getPoints() : 50)
                .build();

        exam = examRepository.save(exam);
        log.info("Exam {} created in workshop {}", exam.getId(), workshopId);
        return toDto(exam, null, null);
    }

    @Transactional(readOnly = true)
    public List<ExamDto> getExams(UUID workshopId) {
        workshopService.findWorkshop(workshopId);
        return examRepository.findByWorkshopIdOrderByCreatedAtAsc(workshopId).stream()
                .map(e -> toDto(e, null, null))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ExamDto getExam(UUID examId) {
        Exam exam = findExam(examId);
        UUID userId = securityUtils.getCurrentUserId();
        List<ExamQuestion> questions = questionRepository.findByExamIdOrderByOrderIndexAsc(examId);

        if (exam.getWorkshop().isOwnedBy(userId)) {
            return toDto(exam, toQuestionDtos(questions, true), null);
        }
        AttemptDto best = attemptRepository.findBestAttempt(userId, examId)
                .map(ExamService::toAttemptDto)
                .orElse(null);
        return toDto(exam, toQuestionDtos(questions, false), best);
    }

    @Transactional
    public ExamDto updateExam(UUID examId, UpdateExamRequest request) {
        Exam exam = findExam(examId);
        workshopService.requireOwner(exam.getWorkshop(), "update exams");

        if (request.getTitle() != null)
            exam.setTitle(requireText(request.getTitle(), "Title"));
        if (request.getDescription() != null)
            exam.setDescription(request.getDescription());
        if (request.getDurationMinutes() != null)
            exam.setDurationMinutes(request.getDurationMinutes());
        if (request.getPassingScore() != null)
            exam.setPassingScore(request.getPassingScore());
        if (request.getPoints() != null)
            exam.setPoints(request.getPoints());

        return toDto(examRepository.saveAndFlush(exam), null, null);
    }

    @Transactional
    public void deleteExam(UUID examId) {
        Exam exam = findExam(examId);
        workshopService.requireOwner(exam.getWorkshop(), "delete exams");
        examRepository.delete(exam);
        log.info("Exam {} deleted", examId);
    }

    // ── Questions ────────────────────────────────────────────────────────────

    @Transactional
    public QuestionDto addQuestion(UUID examId, CreateQuestionRequest request) {
        Exam exam = findExam(examId);
        workshopService.requireOwner(exam.getWorkshop(), "add questions");

        ExamQuestion question = ExamQuestion.builder()
                .exam(exam)
                .questionText(requireText(request.getQuestionText(), "question_text"))
                .questionType(request.getQuestionType() != null ? parseType(request.getQuestionType())
                        : ExamQuestion.QuestionType.MULTIPLE_CHOICE)
                .options(request.getOptions() != null ? new ArrayList<>(request.getOptions()) : new ArrayList<>())
                .correctAnswer(requireText(request.getCorrectAnswer(), "correct_answer"))
                .points(request.getPoints() != null ? request.getPoints() : 10)
                .orderIndex(request.getOrderIndex() != null ? request.getOrderIndex() : 0)
                .build();

        return toQuestionDto(questionRepository.save(question), true);
    }

    @Transactional
    public QuestionDto updateQuestion(UUID questionId, UpdateQuestionRequest request) {
        ExamQuestion question = findQuestion(questionId);
        workshopService.requireOwner(question.getExam().getWorkshop(), "update questions");

        if (request.getQuestionText() != null)
            question.setQuestionText(requireText(request.getQuestionText(), "question_text"));
        if (request.getQuestionType() != null)
            question.setQuestionType(parseType(request.getQuestionType()));
        if (request.getOptions() != null)
            question.setOptions(new ArrayList<>(request.getOptions()));
        if (request.getCorrectAnswer() != null)
            question.setCorrectAnswer(requireText(request.getCorrectAnswer(), "correct_answer"));
        if (request.getPoints() != null)
            question.setPoints(request.getPoints());
        if (request.getOrderIndex() != null)
            question.setOrderIndex(request.getOrderIndex());

        return toQuestionDto(questionRepository.save(question), true);
    }

    @Transactional
    public void deleteQuestion(UUID questionId) {
        ExamQuestion question = findQuestion(questionId);
        workshopService.requireOwner(question.getExam().getWorkshop(), "delete questions");
        questionRepository.delete(question);
    }

    // ── Shared with ExamAttemptService ───────────────────────────────────────

    @Transactional(readOnly = true)
    public Exam findExam(UUID examId) {
        return examRepository.findByIdWithWorkshop(examId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam", examId.toString()));
    }

    /** The exam as a taker sees it: questions in order, no correct answers. */
    ExamDto toTakerView(Exam exam) {
        return toDto(exam, toQuestionDtos(questionRepository.findByExamIdOrderByOrderIndexAsc(exam.getId()), false),
                null);
    }

    static AttemptDto toAttemptDto(ExamAttempt a) {
        return AttemptDto.builder()
                .id(a.getId())
                .examId(a.getExam().getId())
                .userId(a.getUser().getId())
                .answers(a.getAnswers())
                .score(a.getScore())
                .passed(a.getPassed())
                .pointsEarned(a.getPointsEarned())
                .startedAt(a.getStartedAt())
                .submittedAt(a.getSubmittedAt())
                .build();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private ExamQuestion findQuestion(UUID questionId) {
        return questionRepository.findByIdWithWorkshop(questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Question", questionId.toString()));
    }

    private static ExamQuestion.QuestionType parseType(String value) {
        return ExamQuestion.QuestionType.fromValue(value.trim())
                .orElseThrow(() -> new BusinessException(
                        "question_type must be one of: multiple_choice, true_false, short_answer"));
    }

    private static String requireText(String value, String field) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw new BusinessException(field + " cannot be empty");
        }
        return trimmed;
    }

    private List<QuestionDto> toQuestionDtos(List<ExamQuestion> questions, boolean withAnswers) {
        return questions.stream().map(q -> toQuestionDto(q, withAnswers)).collect(Collectors.toList());
    }

    private QuestionDto toQuestionDto(ExamQuestion q, boolean withAnswer) {
        return QuestionDto.builder()
                .id(q.getId())
                .examId(q.getExam().getId())
                .questionText(q.getQuestionText())
                .questionType(q.getQuestionType())
                .options(q.getOptions())
                .correctAnswer(withAnswer ? q.getCorrectAnswer() : null)
                .points(q.getPoints())
                .orderIndex(q.getOrderIndex())
                .build();
    }

    private ExamDto toDto(Exam exam, List<QuestionDto> questions, AttemptDto bestAttempt) {
        return ExamDto.builder()
                .id(exam.getId())
                .workshopId(exam.getWorkshop().getId())
                .title(exam.getTitle())
                .description(exam.getDescription())
                .durationMinutes(exam.getDurationMinutes())
                .passingScore(exam.getPassingScore())
                .points(exam.getPoints())
                .questions(questions)
                .bestAttempt(bestAttempt)
                .createdAt(exam.getCreatedAt())
                .updatedAt(exam.getUpdatedAt())
                .build();
    }
}
