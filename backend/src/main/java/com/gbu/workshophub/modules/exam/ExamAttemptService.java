package com.gbu.workshophub.modules.exam;

import com.gbu.workshophub.exception.BusinessException;
import com.gbu.workshophub.exception.ResourceNotFoundException;
import com.gbu.workshophub.exception.UnauthorizedAccessException;
import com.gbu.workshophub.modules.exam.dto.AttemptDto;
import com.gbu.workshophub.modules.participant.ParticipantService;
import com.gbu.workshophub.modules.points.PointsService;
import com.gbu.workshophub.modules.user.UserService;
import com.gbu.workshophub.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ExamAttemptService {
    private static final Logger log = LoggerFactory.getLogger(ExamAttemptService.class);

    private final ExamAttemptRepository attemptRepository;
    private final ExamQuestionRepository questionRepository;
    private final ExamService examService;
    private final ExamGrader examGrader;
    private final ParticipantService participantService;
    private final UserService userService;
    private final PointsService pointsService;
    private final SecurityUtils securityUtils;

    @Transactional
    public AttemptDto startAttempt(UUID examId) {
        Exam exam = examService.findExam(examId);
        UUID userId = securityUtils.getCurrentUserId();
        participantService.requireJoinedParticipant(exam.getWorkshop().getId(), userId);

        ExamAttempt attempt = attemptRepository.save(ExamAttempt.builder()
                .user(userService.findUser(userId))
                .exam(exam)
                .answers(new HashMap<>())
                .build());

        log.info("User {} started attempt {} on exam {}", userId, attempt.getId(), examId);
        AttemptDto dto = ExamService.toAttemptDto(attempt);
        dto.setExam(examService.toTakerView(exam));
        return dto;
    }

    /**
     * Grades and closes an attempt. A passing attempt is persisted before points are
     * awarded so the first-pass check counts it.
     */
    @Transactional
    public AttemptDto submitAttempt(UUID attemptId, Map<String, Object> answers) {
        if (answers == null || answers.isEmpty()) {
            throw new BusinessException("Answers are required");
        }

        ExamAttempt attempt = attemptRepository.findByIdWithExam(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));
        UUID userId = securityUtils.getCurrentUserId();
        if (!attempt.getUser().getId().equals(userId)) {
            throw new UnauthorizedAccessException("You can only submit your own attempts");
        }
        if (attempt.isSubmitted()) {
            throw new BusinessException("ALREADY_SUBMITTED", "This attempt has already been submitted");
        }

        Exam exam = attempt.getExam();
        ExamGrader.GradeResult result = examGrader.grade(
                questionRepository.findByExamIdOrderByOrderIndexAsc(exam.getId()), answers);
        boolean passed = result.passes(exam.getPassingScore());
        int pointsEarned = passed ? exam.getPoints() : 0;

        attempt.setAnswers(new HashMap<>(answers));
        attempt.setScore(result.score());
        attempt.setPassed(passed);
        attempt.setPointsEarned(pointsEarned);
        attempt.setSubmittedAt(Instant.now());
        attempt = attemptRepository.saveAndFlush(attempt);

        if (passed && pointsEarned > 0) {
            pointsService.awardExam(attempt.getUser(), exam, pointsEarned);
            pointsService.recomputeRankings();
        }

        log.info("Attempt {} submitted: score {} ({} of {} points), passed={}", attemptId, result.score(),
                result.earnedPoints(), result.totalPoints(), passed);
        return ExamService.toAttemptDto(attempt);
    }

    @Transactional(readOnly = true)
    public List<AttemptDto> getMyAttempts(UUID examId) {
        examService.findExam(examId);
        return attemptRepository.findByUserIdAndExamIdOrderByStartedAtDesc(securityUtils.getCurrentUserId(), examId)
                .stream()
                .map(ExamService::toAttemptDto)
                .collect(Collectors.toList());
    }
}
