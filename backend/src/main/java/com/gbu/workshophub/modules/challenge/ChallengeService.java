package com.gbu.workshophub.modules.challenge;

import com.gbu.workshophub.exception.BusinessException;
import com.gbu.workshophub.exception.ConflictException;
import com.gbu.workshophub.exception.ResourceNotFoundException;
import com.gbu.workshophub.modules.challenge.dto.*;
import com.gbu.workshophub.modules.participant.ParticipantService;
import com.gbu.workshophub.modules.points.PointsService;
import com.gbu.workshophub.modules.user.User;
import com.gbu.workshophub.modules.user.UserService;
import com.gbu.workshophub.modules.workshop.Workshop;
import com.gbu.workshophub.modules.workshop.WorkshopService;
import com.gbu.workshophub.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ChallengeService {
    private static final Logger log = LoggerFactory.getLogger(ChallengeService.class);

    private final ChallengeRepository challengeRepository;
    private final ChallengeSubmissionRepository submissionRepository;
    private final WorkshopService workshopService;
    private final ParticipantService participantService;
    private final UserService userService;
    private final PointsService pointsService;
    private final SecurityUtils securityUtils;

    // ── Owner: authoring ─────────────────────────────────────────────────────

    @Transactional
    public ChallengeDto createChallenge(UUID workshopId, CreateChallengeRequest request) {
        Workshop workshop = workshopService.findWorkshop(workshopId);
        workshopService.requireOwner(workshop, "create challenges");

        Challenge challenge = Challenge.builder()
                .workshop(workshop)
                .title(requireText(request.getTitle(), "Title"))
                .description(requireText(request.getDescription(), "Description"))
                .htmlContent(request.getHtmlContent())
                .solution(request.getSolution())
                .orderIndex(request.getOrderIndex() != null ? request.getOrderIndex() : 0)
                .points(request.getPoints() != null ? request.getPoints() : 20)
                .build();

        challenge = challengeRepository.save(challenge);
        log.info("Challenge {} created in workshop {}", challenge.getId(), workshopId);
        return toDto(challenge, true, null);
    }

    @Transactional
    public ChallengeDto updateChallenge(UUID challengeId, UpdateChallengeRequest request) {
        Challenge challenge = findChallenge(challengeId);
        workshopService.requireOwner(challenge.getWorkshop(), "update challenges");

        if (request.getTitle() != null)
            challenge.setTitle(requireText(request.getTitle(), "Title"));
        if (request.getDescription() != null)
            challenge.setDescription(requireText(request.getDescription(), "Description"));
        if (request.getHtmlContent() != null)
            challenge.setHtmlContent(request.getHtmlContent());
        if (request.getSolution() != null)
            challenge.setSolution(request.getSolution());
        if (request.getOrderIndex() != null)
            challenge.setOrderIndex(request.getOrderIndex());
        if (request.getPoints() != null)
            challenge.setPoints(request.getPoints());

        return toDto(challengeRepository.saveAndFlush(challenge), true, null);
    }

    @Transactional
    public void deleteChallenge(UUID challengeId) {
        Challenge challenge = findChallenge(challengeId);
        workshopService.requireOwner(challenge.getWorkshop(), "delete challenges");
        challengeRepository.delete(challenge);
        log.info("Challenge {} deleted", challengeId);
    }

    // ── Viewing: solutions only for the owner ────────────────────────────────

    @Transactional(readOnly = true)
    public List<ChallengeDto> getChallenges(UUID workshopId) {
        Workshop workshop = workshopService.findWorkshop(workshopId);
        UUID userId = securityUtils.getCurrentUserId();
        List<Challenge> challenges = challengeRepository.findByWorkshopIdOrderByOrderIndexAscCreatedAtAsc(workshopId);

        if (workshop.isOwnedBy(userId)) {
            return challenges.stream().map(c -> toDto(c, true, null)).collect(Collectors.toList());
        }
        if (challenges.isEmpty()) {
            return List.of();
        }

        Map<UUID, ChallengeSubmission> mine = submissionRepository
                .findByUserIdAndChallengeIds(userId, challenges.stream().map(Challenge::getId).collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(s -> s.getChallenge().getId(), Function.identity()));

        return challenges.stream()
                .map(c -> toDto(c, false, mine.get(c.getId())))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ChallengeDto getChallenge(UUID challengeId) {
        Challenge challenge = findChallenge(challengeId);
        UUID userId = securityUtils.getCurrentUserId();
        if (challenge.getWorkshop().isOwnedBy(userId)) {
            return toDto(challenge, true, null);
        }
        return toDto(challenge, false,
                submissionRepository.findByUserIdAndChallengeId(userId, challengeId).orElse(null));
    }

    // ── Participant: submit ──────────────────────────────────────────────────

    /** One row per (user, challenge); resubmitting overwrites it and returns it to review. */
    @Transactional
    public SubmissionDto submit(UUID challengeId, SubmitChallengeRequest request) {
        Challenge challenge = findChallenge(challengeId);
        UUID userId = securityUtils.getCurrentUserId();
        participantService.requireJoinedParticipant(challenge.getWorkshop().getId(), userId);

        String text = blankToNull(request.getSubmissionText());
        String url = blankToNull(request.getSubmissionUrl());
        if (text == null && url == null) {
            throw new BusinessException("Either submission_text or submission_url is required");
        }

        ChallengeSubmission submission = submissionRepository.findByUserIdAndChallengeId(userId, challengeId)
                .orElseGet(() -> ChallengeSubmission.builder()
                        .user(userService.findUser(userId))
                        .challenge(challenge)
                        .build());

        submission.setSubmissionText(text);
        submission.setSubmissionUrl(url);
        submission.setStatus(ChallengeSubmission.SubmissionStatus.PENDING);
        submission.setPointsEarned(0);
        submission.setFeedback(null);
        submission.setReviewedBy(null);
        submission.setReviewedAt(null);
        submission.setSubmittedAt(Instant.now());

        try {
            submission = submissionRepository.saveAndFlush(submission);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("DUPLICATE_SUBMISSION", "A submission for this challenge is already in progress");
        }

        log.info("User {} submitted challenge {}", userId, challengeId);
        return toSubmissionDto(submission);
    }

    // ── Owner: review ────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public List<SubmissionDto> getSubmissions(UUID challengeId) {
        Challenge challenge = findChallenge(challengeId);
        workshopService.requireOwner(challenge.getWorkshop(), "view submissions");
        return submissionRepository.findByChallengeIdWithUser(challengeId).stream()
                .map(this::toSubmissionDto)
                .collect(Collectors.toList());
    }

    @Transactional
    public SubmissionDto review(UUID submissionId, ReviewSubmissionRequest request) {
        ChallengeSubmission submission = submissionRepository.findByIdWithChallenge(submissionId)
                .orElseThrow(() -> new ResourceNotFoundException("Submission", submissionId.toString()));
        workshopService.requireOwner(submission.getChallenge().getWorkshop(), "review submissions");

        String rawStatus = request.getStatus() == null ? "" : request.getStatus().trim();
        ChallengeSubmission.SubmissionStatus status = ChallengeSubmission.SubmissionStatus.fromValue(rawStatus)
                .filter(s -> s != ChallengeSubmission.SubmissionStatus.PENDING)
                .orElseThrow(() -> new BusinessException("Status must be passed or failed"));
        int points = request.getPointsEarned() != null ? request.getPointsEarned() : 0;

        submission.setStatus(status);
        submission.setPointsEarned(points);
        submission.setFeedback(blankToNull(request.getFeedback()));
        submission.setReviewedBy(userService.findUser(securityUtils.getCurrentUserId()));
        submission.setReviewedAt(Instant.now());
        submission = submissionRepository.save(submission);

        if (status == ChallengeSubmission.SubmissionStatus.PASSED && points > 0) {
            pointsService.awardChallenge(submission.getUser(), submission.getChallenge(), points);
            pointsService.recomputeRankings();
        }

        log.info("Submission {} reviewed as {}", submissionId, status);
        return toSubmissionDto(submission);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Challenge findChallenge(UUID challengeId) {
        return challengeRepository.findByIdWithWorkshop(challengeId)
                .orElseThrow(() -> new ResourceNotFoundException("Challenge", challengeId.toString()));
    }

    private static String requireText(String value, String field) {
        String trimmed = blankToNull(value);
        if (trimmed == null) {
            throw new BusinessException(field + " cannot be empty");
        }
        return trimmed;
    }

    private static String blankToNull(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private ChallengeDto toDto(Challenge c, boolean owner, ChallengeSubmission own) {
        return ChallengeDto.builder()
                .id(c.getId())
                .workshopId(c.getWorkshop().getId())
                .title(c.getTitle())
                .description(c.getDescription())
                .htmlContent(c.getHtmlContent())
                .solution(owner ? c.getSolution() : null)
                .orderIndex(c.getOrderIndex())
                .points(c.getPoints())
                .submission(own != null ? toSubmissionDto(own) : null)
                .createdAt(c.getCreatedAt())
                .updatedAt(c.getUpdatedAt())
                .build();
    }

    private SubmissionDto toSubmissionDto(ChallengeSubmission s) {
        User user = s.getUser();
        return SubmissionDto.builder()
                .id(s.getId())
                .challengeId(s.getChallenge().getId())
                .userId(user.getId())
                .userName(user.getName())
                .userEmail(user.getEmail())
                .submissionText(s.getSubmissionText())
                .submissionUrl(s.getSubmissionUrl())
                .status(s.getStatus())
                .pointsEarned(s.getPointsEarned())
                .feedback(s.getFeedback())
                .reviewedBy(s.getReviewedBy() != null ? s.getReviewedBy().getId() : null)
                .reviewedAt(s.getReviewedAt())
                .submittedAt(s.getSubmittedAt())
                .build();
    }
}
