package com.gbu.workshophub.modules.points;

import com.gbu.workshophub.exception.BusinessException;
import com.gbu.workshophub.modules.challenge.Challenge;
import com.gbu.workshophub.modules.challenge.ChallengeSubmission;
import com.gbu.workshophub.modules.challenge.ChallengeSubmissionRepository;
import com.gbu.workshophub.modules.exam.Exam;
import com.gbu.workshophub.modules.exam.ExamAttemptRepository;
import com.gbu.workshophub.modules.lesson.Lesson;
import com.gbu.workshophub.modules.lesson.UserProgress;
import com.gbu.workshophub.modules.lesson.UserProgressRepository;
import com.gbu.workshophub.modules.participant.Participant;
import com.gbu.workshophub.modules.participant.ParticipantRepository;
import com.gbu.workshophub.modules.points.dto.*;
import com.gbu.workshophub.modules.user.User;
import com.gbu.workshophub.modules.user.UserService;
import com.gbu.workshophub.modules.workshop.Workshop;
import com.gbu.workshophub.modules.workshop.WorkshopService;
import com.gbu.workshophub.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Awards points for lessons, challenges and exams, keeps the global ranking, and
 * builds both leaderboards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PointsService {

    private final UserPointsRepository userPointsRepository;
    private final LeaderboardHistoryRepository historyRepository;
    private final UserProgressRepository progressRepository;
    private final ChallengeSubmissionRepository submissionRepository;
    private final ExamAttemptRepository attemptRepository;
    private final ParticipantRepository participantRepository;
    private final WorkshopService workshopService;
    private final UserService userService;
    private final SecurityUtils securityUtils;

    @Value("${leaderboard.default-limit:100}")
    private int defaultLimit;

    // ── Awards ───────────────────────────────────────────────────────────────

    /** Completing a lesson twice never pays twice. */
    @Transactional
    public UserPoints awardLesson(User user, Lesson lesson) {
        UserPoints points = getOrInitPoints(user);
        UserProgress progress = progressRepository.findByUserIdAndLessonId(user.getId(), lesson.getId())
                .orElse(null);
        if (progress != null && Boolean.TRUE.equals(progress.getCompleted())) {
            return points;
        }

        Instant now = Instant.now();
        if (progress == null) {
            progress = UserProgress.builder().user(user).lesson(lesson).build();
        }
        progress.setCompleted(true);
        progress.setCompletedAt(now);
        progress.setPointsEarned(lesson.getPoints());
        progressRepository.save(progress);

        points.addPoints(lesson.getPoints(), now);
        points.setLessonsCompleted(points.getLessonsCompleted() + 1);
        log.info("Awarded {} points to user {} for lesson {}", lesson.getPoints(), user.getId(), lesson.getId());
        return userPointsRepository.save(points);
    }

    /** Every passing review pays, including re-reviews of the same challenge. */
    @Transactional
    public UserPoints awardChallenge(User user, Challenge challenge, int awarded) {
        UserPoints points = getOrInitPoints(user);
        points.addPoints(awarded, Instant.now());
        points.setChallengesCompleted(points.getChallengesCompleted() + 1);
        log.info("Awarded {} points to user {} for challenge {}", awarded, user.getId(), challenge.getId());
        return userPointsRepository.save(points);
    }

    /**
     * Must run after the passing attempt is persisted: that attempt is part of the count,
     * so only the first pass of an exam pays.
     */
    @Transactional
    public UserPoints awardExam(User user, Exam exam, int awarded) {
        UserPoints points = getOrInitPoints(user);
        long passedAttempts = attemptRepository.countByUserIdAndExamIdAndPassedTrue(user.getId(), exam.getId());
        if (passedAttempts > 1) {
            log.debug("User {} already passed exam {}; no points awarded", user.getId(), exam.getId());
            return points;
        }
        points.addPoints(awarded, Instant.now());
        points.setExamsPassed(points.getExamsPassed() + 1);
        log.info("Awarded {} points to user {} for exam {}", awarded, user.getId(), exam.getId());
        return userPointsRepository.save(points);
    }

    // ── Ranking ──────────────────────────────────────────────────────────────

    /**
     * Dense 1..N ranking of users with points. Only users whose position moved are
     * written, and each move appends one history row.
     */
    @Transactional
    public void recomputeRankings() {
        List<UserPoints> ranked = userPointsRepository.findAllRanked();
        List<UserPoints> moved = new ArrayList<>();
        List<LeaderboardHistory> history = new ArrayList<>();

        int position = 0;
        for (UserPoints up : ranked) {
            position++;
            if (Objects.equals(up.getCurrentRank(), position)) {
                continue;
            }
            up.setPreviousRank(up.getCurrentRank());
            up.setCurrentRank(position);
            moved.add(up);
            history.add(LeaderboardHistory.builder()
                    .user(up.getUser())
                    .rankPosition(position)
                    .totalPoints(up.getTotalPoints())
                    .build());
        }

        if (!moved.isEmpty()) {
            userPointsRepository.saveAll(moved);
            historyRepository.saveAll(history);
        }
        log.info("Rankings recomputed: {} ranked users, {} changed position", ranked.size(), moved.size());
    }

    @Transactional(readOnly = true)
    public RankInfo rankChange(UUID userId) {
        return userPointsRepository.findById(userId)
                .map(up -> RankInfo.of(up.getCurrentRank(), up.getPreviousRank(), up.getTotalPoints()))
                .orElseGet(RankInfo::unranked);
    }

    // ── Read models ──────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public LeaderboardResponse getLeaderboard(Integer limit) {
        int size = limit != null ? limit : defaultLimit;
        if (size < 1) {
            throw new BusinessException("Limit must be a positive integer");
        }

        List<LeaderboardEntryDto> entries = userPointsRepository.findLeaderboard(PageRequest.of(0, size)).stream()
                .map(up -> LeaderboardEntryDto.builder()
                        .userId(up.getUserId())
                        .userName(up.getUser().getName())
                        .totalPoints(up.getTotalPoints())
                        .lessonsCompleted(up.getLessonsCompleted())
                        .challengesCompleted(up.getChallengesCompleted())
                        .examsPassed(up.getExamsPassed())
                        .currentRank(up.getCurrentRank())
                        .lastUpdated(up.getLastUpdated())
                        .rankInfo(RankInfo.of(up.getCurrentRank(), up.getPreviousRank(), up.getTotalPoints()))
                        .build())
                .collect(Collectors.toList());

        RankInfo mine = securityUtils.findCurrentUserId().map(this::rankChange).orElse(null);
        return new LeaderboardResponse(entries, mine);
    }

    /**
     * Per-workshop standings for joined participants. Each source is summed on its own
     * so a user with several rows in one source does not multiply another source's sum.
     */
    @Transactional(readOnly = true)
    public WorkshopLeaderboardDto getWorkshopLeaderboard(UUID workshopId) {
        Workshop workshop = workshopService.findWorkshop(workshopId);

        Map<UUID, Long[]> lessons = toPairMap(progressRepository.sumCompletedByUserForWorkshop(workshopId));
        Map<UUID, Long> challengePoints = toMap(submissionRepository.sumPointsByUserForWorkshop(workshopId));
        Map<UUID, Long> challengesPassed = toMap(submissionRepository.countByUserForWorkshopAndStatus(
                workshopId, ChallengeSubmission.SubmissionStatus.PASSED));
        Map<UUID, Long> examPoints = toMap(attemptRepository.sumPointsByUserForWorkshop(workshopId));
        Map<UUID, Long> examsPassed = toMap(attemptRepository.countPassedByUserForWorkshop(workshopId));

        List<WorkshopLeaderboardDto.Entry> entries = participantRepository
                .findByWorkshopIdAndStatusWithUser(workshopId, Participant.ParticipantStatus.JOINED).stream()
                .map(Participant::getUser)
                .map(user -> {
                    UUID id = user.getId();
                    Long[] lesson = lessons.getOrDefault(id, new Long[] { 0L, 0L });
                    long total = lesson[0] + challengePoints.getOrDefault(id, 0L) + examPoints.getOrDefault(id, 0L);
                    return WorkshopLeaderboardDto.Entry.builder()
                            .userId(id)
                            .userName(user.getName())
                            .totalPoints(total)
                            .lessonsCompleted(lesson[1])
                            .challengesCompleted(challengesPassed.getOrDefault(id, 0L))
                            .examsPassed(examsPassed.getOrDefault(id, 0L))
                            .build();
                })
                .sorted(Comparator.comparingLong(WorkshopLeaderboardDto.Entry::getTotalPoints).reversed())
                .collect(Collectors.toList());

        return new WorkshopLeaderboardDto(workshop.getId(), workshop.getTitle(), entries);
    }

    /** A user who never scored reads as all zeros; nothing is written. */
    @Transactional(readOnly = true)
    public PointsSummaryDto getUserPoints(UUID userId) {
        User user = userService.findUser(userId);
        UserPoints points = userPointsRepository.findById(userId)
                .orElseGet(() -> UserPoints.builder().userId(userId).user(user).build());
        return new PointsSummaryDto(toDto(points, user), rankChange(userId));
    }

    @Transactional(readOnly = true)
    public PointsSummaryDto getMyPoints() {
        return getUserPoints(securityUtils.getCurrentUserId());
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    /**
     * Locks the user's row, then loads or creates the points row. Awards to the same user
     * run one at a time, so the first-touch insert happens once and increments are not lost.
     */
    @Transactional
    public UserPoints getOrInitPoints(User user) {
        User locked = userService.lockUser(user.getId());
        return userPointsRepository.findById(user.getId())
                .orElseGet(() -> userPointsRepository.saveAndFlush(UserPoints.builder().user(locked).build()));
    }

    private UserPointsDto toDto(UserPoints points, User user) {
        return UserPointsDto.builder()
                .userId(user.getId())
                .userName(user.getName())
                .userEmail(user.getEmail())
                .totalPoints(points.getTotalPoints())
                .lessonsCompleted(points.getLessonsCompleted())
                .challengesCompleted(points.getChallengesCompleted())
                .examsPassed(points.getExamsPassed())
                .currentRank(points.getCurrentRank())
                .previousRank(points.getPreviousRank())
                .lastUpdated(points.getLastUpdated())
                .build();
    }

    private static Map<UUID, Long> toMap(List<Object[]> rows) {
        Map<UUID, Long> map = new HashMap<>();
        for (Object[] row : rows) {
            map.put((UUID) row[0], ((Number) row[1]).longValue());
        }
        return map;
    }

    private static Map<UUID, Long[]> toPairMap(List<Object[]> rows) {
        Map<UUID, Long[]> map = new HashMap<>();
        for (Object[] row : rows) {
            map.put((UUID) row[0], new Long[] { ((Number) row[1]).longValue(), ((Number) row[2]).longValue() });
        }
        return map;
    }
}
