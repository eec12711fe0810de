package com.gbu.workshophub.modules.exam;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExamAttemptRepository extends JpaRepository<ExamAttempt, UUID> {

    List<ExamAttempt> findByUserIdAndExamIdOrderByStartedAtDesc(UUID userId, UUID examId);

    long countByUserIdAndExamIdAndPassedTrue(UUID userId, UUID examId);

    @Query("SELECT a FROM ExamAttempt a JOIN FETCH a.exam WHERE a.id = :id")
    Optional<ExamAttempt> findByIdWithExam(@Param("id") UUID id);

    @Query("SELECT a FROM ExamAttempt a WHERE a.user.id = :userId AND a.exam.id = :examId " +
            "AND a.submittedAt IS NOT NULL ORDER BY a.score DESC, a.submittedAt ASC")
    List<ExamAttempt> findSubmittedRanked(@Param("userId") UUID userId, @Param("examId") UUID examId,
            Pageable pageable);

    /** Highest score, ties broken by the earliest submission. */
    default Optional<ExamAttempt> findBestAttempt(UUID userId, UUID examId) {
        return findSubmittedRanked(userId, examId, PageRequest.of(0, 1)).stream().findFirst();
    }

    /** Rows: userId, sum of points earned across the workshop's exams. */
    @Query("SELECT a.user.id, COALESCE(SUM(a.pointsEarned), 0) FROM ExamAttempt a " +
            "WHERE a.exam.workshop.id = :workshopId GROUP BY a.user.id")
    List<Object[]> sumPointsByUserForWorkshop(@Param("workshopId") UUID workshopId);

    /** Rows: userId, number of distinct exams passed. */
    @Query("SELECT a.user.id, COUNT(DISTINCT a.exam.id) FROM ExamAttempt a " +
            "WHERE a.exam.workshop.id = :workshopId AND a.passed = true GROUP BY a.user.id")
    List<Object[]> countPassedByUserForWorkshop(@Param("workshopId") UUID workshopId);
}
