package com.gbu.workshophub.modules.challenge;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ChallengeSubmissionRepository extends JpaRepository<ChallengeSubmission, UUID> {

    Optional<ChallengeSubmission> findByUserIdAndChallengeId(UUID userId, UUID challengeId);

    @Query("SELECT s FROM ChallengeSubmission s WHERE s.user.id = :userId AND s.challenge.id IN :challengeIds")
    List<ChallengeSubmission> findByUserIdAndChallengeIds(@Param("userId") UUID userId,
            @Param("challengeIds") Collection<UUID> challengeIds);

    @Query("SELECT s FROM ChallengeSubmission s JOIN FETCH s.user WHERE s.challenge.id = :challengeId " +
            "ORDER BY s.submittedAt DESC")
    List<ChallengeSubmission> findByChallengeIdWithUser(@Param("challengeId") UUID challengeId);

    @Query("SELECT s FROM ChallengeSubmission s JOIN FETCH s.user JOIN FETCH s.challenge c " +
            "JOIN FETCH c.workshop w LEFT JOIN FETCH w.owner WHERE s.id = :id")
    Optional<ChallengeSubmission> findByIdWithChallenge(@Param("id") UUID id);

    /** Rows: userId, sum of points earned across the workshop's challenges. */
    @Query("SELECT s.user.id, COALESCE(SUM(s.pointsEarned), 0) FROM ChallengeSubmission s " +
            "WHERE s.challenge.workshop.id = :workshopId GROUP BY s.user.id")
    List<Object[]> sumPointsByUserForWorkshop(@Param("workshopId") UUID workshopId);

    /** Rows: userId, number of distinct challenges with a submission in the given status. */
    @Query("SELECT s.user.id, COUNT(DISTINCT s.challenge.id) FROM ChallengeSubmission s " +
            "WHERE s.challenge.workshop.id = :workshopId AND s.status = :status GROUP BY s.user.id")
    List<Object[]> countByUserForWorkshopAndStatus(@Param("workshopId") UUID workshopId,
            @Param("status") ChallengeSubmission.SubmissionStatus status);
}
