package com.gbu.workshophub.modules.lesson;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserProgressRepository extends JpaRepository<UserProgress, UUID> {

    Optional<UserProgress> findByUserIdAndLessonId(UUID userId, UUID lessonId);

    /** Rows: userId, sum of points, completed lesson count. */
    @Query("SELECT up.user.id, COALESCE(SUM(up.pointsEarned), 0), COUNT(up) FROM UserProgress up " +
            "WHERE up.lesson.workshop.id = :workshopId AND up.completed = true GROUP BY up.user.id")
    List<Object[]> sumCompletedByUserForWorkshop(@Param("workshopId") UUID workshopId);
}
