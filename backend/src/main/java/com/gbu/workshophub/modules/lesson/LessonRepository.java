package com.gbu.workshophub.modules.lesson;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LessonRepository extends JpaRepository<Lesson, UUID> {

    List<Lesson> findByWorkshopIdOrderByOrderIndexAscCreatedAtAsc(UUID workshopId);

    @Query("SELECT l FROM Lesson l JOIN FETCH l.workshop w LEFT JOIN FETCH w.owner WHERE l.id = :id")
    Optional<Lesson> findByIdWithWorkshop(@Param("id") UUID id);
}
