package com.gbu.workshophub.modules.lesson;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LessonMaterialRepository extends JpaRepository<LessonMaterial, UUID> {

    List<LessonMaterial> findByLessonIdOrderByCreatedAtAsc(UUID lessonId);

    @Query("SELECT m FROM LessonMaterial m WHERE m.lesson.id IN :lessonIds ORDER BY m.createdAt ASC")
    List<LessonMaterial> findByLessonIds(@Param("lessonIds") Collection<UUID> lessonIds);

    @Query("SELECT m FROM LessonMaterial m JOIN FETCH m.lesson l JOIN FETCH l.workshop WHERE m.id = :id")
    Optional<LessonMaterial> findByIdWithWorkshop(@Param("id") UUID id);
}
