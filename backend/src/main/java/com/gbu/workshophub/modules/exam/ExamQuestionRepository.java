package com.gbu.workshophub.modules.exam;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExamQuestionRepository extends JpaRepository<ExamQuestion, UUID> {

    List<ExamQuestion> findByExamIdOrderByOrderIndexAsc(UUID examId);

    @Query("SELECT q FROM ExamQuestion q JOIN FETCH q.exam e JOIN FETCH e.workshop w LEFT JOIN FETCH w.owner " +
            "WHERE q.id = :id")
    Optional<ExamQuestion> findByIdWithWorkshop(@Param("id") UUID id);
}
