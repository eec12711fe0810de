package com.gbu.workshophub.modules.exam;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExamRepository extends JpaRepository<Exam, UUID> {

    List<Exam> findByWorkshopIdOrderByCreatedAtAsc(UUID workshopId);

    @Query("SELECT e FROM Exam e JOIN FETCH e.workshop w LEFT JOIN FETCH w.owner WHERE e.id = :id")
    Optional<Exam> findByIdWithWorkshop(@Param("id") UUID id);
}
