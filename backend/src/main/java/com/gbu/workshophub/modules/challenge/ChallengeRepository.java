package com.gbu.workshophub.modules.challenge;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ChallengeRepository extends JpaRepository<Challenge, UUID> {

    List<Challenge> findByWorkshopIdOrderByOrderIndexAscCreatedAtAsc(UUID workshopId);

    @Query("SELECT c FROM Challenge c JOIN FETCH c.workshop w LEFT JOIN FETCH w.owner WHERE c.id = :id")
    Optional<Challenge> findByIdWithWorkshop(@Param("id") UUID id);
}
