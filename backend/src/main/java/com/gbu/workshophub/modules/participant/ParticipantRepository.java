package com.gbu.workshophub.modules.participant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ParticipantRepository extends JpaRepository<Participant, UUID> {

    Optional<Participant> findByWorkshopIdAndUserId(UUID workshopId, UUID userId);

    boolean existsByWorkshopIdAndUserIdAndStatus(UUID workshopId, UUID userId,
            Participant.ParticipantStatus status);

    long countByWorkshopIdAndStatus(UUID workshopId, Participant.ParticipantStatus status);

    default long countJoinedByWorkshopId(UUID workshopId) {
        return countByWorkshopIdAndStatus(workshopId, Participant.ParticipantStatus.JOINED);
    }

    @Query("SELECT p.workshop.id, COUNT(p) FROM Participant p " +
            "WHERE p.workshop.id IN :workshopIds AND p.status = :status GROUP BY p.workshop.id")
    List<Object[]> countByWorkshopIdsAndStatus(@Param("workshopIds") Collection<UUID> workshopIds,
            @Param("status") Participant.ParticipantStatus status);

    default List<Object[]> countJoinedByWorkshopIds(Collection<UUID> workshopIds) {
        return countByWorkshopIdsAndStatus(workshopIds, Participant.ParticipantStatus.JOINED);
    }

    @Query("SELECT p FROM Participant p JOIN FETCH p.user WHERE p.workshop.id = :workshopId " +
            "ORDER BY p.requestedAt DESC")
    List<Participant> findByWorkshopIdWithUser(@Param("workshopId") UUID workshopId);

    @Query("SELECT p FROM Participant p JOIN FETCH p.user WHERE p.workshop.id = :workshopId " +
            "AND p.status = :status ORDER BY p.requestedAt DESC")
    List<Participant> findByWorkshopIdAndStatusWithUser(@Param("workshopId") UUID workshopId,
            @Param("status") Participant.ParticipantStatus status);

    @Query("SELECT p FROM Participant p JOIN FETCH p.workshop w LEFT JOIN FETCH w.owner " +
            "WHERE p.user.id = :userId ORDER BY p.requestedAt DESC")
    List<Participant> findByUserIdWithWorkshop(@Param("userId") UUID userId);
}
