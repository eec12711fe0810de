package com.gbu.workshophub.modules.workshop;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WorkshopRepository extends JpaRepository<Workshop, UUID> {

    @Query("SELECT w FROM Workshop w LEFT JOIN FETCH w.owner ORDER BY w.createdAt DESC")
    List<Workshop> findAllWithOwner();

    @Query("SELECT w FROM Workshop w LEFT JOIN FETCH w.owner WHERE w.owner.id = :ownerId ORDER BY w.createdAt DESC")
    List<Workshop> findByOwnerId(@Param("ownerId") UUID ownerId);
}
