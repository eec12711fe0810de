package com.gbu.workshophub.modules.points;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface LeaderboardHistoryRepository extends JpaRepository<LeaderboardHistory, UUID> {
}
