package com.gbu.workshophub.modules.points;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface UserPointsRepository extends JpaRepository<UserPoints, UUID> {

    @Query("SELECT up FROM UserPoints up WHERE up.totalPoints > 0 " +
            "ORDER BY up.totalPoints DESC, up.lastUpdated ASC")
    List<UserPoints> findAllRanked();

    @Query("SELECT up FROM UserPoints up JOIN FETCH up.user WHERE up.totalPoints > 0 " +
            "ORDER BY up.totalPoints DESC, up.lastUpdated ASC")
    List<UserPoints> findLeaderboard(Pageable pageable);
}
