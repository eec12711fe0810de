package com.gbu.workshophub.modules.points.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class LeaderboardEntryDto {
    private UUID userId;
    private String userName;
    private Integer totalPoints;
    private Integer lessonsCompleted;
    private Integer challengesCompleted;
    private Integer examsPassed;
    private Integer currentRank;
    private Instant lastUpdated;
    private RankInfo rankInfo;
}
