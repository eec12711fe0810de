package com.gbu.workshophub.modules.points.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class UserPointsDto {
    private UUID userId;
    private String userName;
    private String userEmail;
    private Integer totalPoints;
    private Integer lessonsCompleted;
    private Integer challengesCompleted;
    private Integer examsPassed;
    private Integer currentRank;
    private Integer previousRank;
    private Instant lastUpdated;
}
