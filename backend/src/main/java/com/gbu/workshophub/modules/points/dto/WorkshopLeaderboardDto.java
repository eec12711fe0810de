package com.gbu.workshophub.modules.points.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@AllArgsConstructor
public class WorkshopLeaderboardDto {
    private UUID workshopId;
    private String workshopTitle;
    private List<Entry> leaderboard;

    @Data
    @Builder
    public static class Entry {
        private UUID userId;
        private String userName;
        private long totalPoints;
        private long lessonsCompleted;
        private long challengesCompleted;
        private long examsPassed;
    }
}
