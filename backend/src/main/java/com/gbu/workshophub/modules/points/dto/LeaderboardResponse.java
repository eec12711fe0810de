package com.gbu.workshophub.modules.points.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class LeaderboardResponse {
    private List<LeaderboardEntryDto> leaderboard;

    // anonymous callers get no current_user_rank key at all
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private RankInfo currentUserRank;
}
