package com.gbu.workshophub.modules.points.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankInfo {

    public static final String UP = "up";
    public static final String DOWN = "down";
    public static final String SAME = "same";
    public static final String NEW = "new";

    private int rank;
    private int previousRank;
    private int change;
    private String direction;
    private int totalPoints;

    public static RankInfo unranked() {
        return new RankInfo(0, 0, 0, SAME, 0);
    }

    public static RankInfo of(int rank, int previousRank, int totalPoints) {
        if (previousRank == 0) {
            return new RankInfo(rank, previousRank, 0, NEW, totalPoints);
        }
        // a smaller number is a better position
        if (rank < previousRank) {
            return new RankInfo(rank, previousRank, previousRank - rank, UP, totalPoints);
        }
        if (rank > previousRank) {
            return new RankInfo(rank, previousRank, rank - previousRank, DOWN, totalPoints);
        }
        return new RankInfo(rank, previousRank, 0, SAME, totalPoints);
    }
}
