package com.gbu.workshophub.modules.points.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PointsSummaryDto {
    private UserPointsDto points;
    private RankInfo rankInfo;
}
