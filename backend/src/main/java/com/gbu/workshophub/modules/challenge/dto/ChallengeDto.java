package com.gbu.workshophub.modules.challenge.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class ChallengeDto {
    private UUID id;
    private UUID workshopId;
    private String title;
    private String description;
    private String htmlContent;
    // null unless the caller owns the workshop
    private String solution;
    private Integer orderIndex;
    private Integer points;
    // the caller's own submission; never populated for the owner
    private SubmissionDto submission;
    private Instant createdAt;
    private Instant updatedAt;
}
