package com.gbu.workshophub.modules.exam.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class ExamDto {
    private UUID id;
    private UUID workshopId;
    private String title;
    private String description;
    private Integer durationMinutes;
    private Integer passingScore;
    private Integer points;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<QuestionDto> questions;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private AttemptDto bestAttempt;

    private Instant createdAt;
    private Instant updatedAt;
}
