package com.gbu.workshophub.modules.exam.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
public class AttemptDto {
    private UUID id;
    private UUID examId;
    private UUID userId;
    private Map<String, Object> answers;
    private Integer score;
    private Boolean passed;
    private Integer pointsEarned;
    private Instant startedAt;
    private Instant submittedAt;

    // only on a freshly started attempt
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private ExamDto exam;
}
