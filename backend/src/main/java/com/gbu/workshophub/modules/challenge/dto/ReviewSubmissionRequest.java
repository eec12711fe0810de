package com.gbu.workshophub.modules.challenge.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewSubmissionRequest {

    // passed | failed
    private String status;

    @Min(0)
    private Integer pointsEarned;

    private String feedback;
}
