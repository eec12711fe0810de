package com.gbu.workshophub.modules.challenge.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateChallengeRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200)
    private String title;

    @NotBlank(message = "Description is required")
    private String description;

    private String htmlContent;

    private String solution;

    @Min(0)
    private Integer orderIndex;

    @Min(0)
    private Integer points;
}
