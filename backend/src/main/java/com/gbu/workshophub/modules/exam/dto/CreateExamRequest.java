package com.gbu.workshophub.modules.exam.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateExamRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200)
    private String title;

    private String description;

    @Min(1)
    private Integer durationMinutes;

    @Min(0)
    @Max(100)
    private Integer passingScore;

    @Min(0)
    private Integer points;
}
