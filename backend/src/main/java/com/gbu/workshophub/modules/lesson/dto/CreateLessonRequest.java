package com.gbu.workshophub.modules.lesson.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateLessonRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200)
    private String title;

    private String description;

    private String content;

    @Min(0)
    private Integer orderIndex;

    @Min(0)
    private Integer points;
}
