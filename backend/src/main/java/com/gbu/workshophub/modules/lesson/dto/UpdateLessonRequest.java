package com.gbu.workshophub.modules.lesson.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

/** Absent fields are left unchanged. */
@Data
public class UpdateLessonRequest {

    @Size(max = 200)
    private String title;

    private String description;

    private String content;

    @Min(0)
    private Integer orderIndex;

    @Min(0)
    private Integer points;
}
