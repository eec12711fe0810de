package com.gbu.workshophub.modules.lesson.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class LessonCompletionDto {
    private String message;
    private Integer pointsEarned;
    private Integer totalPoints;
}
