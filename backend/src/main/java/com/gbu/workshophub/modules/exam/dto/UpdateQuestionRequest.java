package com.gbu.workshophub.modules.exam.dto;

import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.List;

@Data
public class UpdateQuestionRequest {

    private String questionText;

    private String questionType;

    private List<String> options;

    private String correctAnswer;

    @Min(0)
    private Integer points;

    @Min(0)
    private Integer orderIndex;
}
