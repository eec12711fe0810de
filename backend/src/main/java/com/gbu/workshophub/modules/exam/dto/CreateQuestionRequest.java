package com.gbu.workshophub.modules.exam.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.List;

@Data
public class CreateQuestionRequest {

    @NotBlank(message = "question_text is required")
    private String questionText;

    // multiple_choice | true_false | short_answer
    private String questionType;

    private List<String> options;

    @NotBlank(message = "correct_answer is required")
    private String correctAnswer;

    @Min(0)
    private Integer points;

    @Min(0)
    private Integer orderIndex;
}
