package com.gbu.workshophub.modules.exam.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gbu.workshophub.modules.exam.ExamQuestion;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@Builder
public class QuestionDto {
    private UUID id;
    private UUID examId;
    private String questionText;
    private ExamQuestion.QuestionType questionType;
    private List<String> options;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String correctAnswer;

    private Integer points;
    private Integer orderIndex;
}
