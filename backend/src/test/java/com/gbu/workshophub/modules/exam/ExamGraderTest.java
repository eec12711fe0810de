package com.gbu.workshophub.modules.exam;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExamGrader")
class ExamGraderTest {

    private final ExamGrader grader = new ExamGrader();

    private static ExamQuestion question(String correct, int points) {
        return ExamQuestion.builder()
                .id(UUID.randomUUID())
                .questionText("q")
                .correctAnswer(correct)
                .points(points)
                .build();
    }

    @Test
    @DisplayName("answers match ignoring case and surrounding whitespace")
    void grade_normalizesAnswers() {
        ExamQuestion q = question("Paris", 10);

        ExamGrader.GradeResult result = grader.grade(List.of(q), Map.of(q.getId().toString(), "  pARIS "));

        assertThat(result.earnedPoints()).isEqualTo(10);
        assertThat(result.score()).isEqualTo(100);
    }

    @Test
    @DisplayName("score is the floored percentage of points earned")
    void grade_floorsPercentage() {
        ExamQuestion a = question("a", 1);
        ExamQuestion b = question("b", 1);
        ExamQuestion c = question("c", 1);

        ExamGrader.GradeResult result = grader.grade(List.of(a, b, c),
                Map.of(a.getId().toString(), "a", b.getId().toString(), "wrong"));

        assertThat(result.earnedPoints()).isEqualTo(1);
        assertThat(result.totalPoints()).isEqualTo(3);
        assertThat(result.score()).isEqualTo(33);
        assertThat(result.passes(33)).isTrue();
        assertThat(result.passes(34)).isFalse();
    }

    @Test
    @DisplayName("missing and null answers earn nothing")
    void grade_missingAnswers() {
        ExamQuestion a = question("true", 5);
        ExamQuestion b = question("false", 5);
        Map<String, Object> answers = new HashMap<>();
        answers.put(a.getId().toString(), null);

        ExamGrader.GradeResult result = grader.grade(List.of(a, b), answers);

        assertThat(result.earnedPoints()).isZero();
        assertThat(result.score()).isZero();
    }

    @Test
    @DisplayName("non-string answers are compared by their text form")
    void grade_numericAnswer() {
        ExamQuestion q = question("42", 4);

        ExamGrader.GradeResult result = grader.grade(List.of(q), Map.of(q.getId().toString(), 42));

        assertThat(result.score()).isEqualTo(100);
    }

    @Test
    @DisplayName("an exam without questions scores zero")
    void grade_noQuestions() {
        ExamGrader.GradeResult result = grader.grade(List.of(), Map.of("x", "y"));

        assertThat(result.totalPoints()).isZero();
        assertThat(result.score()).isZero();
        assertThat(result.passes(0)).isTrue();
    }
}
