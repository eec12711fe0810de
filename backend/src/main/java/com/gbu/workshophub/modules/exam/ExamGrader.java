package com.gbu.workshophub.modules.exam;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores an answer sheet. Answers match when equal after trimming and lower-casing;
 * the score is the floored percentage of question points earned.
 */
@Component
public class ExamGrader {

    public GradeResult grade(List<ExamQuestion> questions, Map<String, Object> answers) {
        int total = 0;
        int earned = 0;
        for (ExamQuestion question : questions) {
            total += question.getPoints();
            Object answer = answers.get(question.getId().toString());
            if (answer != null && normalize(String.valueOf(answer)).equals(normalize(question.getCorrectAnswer()))) {
                earned += question.getPoints();
            }
        }
        int score = total > 0 ? (earned * 100) / total : 0;
        return new GradeResult(earned, total, score);
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    public record GradeResult(int earnedPoints, int totalPoints, int score) {

        public boolean passes(int passingScore) {
            return score >= passingScore;
        }
    }
}
