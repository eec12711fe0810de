package com.gbu.workshophub.modules.challenge;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gbu.workshophub.modules.user.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "challenge_submissions", uniqueConstraints = @UniqueConstraint(name = "uq_submissions_user_challenge", columnNames = {
        "user_id", "challenge_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChallengeSubmission {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "challenge_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Challenge challenge;

    @Column(name = "submission_text", columnDefinition = "TEXT")
    private String submissionText;

    @Column(name = "submission_url", length = 1000)
    private String submissionUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SubmissionStatus status = SubmissionStatus.PENDING;

    @Column(name = "points_earned", nullable = false)
    @Builder.Default
    private Integer pointsEarned = 0;

    @Column(columnDefinition = "TEXT")
    private String feedback;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "reviewed_by")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    // restamped on every resubmission
    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    public enum SubmissionStatus {
        PENDING, PASSED, FAILED;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<SubmissionStatus> fromValue(String value) {
            return Arrays.stream(values()).filter(s -> s.getValue().equals(value)).findFirst();
        }
    }
}
