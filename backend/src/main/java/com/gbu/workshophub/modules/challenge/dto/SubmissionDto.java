package com.gbu.workshophub.modules.challenge.dto;

import com.gbu.workshophub.modules.challenge.ChallengeSubmission;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class SubmissionDto {
    private UUID id;
    private UUID challengeId;
    private UUID userId;
    private String userName;
    private String userEmail;
    private String submissionText;
    private String submissionUrl;
    private ChallengeSubmission.SubmissionStatus status;
    private Integer pointsEarned;
    private String feedback;
    private UUID reviewedBy;
    private Instant reviewedAt;
    private Instant submittedAt;
}
