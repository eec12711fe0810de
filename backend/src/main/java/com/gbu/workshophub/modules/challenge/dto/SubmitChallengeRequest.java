package com.gbu.workshophub.modules.challenge.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitChallengeRequest {

    private String submissionText;

    @Size(max = 1000)
    private String submissionUrl;
}
