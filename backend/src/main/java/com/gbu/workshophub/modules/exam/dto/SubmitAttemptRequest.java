package com.gbu.workshophub.modules.exam.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitAttemptRequest {

    // question id -> answer
    private Map<String, Object> answers;
}
