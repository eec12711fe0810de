package com.gbu.workshophub.modules.auth.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class TokenResponse {
    private UUID id;
    private String email;
    private String name;
    private Instant createdAt;
    private String accessToken;
    private String tokenType;
    private long expiresIn; // seconds
}
