package com.gbu.workshophub.modules.user.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class UserProfileDto {
    private UUID id;
    private String name;
    private String email;
    private Instant createdAt;
    private Instant updatedAt;
}
