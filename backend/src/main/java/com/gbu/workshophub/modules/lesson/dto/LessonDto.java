package com.gbu.workshophub.modules.lesson.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class LessonDto {
    private UUID id;
    private UUID workshopId;
    private String title;
    private String description;
    private String content;
    private Integer orderIndex;
    private Integer points;
    private List<MaterialDto> materials;
    private Instant createdAt;
    private Instant updatedAt;
}
