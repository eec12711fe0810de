package com.gbu.workshophub.modules.lesson.dto;

import com.gbu.workshophub.modules.lesson.LessonMaterial;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class MaterialDto {
    private UUID id;
    private UUID lessonId;
    private LessonMaterial.MaterialType materialType;
    private String title;
    private String url;
    private Long fileSize;
    private Integer duration;
    private Instant createdAt;
}
