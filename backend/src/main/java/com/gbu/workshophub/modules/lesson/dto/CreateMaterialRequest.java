package com.gbu.workshophub.modules.lesson.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateMaterialRequest {

    @NotBlank(message = "material_type is required")
    private String materialType;

    @NotBlank(message = "Title is required")
    @Size(max = 200)
    private String title;

    @NotBlank(message = "URL is required")
    @Size(max = 1000)
    private String url;

    @Min(0)
    private Long fileSize;

    @Min(0)
    private Integer duration;
}
