package com.gbu.workshophub.modules.workshop.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;

@Data
public class CreateWorkshopRequest {

    @NotBlank(message = "Title is required")
    private String title;

    @NotBlank(message = "Description is required")
    private String description;

    private LocalDate workshopDate;

    // online | physical
    private String venueType;

    @Size(max = 500, message = "Venue address must not exceed 500 characters")
    private String venueAddress;
}
