package com.gbu.workshophub.modules.workshop.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;

/** Partial update: only non-null fields are applied. */
@Data
public class UpdateWorkshopRequest {
    private String title;
    private String description;
    private String status;
    private Boolean signupEnabled;
    private LocalDate workshopDate;
    private String venueType;

    @Size(max = 500, message = "Venue address must not exceed 500 characters")
    private String venueAddress;
}
