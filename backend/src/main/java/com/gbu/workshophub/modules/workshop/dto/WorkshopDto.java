package com.gbu.workshophub.modules.workshop.dto;

import com.gbu.workshophub.modules.workshop.Workshop;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
public class WorkshopDto {
    private UUID id;
    private String title;
    private String description;
    private Workshop.WorkshopStatus status;
    private Boolean signupEnabled;
    private UUID ownerId;
    private String ownerName;
    private LocalDate workshopDate;
    private Workshop.VenueType venueType;
    private String venueAddress;
    private Long participantCount;
    private Instant createdAt;
    private Instant updatedAt;
}
