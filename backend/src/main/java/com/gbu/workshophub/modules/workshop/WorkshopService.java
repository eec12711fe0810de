package com.gbu.workshophub.modules.workshop;

import com.gbu.workshophub.exception.BusinessException;
import com.gbu.workshophub.exception.ResourceNotFoundException;
import com.gbu.workshophub.exception.UnauthorizedAccessException;
import com.gbu.workshophub.modules.participant.ParticipantRepository;
import com.gbu.workshophub.modules.user.User;
import com.gbu.workshophub.modules.user.UserService;
import com.gbu.workshophub.modules.workshop.dto.*;
import com.gbu.workshophub.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkshopService {

    static final int MAX_TITLE_LENGTH = 200;
    static final int MAX_DESCRIPTION_LENGTH = 1000;

    private final WorkshopRepository workshopRepository;
    private final ParticipantRepository participantRepository;
    private final UserService userService;
    private final SecurityUtils securityUtils;

    @Transactional
    public WorkshopDto createWorkshop(CreateWorkshopRequest request) {
        User owner = userService.findUser(securityUtils.getCurrentUserId());

        Workshop workshop = Workshop.builder()
                .title(validateTitle(request.getTitle()))
                .description(validateDescription(request.getDescription()))
                .status(Workshop.WorkshopStatus.PENDING)
                .signupEnabled(true)
                .owner(owner)
                .workshopDate(request.getWorkshopDate())
                .venueType(request.getVenueType() != null ? parseVenueType(request.getVenueType()) : null)
                .venueAddress(request.getVenueAddress())
                .build();

        workshop = workshopRepository.save(workshop);
        log.info("User {} created workshop {}", owner.getId(), workshop.getId());
        return toDto(workshop, 0L);
    }

    @Transactional(readOnly = true)
    public List<WorkshopDto> getAllWorkshops() {
        return toDtos(workshopRepository.findAllWithOwner());
    }

    @Transactional(readOnly = true)
    public List<WorkshopDto> getMyWorkshops() {
        return toDtos(workshopRepository.findByOwnerId(securityUtils.getCurrentUserId()));
    }

    @Transactional(readOnly = true)
    public WorkshopDto getWorkshop(UUID workshopId) {
        return toDto(findWorkshop(workshopId));
    }

    @Transactional
    public WorkshopDto updateWorkshop(UUID workshopId, UpdateWorkshopRequest request) {
        Workshop workshop = findWorkshop(workshopId);
        requireOwner(workshop, "update this workshop");

        // validate everything before touching the entity so a rejected request writes nothing
        String title = request.getTitle() != null ? validateTitle(request.getTitle()) : null;
        String description = request.getDescription() != null ? validateDescription(request.getDescription()) : null;
        Workshop.WorkshopStatus status = request.getStatus() != null ? parseStatus(request.getStatus()) : null;
        Workshop.VenueType venueType = request.getVenueType() != null ? parseVenueType(request.getVenueType())
                : null;

        if (title != null)
            workshop.setTitle(title);
        if (description != null)
            workshop.setDescription(description);
        if (status != null)
            workshop.setStatus(status);
        if (request.getSignupEnabled() != null)
            workshop.setSignupEnabled(request.getSignupEnabled());
        if (request.getWorkshopDate() != null)
            workshop.setWorkshopDate(request.getWorkshopDate());
        if (venueType != null)
            workshop.setVenueType(venueType);
        if (request.getVenueAddress() != null)
            workshop.setVenueAddress(request.getVenueAddress());

        return toDto(workshopRepository.saveAndFlush(workshop));
    }

    @Transactional
    public void deleteWorkshop(UUID workshopId) {
        Workshop workshop = findWorkshop(workshopId);
        requireOwner(workshop, "delete this workshop");
        workshopRepository.delete(workshop);
        log.info("Workshop {} deleted by its owner", workshopId);
    }

    // ── Shared with participant/lesson/challenge/exam modules ────────────────

    @Transactional(readOnly = true)
    public Workshop findWorkshop(UUID workshopId) {
        return workshopRepository.findById(workshopId)
                .orElseThrow(() -> new ResourceNotFoundException("Workshop", workshopId.toString()));
    }

    public void requireOwner(Workshop workshop, String action) {
        if (!workshop.isOwnedBy(securityUtils.getCurrentUserId())) {
            throw new UnauthorizedAccessException("Only the workshop owner can " + action);
        }
    }

    public boolean isCurrentUserOwner(Workshop workshop) {
        return securityUtils.findCurrentUserId().map(workshop::isOwnedBy).orElse(false);
    }

    // ── Validation ───────────────────────────────────────────────────────────

    private String validateTitle(String raw) {
        String title = raw.trim();
        if (title.isEmpty()) {
            throw new BusinessException("Title cannot be empty");
        }
        if (title.codePointCount(0, title.length()) > MAX_TITLE_LENGTH) {
            throw new BusinessException("Title must not exceed " + MAX_TITLE_LENGTH + " characters");
        }
        return title;
    }

    private String validateDescription(String raw) {
        String description = raw.trim();
        if (description.isEmpty()) {
            throw new BusinessException("Description cannot be empty");
        }
        if (description.codePointCount(0, description.length()) > MAX_DESCRIPTION_LENGTH) {
            throw new BusinessException("Description must not exceed " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return description;
    }

    private Workshop.WorkshopStatus parseStatus(String value) {
        return Workshop.WorkshopStatus.fromValue(value)
                .orElseThrow(() -> new BusinessException("Status must be one of: pending, ongoing, completed"));
    }

    private Workshop.VenueType parseVenueType(String value) {
        return Workshop.VenueType.fromValue(value)
                .orElseThrow(() -> new BusinessException("Venue type must be one of: online, physical"));
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private List<WorkshopDto> toDtos(List<Workshop> workshops) {
        Map<UUID, Long> counts = buildParticipantCountMap(workshops);
        return workshops.stream()
                .map(w -> toDto(w, counts.getOrDefault(w.getId(), 0L)))
                .collect(Collectors.toList());
    }

    /** One grouped query for the whole list instead of a count per workshop. */
    private Map<UUID, Long> buildParticipantCountMap(List<Workshop> workshops) {
        if (workshops.isEmpty())
            return Map.of();
        List<UUID> ids = workshops.stream().map(Workshop::getId).collect(Collectors.toList());
        return participantRepository.countJoinedByWorkshopIds(ids).stream()
                .collect(Collectors.toMap(
                        row -> (UUID) row[0],
                        row -> (Long) row[1]));
    }

    public WorkshopDto toDto(Workshop workshop) {
        return toDto(workshop, participantRepository.countJoinedByWorkshopId(workshop.getId()));
    }

    private WorkshopDto toDto(Workshop workshop, long participantCount) {
        User owner = workshop.getOwner();
        return WorkshopDto.builder()
                .id(workshop.getId())
                .title(workshop.getTitle())
                .description(workshop.getDescription())
                .status(workshop.getStatus())
                .signupEnabled(workshop.getSignupEnabled())
                .ownerId(owner != null ? owner.getId() : null)
                .ownerName(owner != null ? owner.getName() : null)
                .workshopDate(workshop.getWorkshopDate())
                .venueType(workshop.getVenueType())
                .venueAddress(workshop.getVenueAddress())
                .participantCount(participantCount)
                .createdAt(workshop.getCreatedAt())
                .updatedAt(workshop.getUpdatedAt())
                .build();
    }
}
