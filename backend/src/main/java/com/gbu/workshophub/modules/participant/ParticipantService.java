package com.gbu.workshophub.modules.participant;

import com.gbu.workshophub.exception.BusinessException;
import com.gbu.workshophub.exception.ConflictException;
import com.gbu.workshophub.exception.ResourceNotFoundException;
import com.gbu.workshophub.exception.UnauthorizedAccessException;
import com.gbu.workshophub.modules.user.User;
import com.gbu.workshophub.modules.user.UserService;
import com.gbu.workshophub.modules.workshop.Workshop;
import com.gbu.workshophub.modules.workshop.WorkshopService;
import com.gbu.workshophub.security.SecurityUtils;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ParticipantService {
    private static final Logger log = LoggerFactory.getLogger(ParticipantService.class);

    private final ParticipantRepository participantRepository;
    private final WorkshopService workshopService;
    private final UserService userService;
    private final SecurityUtils securityUtils;

    // ── Caller: request to join a workshop ───────────────────────────────────

    @Transactional
    public ParticipantDto join(UUID workshopId) {
        Workshop workshop = workshopService.findWorkshop(workshopId);
        UUID userId = securityUtils.getCurrentUserId();

        if (workshop.isOwnedBy(userId)) {
            throw new BusinessException("OWNER_CANNOT_JOIN", "Workshop owners cannot join their own workshops");
        }

        participantRepository.findByWorkshopIdAndUserId(workshopId, userId).ifPresent(existing -> {
            throw new ConflictException("ALREADY_JOINED",
                    "You have already joined this workshop with status: " + existing.getStatus().getValue());
        });

        Participant participant = Participant.builder()
                .workshop(workshop)
                .user(userService.findUser(userId))
                .status(Participant.ParticipantStatus.PENDING)
                .build();

        try {
            participant = participantRepository.saveAndFlush(participant);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("DUPLICATE_PARTICIPANT", "You have already joined this workshop");
        }

        log.info("User {} requested to join workshop {}", userId, workshopId);
        return toDto(participant);
    }

    // ── Owner: approve / reject / waitlist ───────────────────────────────────

    @Transactional
    public ParticipantDto updateStatus(UUID workshopId, UUID participantId, String status) {
        Workshop workshop = workshopService.findWorkshop(workshopId);
        workshopService.requireOwner(workshop, "update participant status");
        Participant participant = findParticipantInWorkshop(workshopId, participantId);

        if (status == null || status.isBlank()) {
            throw new BusinessException("MISSING_STATUS", "Status is required");
        }
        Participant.ParticipantStatus newStatus = Participant.ParticipantStatus.fromValue(status)
                .orElseThrow(() -> new BusinessException("INVALID_STATUS",
                        "Status must be one of: pending, joined, rejected, waitlisted"));

        participant.setStatus(newStatus);
        if (newStatus.isDecision()) {
            participant.setApprovedAt(Instant.now());
            participant.setApprovedBy(userService.findUser(securityUtils.getCurrentUserId()));
        }

        participant = participantRepository.save(participant);
        log.info("Participant {} of workshop {} set to {}", participantId, workshopId, newStatus);
        return toDto(participant);
    }

    // ── Owner or self: remove ─────────────────────────────────────────────────

    @Transactional
    public void remove(UUID workshopId, UUID participantId) {
        Workshop workshop = workshopService.findWorkshop(workshopId);
        Participant participant = findParticipantInWorkshop(workshopId, participantId);
        UUID actorId = securityUtils.getCurrentUserId();

        if (!workshop.isOwnedBy(actorId) && !participant.getUser().getId().equals(actorId)) {
            throw new UnauthorizedAccessException("You can only remove yourself or participants of your own workshop");
        }

        participantRepository.delete(participant);
        log.info("Participant {} removed from workshop {} by {}", participantId, workshopId, actorId);
    }

    // ── Listing ──────────────────────────────────────────────────────────────

    /** Owner view: every participant bucketed by status, all four buckets present. */
    @Transactional(readOnly = true)
    public Map<String, List<ParticipantDto>> getParticipantsGrouped(UUID workshopId) {
        Workshop workshop = workshopService.findWorkshop(workshopId);
        workshopService.requireOwner(workshop, "view participants");

        Map<String, List<ParticipantDto>> grouped = new LinkedHashMap<>();
        for (Participant.ParticipantStatus s : Participant.ParticipantStatus.values()) {
            grouped.put(s.getValue(), new ArrayList<>());
        }
        for (Participant p : participantRepository.findByWorkshopIdWithUser(workshopId)) {
            grouped.get(p.getStatus().getValue()).add(toDto(p));
        }
        return grouped;
    }

    @Transactional(readOnly = true)
    public List<ParticipantDto> getParticipantsByStatus(UUID workshopId, String status) {
        Workshop workshop = workshopService.findWorkshop(workshopId);
        workshopService.requireOwner(workshop, "view participants");

        Participant.ParticipantStatus filter = Participant.ParticipantStatus.fromValue(status)
                .orElseThrow(() -> new BusinessException("INVALID_STATUS",
                        "Status must be one of: pending, joined, rejected, waitlisted"));

        return participantRepository.findByWorkshopIdAndStatusWithUser(workshopId, filter).stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<JoinedWorkshopDto> getMyParticipations() {
        return participantRepository.findByUserIdWithWorkshop(securityUtils.getCurrentUserId()).stream()
                .map(this::toJoinedDto)
                .collect(Collectors.toList());
    }

    // ── Gatekeeping for lessons / challenges / exams ─────────────────────────

    public boolean isJoinedParticipant(UUID workshopId, UUID userId) {
        return participantRepository.existsByWorkshopIdAndUserIdAndStatus(workshopId, userId,
                Participant.ParticipantStatus.JOINED);
    }

    public void requireJoinedParticipant(UUID workshopId, UUID userId) {
        if (!isJoinedParticipant(workshopId, userId)) {
            throw new UnauthorizedAccessException("You must be a joined participant of this workshop");
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Participant findParticipantInWorkshop(UUID workshopId, UUID participantId) {
        Participant participant = participantRepository.findById(participantId)
                .orElseThrow(() -> new ResourceNotFoundException("Participant", participantId.toString()));
        if (!participant.getWorkshop().getId().equals(workshopId)) {
            throw new BusinessException("INVALID_PARTICIPANT", "Participant does not belong to this workshop");
        }
        return participant;
    }

    private ParticipantDto toDto(Participant p) {
        User user = p.getUser();
        User approver = p.getApprovedBy();
        return ParticipantDto.builder()
                .id(p.getId())
                .workshopId(p.getWorkshop().getId())
                .userId(user.getId())
                .userName(user.getName())
                .userEmail(user.getEmail())
                .status(p.getStatus())
                .requestedAt(p.getRequestedAt())
                .approvedAt(p.getApprovedAt())
                .approvedBy(approver != null ? approver.getId() : null)
                .build();
    }

    private JoinedWorkshopDto toJoinedDto(Participant p) {
        Workshop w = p.getWorkshop();
        return JoinedWorkshopDto.builder()
                .id(p.getId())
                .workshopId(w.getId())
                .status(p.getStatus())
                .requestedAt(p.getRequestedAt())
                .approvedAt(p.getApprovedAt())
                .workshopTitle(w.getTitle())
                .workshopDescription(w.getDescription())
                .workshopStatus(w.getStatus())
                .ownerId(w.getOwner() != null ? w.getOwner().getId() : null)
                .build();
    }

    @Data
    @Builder
    public static class ParticipantDto {
        private UUID id;
        private UUID workshopId;
        private UUID userId;
        private String userName;
        private String userEmail;
        private Participant.ParticipantStatus status;
        private Instant requestedAt;
        private Instant approvedAt;
        private UUID approvedBy;
    }

    @Data
    @Builder
    public static class JoinedWorkshopDto {
        private UUID id;
        private UUID workshopId;
        private Participant.ParticipantStatus status;
        private Instant requestedAt;
        private Instant approvedAt;
        private String workshopTitle;
        private String workshopDescription;
        private Workshop.WorkshopStatus workshopStatus;
        private UUID ownerId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpdateStatusRequest {
        private String status;
    }
}
