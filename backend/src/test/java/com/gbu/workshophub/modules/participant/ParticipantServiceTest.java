package com.gbu.workshophub.modules.participant;

import com.gbu.workshophub.exception.BusinessException;
import com.gbu.workshophub.exception.ConflictException;
import com.gbu.workshophub.exception.ResourceNotFoundException;
import com.gbu.workshophub.exception.UnauthorizedAccessException;
import com.gbu.workshophub.modules.participant.ParticipantService.ParticipantDto;
import com.gbu.workshophub.modules.user.User;
import com.gbu.workshophub.modules.user.UserService;
import com.gbu.workshophub.modules.workshop.Workshop;
import com.gbu.workshophub.modules.workshop.WorkshopService;
import com.gbu.workshophub.security.SecurityUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ParticipantService")
class ParticipantServiceTest {

    @Mock
    private ParticipantRepository participantRepository;

    @Mock
    private WorkshopService workshopService;

    @Mock
    private UserService userService;

    @Mock
    private SecurityUtils securityUtils;

    @InjectMocks
    private ParticipantService participantService;

    private User owner;
    private User learner;
    private Workshop workshop;

    @BeforeEach
    void setUp() {
        owner = User.builder().id(UUID.randomUUID()).name("Owner").email("owner@example.com").build();
        learner = User.builder().id(UUID.randomUUID()).name("Learner").email("learner@example.com").build();
        workshop = Workshop.builder().id(UUID.randomUUID()).title("Kotlin").description("Basics").owner(owner).build();
    }

    private Participant participant(User user, Participant.ParticipantStatus status) {
        return Participant.builder()
                .id(UUID.randomUUID())
                .workshop(workshop)
                .user(user)
                .status(status)
                .build();
    }

    // ── join ──────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("join creates a pending participation")
    void join_createsPending() {
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(securityUtils.getCurrentUserId()).thenReturn(learner.getId());
        when(participantRepository.findByWorkshopIdAndUserId(workshop.getId(), learner.getId()))
                .thenReturn(Optional.empty());
        when(userService.findUser(learner.getId())).thenReturn(learner);
        when(participantRepository.saveAndFlush(any(Participant.class))).thenAnswer(inv -> inv.getArgument(0));

        ParticipantDto dto = participantService.join(workshop.getId());

        assertThat(dto.getStatus()).isEqualTo(Participant.ParticipantStatus.PENDING);
        assertThat(dto.getUserId()).isEqualTo(learner.getId());
        assertThat(dto.getApprovedAt()).isNull();
    }

    @Test
    @DisplayName("join is refused to the workshop owner")
    void join_ownerRefused() {
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(securityUtils.getCurrentUserId()).thenReturn(owner.getId());

        assertThatThrownBy(() -> participantService.join(workshop.getId()))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo("OWNER_CANNOT_JOIN");
    }

    @Test
    @DisplayName("join reports the existing status on a second request")
    void join_alreadyJoined() {
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(securityUtils.getCurrentUserId()).thenReturn(learner.getId());
        when(participantRepository.findByWorkshopIdAndUserId(workshop.getId(), learner.getId()))
                .thenReturn(Optional.of(participant(learner, Participant.ParticipantStatus.WAITLISTED)));

        assertThatThrownBy(() -> participantService.join(workshop.getId()))
                .isInstanceOf(ConflictException.class)
                .hasMessage("You have already joined this workshop with status: waitlisted");
        verify(participantRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("join maps a lost race on the unique constraint to a conflict")
    void join_raceLost() {
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(securityUtils.getCurrentUserId()).thenReturn(learner.getId());
        when(participantRepository.findByWorkshopIdAndUserId(workshop.getId(), learner.getId()))
                .thenReturn(Optional.empty());
        when(userService.findUser(learner.getId())).thenReturn(learner);
        doThrow(new DataIntegrityViolationException("uq_participants_workshop_user"))
                .when(participantRepository).saveAndFlush(any(Participant.class));

        assertThatThrownBy(() -> participantService.join(workshop.getId()))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("DUPLICATE_PARTICIPANT");
    }

    @Test
    @DisplayName("join propagates WORKSHOP_NOT_FOUND before anything else")
    void join_unknownWorkshop() {
        UUID id = UUID.randomUUID();
        when(workshopService.findWorkshop(id)).thenThrow(new ResourceNotFoundException("Workshop", id.toString()));

        assertThatThrownBy(() -> participantService.join(id))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(securityUtils, never()).getCurrentUserId();
    }

    // ── updateStatus ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("approving stamps approved_at and approved_by")
    void updateStatus_joinedStampsApproval() {
        Participant p = participant(learner, Participant.ParticipantStatus.PENDING);
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(participantRepository.findById(p.getId())).thenReturn(Optional.of(p));
        when(securityUtils.getCurrentUserId()).thenReturn(owner.getId());
        when(userService.findUser(owner.getId())).thenReturn(owner);
        when(participantRepository.save(p)).thenReturn(p);

        ParticipantDto dto = participantService.updateStatus(workshop.getId(), p.getId(), "joined");

        assertThat(dto.getStatus()).isEqualTo(Participant.ParticipantStatus.JOINED);
        assertThat(dto.getApprovedAt()).isNotNull();
        assertThat(dto.getApprovedBy()).isEqualTo(owner.getId());
    }

    @Test
    @DisplayName("rejecting stamps approved_at and approved_by too")
    void updateStatus_rejectedStampsDecision() {
        Participant p = participant(learner, Participant.ParticipantStatus.WAITLISTED);
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(participantRepository.findById(p.getId())).thenReturn(Optional.of(p));
        when(securityUtils.getCurrentUserId()).thenReturn(owner.getId());
        when(userService.findUser(owner.getId())).thenReturn(owner);
        when(participantRepository.save(p)).thenReturn(p);

        ParticipantDto dto = participantService.updateStatus(workshop.getId(), p.getId(), "rejected");

        assertThat(dto.getStatus()).isEqualTo(Participant.ParticipantStatus.REJECTED);
        assertThat(dto.getApprovedAt()).isNotNull();
        assertThat(dto.getApprovedBy()).isEqualTo(owner.getId());
        assertThat(p.getApprovedBy()).isSameAs(owner);
    }

    @Test
    @DisplayName("waitlisting does not stamp an approval")
    void updateStatus_waitlistedNoStamp() {
        Participant p = participant(learner, Participant.ParticipantStatus.PENDING);
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(participantRepository.findById(p.getId())).thenReturn(Optional.of(p));
        when(participantRepository.save(p)).thenReturn(p);

        ParticipantDto dto = participantService.updateStatus(workshop.getId(), p.getId(), "waitlisted");

        assertThat(dto.getStatus()).isEqualTo(Participant.ParticipantStatus.WAITLISTED);
        assertThat(dto.getApprovedAt()).isNull();
        assertThat(dto.getApprovedBy()).isNull();
    }

    @Test
    @DisplayName("updateStatus rejects a participant from another workshop")
    void updateStatus_wrongWorkshop() {
        Workshop other = Workshop.builder().id(UUID.randomUUID()).title("x").description("y").owner(owner).build();
        Participant p = Participant.builder().id(UUID.randomUUID()).workshop(other).user(learner).build();
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(participantRepository.findById(p.getId())).thenReturn(Optional.of(p));

        assertThatThrownBy(() -> participantService.updateStatus(workshop.getId(), p.getId(), "joined"))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo("INVALID_PARTICIPANT");
    }

    @Test
    @DisplayName("updateStatus validates the status value after ownership")
    void updateStatus_invalidStatus() {
        Participant p = participant(learner, Participant.ParticipantStatus.PENDING);
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(participantRepository.findById(p.getId())).thenReturn(Optional.of(p));

        assertThatThrownBy(() -> participantService.updateStatus(workshop.getId(), p.getId(), "banned"))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo("INVALID_STATUS");
        assertThatThrownBy(() -> participantService.updateStatus(workshop.getId(), p.getId(), " "))
                .isInstanceOf(BusinessException.class)
                .extracting("code").isEqualTo("MISSING_STATUS");
        verify(workshopService, times(2)).requireOwner(workshop, "update participant status");
    }

    @Test
    @DisplayName("updateStatus by a non-owner is forbidden")
    void updateStatus_nonOwner() {
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        doThrow(new UnauthorizedAccessException("Only the workshop owner can update participant status"))
                .when(workshopService).requireOwner(any(Workshop.class), anyString());

        assertThatThrownBy(() -> participantService.updateStatus(workshop.getId(), UUID.randomUUID(), "joined"))
                .isInstanceOf(UnauthorizedAccessException.class);
        verify(participantRepository, never()).findById(any());
    }

    // ── remove ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("a participant may remove themselves")
    void remove_self() {
        Participant p = participant(learner, Participant.ParticipantStatus.JOINED);
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(participantRepository.findById(p.getId())).thenReturn(Optional.of(p));
        when(securityUtils.getCurrentUserId()).thenReturn(learner.getId());

        participantService.remove(workshop.getId(), p.getId());

        verify(participantRepository).delete(p);
    }

    @Test
    @DisplayName("a third party cannot remove a participant")
    void remove_stranger() {
        Participant p = participant(learner, Participant.ParticipantStatus.JOINED);
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(participantRepository.findById(p.getId())).thenReturn(Optional.of(p));
        when(securityUtils.getCurrentUserId()).thenReturn(UUID.randomUUID());

        assertThatThrownBy(() -> participantService.remove(workshop.getId(), p.getId()))
                .isInstanceOf(UnauthorizedAccessException.class);
        verify(participantRepository, never()).delete(any());
    }

    // ── listing ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("grouped listing always returns all four buckets")
    void getParticipantsGrouped_allBuckets() {
        when(workshopService.findWorkshop(workshop.getId())).thenReturn(workshop);
        when(participantRepository.findByWorkshopIdWithUser(workshop.getId()))
                .thenReturn(List.of(participant(learner, Participant.ParticipantStatus.JOINED)));

        Map<String, List<ParticipantDto>> grouped = participantService.getParticipantsGrouped(workshop.getId());

        assertThat(grouped).containsOnlyKeys("pending", "joined", "rejected", "waitlisted");
        assertThat(grouped.get("joined")).hasSize(1);
        assertThat(grouped.get("pending")).isEmpty();
    }

    @Test
    @DisplayName("requireJoinedParticipant refuses pending participants")
    void requireJoinedParticipant_pending() {
        when(participantRepository.existsByWorkshopIdAndUserIdAndStatus(workshop.getId(), learner.getId(),
                Participant.ParticipantStatus.JOINED)).thenReturn(false);

        assertThatThrownBy(() -> participantService.requireJoinedParticipant(workshop.getId(), learner.getId()))
                .isInstanceOf(UnauthorizedAccessException.class)
                .hasMessage("You must be a joined participant of this workshop");
    }
}
