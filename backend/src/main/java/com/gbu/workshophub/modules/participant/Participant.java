package com.gbu.workshophub.modules.participant;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gbu.workshophub.modules.user.User;
import com.gbu.workshophub.modules.workshop.Workshop;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "participants", uniqueConstraints = @UniqueConstraint(name = "uq_participants_workshop_user", columnNames = {
        "workshop_id", "user_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Participant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "workshop_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Workshop workshop;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ParticipantStatus status = ParticipantStatus.PENDING;

    @CreationTimestamp
    @Column(name = "requested_at", updatable = false)
    private Instant requestedAt;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "approved_by")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User approvedBy;

    public enum ParticipantStatus {
        PENDING, JOINED, REJECTED, WAITLISTED;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<ParticipantStatus> fromValue(String value) {
            return Arrays.stream(values()).filter(s -> s.getValue().equals(value)).findFirst();
        }

        /** joined and rejected are decisions; they carry an approval stamp. */
        public boolean isDecision() {
            return this == JOINED || this == REJECTED;
        }
    }
}
