package com.gbu.workshophub.modules.workshop;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gbu.workshophub.modules.user.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "workshops")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Workshop {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private WorkshopStatus status = WorkshopStatus.PENDING;

    @Column(name = "signup_enabled", nullable = false)
    @Builder.Default
    private Boolean signupEnabled = true;

    // null once the owning account has been deleted
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "owner_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User owner;

    @Column(name = "workshop_date")
    private LocalDate workshopDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "venue_type", length = 20)
    private VenueType venueType;

    @Column(name = "venue_address", length = 500)
    private String venueAddress;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isOwnedBy(UUID userId) {
        return owner != null && owner.getId().equals(userId);
    }

    public enum WorkshopStatus {
        PENDING, ONGOING, COMPLETED;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<WorkshopStatus> fromValue(String value) {
            return Arrays.stream(values()).filter(s -> s.getValue().equals(value)).findFirst();
        }
    }

    public enum VenueType {
        ONLINE, PHYSICAL;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<VenueType> fromValue(String value) {
            return Arrays.stream(values()).filter(v -> v.getValue().equals(value)).findFirst();
        }
    }
}
