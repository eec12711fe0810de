package com.gbu.workshophub.modules.points;

import com.gbu.workshophub.modules.user.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

/**
 * Running totals for one user. A rank of 0 means "not ranked yet".
 */
@Entity
@Table(name = "user_points")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserPoints {

    @Id
    @Column(name = "user_id")
    private UUID userId;

    @MapsId
    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Column(name = "total_points", nullable = false)
    @Builder.Default
    private Integer totalPoints = 0;

    @Column(name = "lessons_completed", nullable = false)
    @Builder.Default
    private Integer lessonsCompleted = 0;

    @Column(name = "challenges_completed", nullable = false)
    @Builder.Default
    private Integer challengesCompleted = 0;

    @Column(name = "exams_passed", nullable = false)
    @Builder.Default
    private Integer examsPassed = 0;

    @Column(name = "current_rank", nullable = false)
    @Builder.Default
    private Integer currentRank = 0;

    @Column(name = "previous_rank", nullable = false)
    @Builder.Default
    private Integer previousRank = 0;

    // moves only on awards; ties on total_points rank the earlier scorer first
    @Column(name = "last_updated", nullable = false)
    @Builder.Default
    private Instant lastUpdated = Instant.now();

    void addPoints(int points, Instant at) {
        this.totalPoints += points;
        this.lastUpdated = at;
    }
}
