package com.socialnet.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Directed follow edge: {@code follower} follows {@code followee}.
 *
 * A pair is stored at most once. Self-follows are rejected by the service.
 *
 * Database Table: following_interactions
 */
@Entity
@Table(name = "following_interactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_follow_pair", columnNames = {"follower_id", "followee_id"}),
        indexes = @Index(name = "idx_follow_followee_id", columnList = "followee_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FollowingInteraction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "follower_id", nullable = false, foreignKey = @ForeignKey(name = "fk_follow_follower"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Profile follower;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "followee_id", nullable = false, foreignKey = @ForeignKey(name = "fk_follow_followee"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Profile followee;

    @CreationTimestamp
    @Column(name = "followed_at", nullable = false, updatable = false)
    private LocalDateTime followedAt;

    public FollowingInteraction(Profile follower, Profile followee) {
        this.follower = follower;
        this.followee = followee;
    }
}
