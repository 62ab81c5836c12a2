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
 * Like of a post by a profile. A profile likes a post at most once.
 *
 * Database Table: likes
 */
@Entity
@Table(name = "likes",
        uniqueConstraints = @UniqueConstraint(name = "uk_like_post_profile", columnNames = {"post_id", "profile_id"}),
        indexes = @Index(name = "idx_like_profile_id", columnList = "profile_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PostLike {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "post_id", nullable = false, foreignKey = @ForeignKey(name = "fk_like_post"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Post post;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "profile_id", nullable = false, foreignKey = @ForeignKey(name = "fk_like_profile"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Profile profile;

    @CreationTimestamp
    @Column(name = "liked_at", nullable = false, updatable = false)
    private LocalDateTime likedAt;

    public PostLike(Post post, Profile profile) {
        this.post = post;
        this.profile = profile;
    }
}
