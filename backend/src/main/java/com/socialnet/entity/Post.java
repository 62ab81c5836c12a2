package com.socialnet.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Post entity authored by a {@link Profile}.
 *
 * A post is created either synchronously through the REST API or as the side
 * effect of a CREATE_POST job once the job's eta has passed.
 *
 * Database Table: posts
 */
@Entity
@Table(name = "posts", indexes = {
    @Index(name = "idx_post_author_id", columnList = "author_id"),
    @Index(name = "idx_post_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Post {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Author profile. Foreign key to profiles.
     */
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_id", nullable = false, foreignKey = @ForeignKey(name = "fk_post_author"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Profile author;

    @Column(name = "title", length = 200)
    private String title;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    /**
     * Path of the uploaded image relative to the media root, or an external URL.
     */
    @Column(name = "image", length = 500)
    private String image;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "post_hashtags",
            joinColumns = @JoinColumn(name = "post_id"),
            inverseJoinColumns = @JoinColumn(name = "hashtag_id"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Set<HashTag> hashtags = new LinkedHashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public Post(Profile author, String title, String content, String image) {
        this.author = author;
        this.title = title;
        this.content = content;
        this.image = image;
    }
}
