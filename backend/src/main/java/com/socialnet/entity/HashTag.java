package com.socialnet.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hashtag attached to posts. Captions are unique and created on first use.
 *
 * Database Table: hashtags
 */
@Entity
@Table(name = "hashtags", indexes = {
    @Index(name = "idx_hashtag_caption", columnList = "caption", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HashTag {

    public static final int MAX_CAPTION_LENGTH = 50;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "caption", nullable = false, unique = true, length = MAX_CAPTION_LENGTH)
    private String caption;

    public HashTag(String caption) {
        this.caption = caption;
    }
}
