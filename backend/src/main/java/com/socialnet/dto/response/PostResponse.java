package com.socialnet.dto.response;

import com.socialnet.entity.HashTag;
import com.socialnet.entity.Post;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for a published post.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostResponse {

    private Long id;

    private Long authorId;

    private String authorUsername;

    private String title;

    private String content;

    private String image;

    private List<String> hashtags;

    private LocalDateTime createdAt;

    /**
     * Map an entity to its response. Must run inside a transaction since author
     * and hashtags are lazy.
     */
    public static PostResponse from(Post post) {
        return PostResponse.builder()
                .id(post.getId())
                .authorId(post.getAuthor().getId())
                .authorUsername(post.getAuthor().getUsername())
                .title(post.getTitle())
                .content(post.getContent())
                .image(post.getImage())
                .hashtags(post.getHashtags().stream()
                        .map(HashTag::getCaption)
                        .sorted()
                        .collect(Collectors.toList()))
                .createdAt(post.getCreatedAt())
                .build();
    }
}
