package com.socialnet.dto.response;

import com.socialnet.entity.Comment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentResponse {

    private Long id;

    private Long postId;

    private Long authorId;

    private String authorUsername;

    private String content;

    private LocalDateTime commentedAt;

    public static CommentResponse from(Comment comment) {
        return CommentResponse.builder()
                .id(comment.getId())
                .postId(comment.getPost().getId())
                .authorId(comment.getAuthor().getId())
                .authorUsername(comment.getAuthor().getUsername())
                .content(comment.getContent())
                .commentedAt(comment.getCommentedAt())
                .build();
    }
}
