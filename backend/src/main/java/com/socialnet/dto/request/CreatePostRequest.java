package com.socialnet.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for creating a post.
 *
 * Without {@code scheduledAt} the post is created immediately. With a future
 * {@code scheduledAt} a CREATE_POST job is enqueued and the post appears once the
 * job runs.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "title": "Hello",
 *   "content": "hi",
 *   "hashtags": ["intro", "news"],
 *   "scheduledAt": "2030-01-01T09:00:00"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePostRequest {

    @Size(max = 200, message = "Title must be at most 200 characters")
    private String title;

    @NotBlank(message = "Content is required")
    @Size(max = 5000, message = "Content must be at most 5000 characters")
    private String content;

    @Size(max = 500, message = "Image reference must be at most 500 characters")
    private String image;

    @Builder.Default
    @Size(max = 30, message = "At most 30 hashtags are allowed")
    private List<String> hashtags = new ArrayList<>();

    /**
     * Publication time as UTC wall-clock time. Must not be in the past.
     */
    private LocalDateTime scheduledAt;
}
