package com.socialnet.jobs;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload of a CREATE_POST job: the post to create once the eta passes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePostPayload implements JobPayload {

    /**
     * Id of the author's profile.
     */
    private Long authorId;

    private String title;

    private String content;

    private String image;

    /**
     * Hashtag captions, created on first use.
     */
    @Builder.Default
    private List<String> hashtags = new ArrayList<>();
}
