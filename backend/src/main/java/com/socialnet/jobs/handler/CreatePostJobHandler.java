package com.socialnet.jobs.handler;

import com.socialnet.entity.Post;
import com.socialnet.jobs.CreatePostPayload;
import com.socialnet.jobs.JobHandler;
import com.socialnet.jobs.JobKind;
import com.socialnet.service.PostService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes a scheduled post. A missing author profile fails the job.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CreatePostJobHandler implements JobHandler<CreatePostPayload> {

    private final PostService postService;

    @Override
    public JobKind kind() {
        return JobKind.CREATE_POST;
    }

    @Override
    public Class<CreatePostPayload> payloadType() {
        return CreatePostPayload.class;
    }

    @Override
    public void handle(CreatePostPayload payload) {
        Post post = postService.publish(payload);
        log.debug("Scheduled post created: postId={}, authorId={}", post.getId(), payload.getAuthorId());
    }
}
