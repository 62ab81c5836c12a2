package com.socialnet.controller;

import com.socialnet.dto.request.CreatePostRequest;
import com.socialnet.dto.response.ImageUploadResponse;
import com.socialnet.dto.response.MessageResponse;
import com.socialnet.dto.response.PostResponse;
import com.socialnet.security.CurrentUser;
import com.socialnet.service.LikeService;
import com.socialnet.service.PostService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

/**
 * REST Controller for posts.
 *
 * Creation Flow:
 * 1. Without {@code scheduledAt}: the post is created immediately (201 Created)
 * 2. With {@code scheduledAt}: a CREATE_POST job is enqueued for that time and the
 *    job id is returned (202 Accepted); the post appears once a worker runs the job
 *
 * Error Responses:
 * - 400 Bad Request: Validation errors, scheduled time in the past, hashtag too long,
 *   unliking a post that is not liked, invalid image
 * - 403 Forbidden: Deleting another user's post or uploading its image
 * - 404 Not Found: Unknown post id
 * - 409 Conflict: Liking a post twice
 * - 503 Service Unavailable: Job queue unreachable when scheduling
 *
 * @see com.socialnet.service.PostService
 * @see com.socialnet.controller.JobController
 */
@RestController
@RequestMapping("/api/posts")
@RequiredArgsConstructor
@Slf4j
public class PostController {

    private final PostService postService;
    private final LikeService likeService;

    /**
     * Create or schedule a post.
     *
     * Example request (scheduled):
     * <pre>
     * POST /api/posts
     * {
     *   "title": "Launch",
     *   "content": "We are live",
     *   "hashtags": ["launch", "news"],
     *   "scheduledAt": "2030-01-01T09:00:00"
     * }
     * </pre>
     *
     * Example response (scheduled):
     * <pre>
     * HTTP/1.1 202 Accepted
     * {
     *   "jobId": "3f2a...",
     *   "status": "PENDING",
     *   "scheduledAt": "2030-01-01T09:00:00",
     *   "message": "Post scheduled for publication"
     * }
     * </pre>
     */
    @PostMapping
    public ResponseEntity<?> createPost(@Valid @RequestBody CreatePostRequest request,
                                        Authentication authentication) {
        UUID userId = CurrentUser.id(authentication);
        if (request.getScheduledAt() != null) {
            log.info("Scheduled post requested by user: {}, scheduledAt: {}", userId, request.getScheduledAt());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(postService.schedulePost(userId, request));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(postService.createPost(userId, request));
    }

    @GetMapping
    public ResponseEntity<List<PostResponse>> listPosts(
            @RequestParam(required = false) String hashtag,
            @RequestParam(required = false) String authorUsername) {
        return ResponseEntity.ok(postService.listPosts(hashtag, authorUsername));
    }

    @GetMapping("/my-posts")
    public ResponseEntity<List<PostResponse>> myPosts(Authentication authentication) {
        return ResponseEntity.ok(postService.myPosts(CurrentUser.id(authentication)));
    }

    @GetMapping("/followees-posts")
    public ResponseEntity<List<PostResponse>> followeesPosts(Authentication authentication) {
        return ResponseEntity.ok(postService.followeesPosts(CurrentUser.id(authentication)));
    }

    @GetMapping("/liked")
    public ResponseEntity<List<PostResponse>> likedPosts(Authentication authentication) {
        return ResponseEntity.ok(likeService.likedPosts(CurrentUser.id(authentication)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PostResponse> getPost(@PathVariable Long id) {
        return ResponseEntity.ok(postService.getPost(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePost(@PathVariable Long id, Authentication authentication) {
        postService.deletePost(id, CurrentUser.id(authentication));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/like")
    public ResponseEntity<MessageResponse> like(@PathVariable Long id, Authentication authentication) {
        likeService.like(CurrentUser.id(authentication), id);
        return ResponseEntity.status(HttpStatus.CREATED).body(new MessageResponse("Post liked"));
    }

    @PostMapping("/{id}/unlike")
    public ResponseEntity<MessageResponse> unlike(@PathVariable Long id, Authentication authentication) {
        likeService.unlike(CurrentUser.id(authentication), id);
        return ResponseEntity.ok(new MessageResponse("Post unliked"));
    }

    /**
     * Upload the image of a post. Only the author may upload.
     *
     * Endpoint: POST /api/posts/{id}/upload-image (multipart/form-data, part "file")
     */
    @PostMapping(value = "/{id}/upload-image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImageUploadResponse> uploadImage(@PathVariable Long id,
                                                           @RequestParam("file") MultipartFile file,
                                                           Authentication authentication) {
        log.info("Post image upload: postId={}, file={}, size={}KB",
                id, file.getOriginalFilename(), file.getSize() / 1024);
        return ResponseEntity.ok(postService.uploadImage(id, CurrentUser.id(authentication), file));
    }
}
