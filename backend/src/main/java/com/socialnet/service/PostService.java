package com.socialnet.service;

import com.socialnet.dto.request.CreatePostRequest;
import com.socialnet.dto.response.ImageUploadResponse;
import com.socialnet.dto.response.PostResponse;
import com.socialnet.dto.response.ScheduledPostResponse;
import com.socialnet.entity.HashTag;
import com.socialnet.entity.Post;
import com.socialnet.entity.Profile;
import com.socialnet.entity.ScheduledJob.JobStatus;
import com.socialnet.exception.ResourceNotFoundException;
import com.socialnet.exception.UnauthorizedException;
import com.socialnet.jobs.CreatePostPayload;
import com.socialnet.jobs.JobKind;
import com.socialnet.repository.CommentRepository;
import com.socialnet.repository.HashTagRepository;
import com.socialnet.repository.PostLikeRepository;
import com.socialnet.repository.PostRepository;
import com.socialnet.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for creating, scheduling, listing and deleting posts and their images.
 *
 * Immediate creation and scheduled publication share {@link #publish}, so a post
 * created by a CREATE_POST job is indistinguishable from one created directly.
 *
 * @see com.socialnet.jobs.handler.CreatePostJobHandler
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PostService {

    private final PostRepository postRepository;
    private final ProfileRepository profileRepository;
    private final HashTagRepository hashTagRepository;
    private final ProfileService profileService;
    private final JobQueueClient jobQueueClient;
    private final PostLikeRepository likeRepository;
    private final CommentRepository commentRepository;
    private final MediaStorageService mediaStorageService;

    /**
     * Create a post for the current user right away.
     *
     * @param userId the authenticated user
     * @param request post content
     * @return the created post
     */
    @Transactional
    public PostResponse createPost(UUID userId, CreatePostRequest request) {
        Profile author = profileService.findByUser(userId);
        Post post = publish(toPayload(author, request));
        return PostResponse.from(post);
    }

    /**
     * Enqueue a CREATE_POST job that publishes the post at {@code request.scheduledAt}.
     *
     * @param userId the authenticated user
     * @param request post content with a scheduled time
     * @return the job id and its initial status
     * @throws IllegalArgumentException if the scheduled time is missing or in the past, or a
     *         hashtag is too long; nothing is enqueued in that case
     * @throws com.socialnet.exception.JobSubmissionException if the queue is unreachable
     */
    public ScheduledPostResponse schedulePost(UUID userId, CreatePostRequest request) {
        if (request.getScheduledAt() == null) {
            throw new IllegalArgumentException("Scheduled time is required to schedule a post.");
        }
        Profile author = profileService.findByUser(userId);
        CreatePostPayload payload = toPayload(author, request);

        UUID jobId = jobQueueClient.enqueue(
                JobKind.CREATE_POST, payload, request.getScheduledAt(), userId, null);

        log.info("Post scheduled: jobId={}, authorId={}, scheduledAt={}",
                jobId, author.getId(), request.getScheduledAt());

        return ScheduledPostResponse.builder()
                .jobId(jobId)
                .status(JobStatus.PENDING.name())
                .scheduledAt(request.getScheduledAt())
                .message("Post scheduled for publication")
                .build();
    }

    /**
     * Create the post described by a payload.
     *
     * Steps:
     * 1. Load the author profile
     * 2. Save the post (title, content, image)
     * 3. Get or create each hashtag by caption and attach it
     *
     * @param payload the post to create
     * @return the saved post
     * @throws IllegalArgumentException if the author does not exist or the content is empty
     */
    @Transactional
    public Post publish(CreatePostPayload payload) {
        if (payload.getAuthorId() == null) {
            throw new IllegalArgumentException("Author id is required.");
        }
        if (payload.getContent() == null || payload.getContent().isBlank()) {
            throw new IllegalArgumentException("Post content is required.");
        }

        Profile author = profileRepository.findById(payload.getAuthorId())
                .orElseThrow(() -> new IllegalArgumentException(
                        String.format("Author profile '%s' not found.", payload.getAuthorId())));

        Post post = new Post(author, payload.getTitle(), payload.getContent(), payload.getImage());
        post.setHashtags(resolveHashtags(payload.getHashtags()));
        Post saved = postRepository.save(post);

        log.info("Post published: postId={}, authorId={}, hashtags={}",
                saved.getId(), author.getId(), saved.getHashtags().size());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<PostResponse> listPosts(String hashtag, String authorUsername) {
        String tag = hashtag == null || hashtag.isBlank() ? null : normalizeCaption(hashtag);
        String author = authorUsername == null || authorUsername.isBlank() ? null : authorUsername.trim();
        return postRepository.search(tag, author).stream()
                .map(PostResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public PostResponse getPost(Long postId) {
        return PostResponse.from(findPost(postId));
    }

    /** Posts authored by the caller, newest first. */
    @Transactional(readOnly = true)
    public List<PostResponse> myPosts(UUID userId) {
        Profile author = profileService.findByUser(userId);
        return postRepository.findByAuthorIdOrderByCreatedAtDesc(author.getId()).stream()
                .map(PostResponse::from)
                .collect(Collectors.toList());
    }

    /** Posts by the profiles the caller follows, newest first. */
    @Transactional(readOnly = true)
    public List<PostResponse> followeesPosts(UUID userId) {
        Profile follower = profileService.findByUser(userId);
        return postRepository.findByFolloweesOf(follower.getId()).stream()
                .map(PostResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * Store an image for a post and attach it, replacing any previous one.
     * Only the author may upload.
     *
     * @throws UnauthorizedException if the caller is not the author
     * @throws IllegalArgumentException if the file is empty, too large or not an image
     */
    @Transactional
    public ImageUploadResponse uploadImage(Long postId, UUID userId, MultipartFile file) {
        Post post = findPost(postId);
        requireAuthor(post, userId, "upload an image to");

        String baseName = post.getTitle() == null || post.getTitle().isBlank() ? "post-" + postId : post.getTitle();
        String stored = mediaStorageService.storeImage(MediaStorageService.POST_IMAGES, baseName, file);

        String previous = post.getImage();
        post.setImage(stored);
        postRepository.save(post);
        mediaStorageService.delete(previous);

        log.info("Post image uploaded: postId={}, image={}", postId, stored);
        return ImageUploadResponse.uploaded(stored);
    }

    /**
     * Delete a post with its likes and comments. Only its author may delete it.
     *
     * @throws UnauthorizedException if the caller is not the author
     */
    @Transactional
    public void deletePost(Long postId, UUID userId) {
        Post post = findPost(postId);
        requireAuthor(post, userId, "delete");
        likeRepository.deleteByPost(postId);
        commentRepository.deleteByPost(postId);
        String image = post.getImage();
        postRepository.delete(post);
        mediaStorageService.delete(image);
        log.info("Post deleted: postId={}", postId);
    }

    private void requireAuthor(Post post, UUID userId, String action) {
        if (!post.getAuthor().getUser().getId().equals(userId)) {
            log.warn("Post action rejected: action={}, postId={}, requester={}", action, post.getId(), userId);
            throw UnauthorizedException.insufficientPermissions(action, "this post");
        }
    }

    private Post findPost(Long postId) {
        return postRepository.findById(postId)
                .orElseThrow(() -> ResourceNotFoundException.of("Post", postId));
    }

    private Set<HashTag> resolveHashtags(List<String> captions) {
        Set<HashTag> tags = new LinkedHashSet<>();
        for (String caption : normalizeHashtags(captions)) {
            tags.add(hashTagRepository.findByCaption(caption)
                    .orElseGet(() -> hashTagRepository.save(new HashTag(caption))));
        }
        return tags;
    }

    /**
     * Trim captions, strip a leading '#', drop blanks and duplicates.
     *
     * @throws IllegalArgumentException if a caption is longer than {@link HashTag#MAX_CAPTION_LENGTH}
     */
    static List<String> normalizeHashtags(List<String> captions) {
        Set<String> normalized = new LinkedHashSet<>();
        if (captions == null) {
            return new ArrayList<>();
        }
        for (String raw : captions) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String caption = normalizeCaption(raw);
            if (caption.isEmpty()) {
                continue;
            }
            if (caption.length() > HashTag.MAX_CAPTION_LENGTH) {
                throw new IllegalArgumentException(String.format(
                        "Hashtag '%s' exceeds %d characters.", caption, HashTag.MAX_CAPTION_LENGTH));
            }
            normalized.add(caption);
        }
        return new ArrayList<>(normalized);
    }

    private static CreatePostPayload toPayload(Profile author, CreatePostRequest request) {
        return CreatePostPayload.builder()
                .authorId(author.getId())
                .title(request.getTitle())
                .content(request.getContent())
                .image(request.getImage())
                .hashtags(normalizeHashtags(request.getHashtags()))
                .build();
    }
}
