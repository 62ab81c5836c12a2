package com.socialnet.service;

import com.socialnet.dto.response.PostResponse;
import com.socialnet.entity.Post;
import com.socialnet.entity.PostLike;
import com.socialnet.entity.Profile;
import com.socialnet.exception.ConflictException;
import com.socialnet.exception.ResourceNotFoundException;
import com.socialnet.repository.PostLikeRepository;
import com.socialnet.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for liking and unliking posts.
 *
 * Business Rules:
 * - A profile likes a post at most once; a second like is a conflict (409)
 * - Unliking a post that is not liked is a bad request (400)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LikeService {

    private final PostLikeRepository likeRepository;
    private final PostRepository postRepository;
    private final ProfileService profileService;

    /**
     * @throws ResourceNotFoundException if the post does not exist
     * @throws ConflictException if the caller already likes the post
     */
    @Transactional
    public void like(UUID userId, Long postId) {
        Profile profile = profileService.findByUser(userId);
        Post post = findPost(postId);
        if (likeRepository.existsByPostIdAndProfileId(post.getId(), profile.getId())) {
            throw ConflictException.alreadyLiked(postId);
        }
        likeRepository.save(new PostLike(post, profile));
        log.info("Post liked: postId={}, profileId={}", postId, profile.getId());
    }

    /**
     * @throws ResourceNotFoundException if the post does not exist
     * @throws IllegalArgumentException if the caller does not like the post
     */
    @Transactional
    public void unlike(UUID userId, Long postId) {
        Profile profile = profileService.findByUser(userId);
        Post post = findPost(postId);
        PostLike like = likeRepository.findByPostIdAndProfileId(post.getId(), profile.getId())
                .orElseThrow(() -> new IllegalArgumentException(
                        String.format("You have not liked post '%s'.", postId)));
        likeRepository.delete(like);
        log.info("Post unliked: postId={}, profileId={}", postId, profile.getId());
    }

    /** Posts the caller likes, most recently liked first. */
    @Transactional(readOnly = true)
    public List<PostResponse> likedPosts(UUID userId) {
        Profile profile = profileService.findByUser(userId);
        return postRepository.findLikedBy(profile.getId()).stream()
                .map(PostResponse::from)
                .collect(Collectors.toList());
    }

    private Post findPost(Long postId) {
        return postRepository.findById(postId)
                .orElseThrow(() -> ResourceNotFoundException.of("Post", postId));
    }
}
