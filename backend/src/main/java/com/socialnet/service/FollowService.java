package com.socialnet.service;

import com.socialnet.dto.response.FollowResponse;
import com.socialnet.entity.FollowingInteraction;
import com.socialnet.entity.Profile;
import com.socialnet.exception.ConflictException;
import com.socialnet.exception.ResourceNotFoundException;
import com.socialnet.repository.FollowingInteractionRepository;
import com.socialnet.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for the follow graph between profiles.
 *
 * Business Rules:
 * - A profile cannot follow or unfollow itself (409)
 * - Following a profile twice is a conflict (409)
 * - Unfollowing a profile that is not followed is a bad request (400)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FollowService {

    private final FollowingInteractionRepository followRepository;
    private final ProfileRepository profileRepository;
    private final ProfileService profileService;

    /**
     * Make the current user's profile follow {@code profileId}.
     *
     * @throws ResourceNotFoundException if the target profile does not exist
     * @throws ConflictException if the target is the caller or is already followed
     */
    @Transactional
    public FollowResponse follow(UUID userId, Long profileId) {
        Profile follower = profileService.findByUser(userId);
        Profile followee = findProfile(profileId);
        if (follower.getId().equals(followee.getId())) {
            throw ConflictException.selfFollow();
        }
        if (followRepository.existsByFollowerIdAndFolloweeId(follower.getId(), followee.getId())) {
            throw ConflictException.alreadyFollowing(followee.getUsername());
        }

        FollowingInteraction saved = followRepository.save(new FollowingInteraction(follower, followee));
        log.info("Profile followed: followerId={}, followeeId={}", follower.getId(), followee.getId());
        return FollowResponse.of(followee, saved.getFollowedAt());
    }

    /**
     * Remove the follow edge from the current user's profile to {@code profileId}.
     *
     * @throws ResourceNotFoundException if the target profile does not exist
     * @throws ConflictException if the target is the caller
     * @throws IllegalArgumentException if the target is not followed
     */
    @Transactional
    public void unfollow(UUID userId, Long profileId) {
        Profile follower = profileService.findByUser(userId);
        Profile followee = findProfile(profileId);
        if (follower.getId().equals(followee.getId())) {
            throw ConflictException.selfFollow();
        }
        FollowingInteraction edge = followRepository
                .findByFollowerIdAndFolloweeId(follower.getId(), followee.getId())
                .orElseThrow(() -> new IllegalArgumentException(
                        String.format("You are not following '%s'.", followee.getUsername())));

        followRepository.delete(edge);
        log.info("Profile unfollowed: followerId={}, followeeId={}", follower.getId(), followee.getId());
    }

    @Transactional(readOnly = true)
    public List<FollowResponse> followersOf(UUID userId) {
        Profile profile = profileService.findByUser(userId);
        return followRepository.findFollowersOf(profile.getId()).stream()
                .map(edge -> FollowResponse.of(edge.getFollower(), edge.getFollowedAt()))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<FollowResponse> followeesOf(UUID userId) {
        Profile profile = profileService.findByUser(userId);
        return followRepository.findFolloweesOf(profile.getId()).stream()
                .map(edge -> FollowResponse.of(edge.getFollowee(), edge.getFollowedAt()))
                .collect(Collectors.toList());
    }

    private Profile findProfile(Long profileId) {
        return profileRepository.findById(profileId)
                .orElseThrow(() -> ResourceNotFoundException.of("Profile", profileId));
    }
}
