package com.socialnet.service;

import com.socialnet.dto.request.UpdateProfileRequest;
import com.socialnet.dto.response.ImageUploadResponse;
import com.socialnet.dto.response.ProfileResponse;
import com.socialnet.entity.Post;
import com.socialnet.entity.Profile;
import com.socialnet.entity.User;
import com.socialnet.exception.DuplicateResourceException;
import com.socialnet.exception.ResourceNotFoundException;
import com.socialnet.repository.CommentRepository;
import com.socialnet.repository.FollowingInteractionRepository;
import com.socialnet.repository.PostLikeRepository;
import com.socialnet.repository.PostRepository;
import com.socialnet.repository.ProfileRepository;
import com.socialnet.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class ProfileService {

    private final ProfileRepository profileRepository;
    private final UserRepository userRepository;
    private final PostRepository postRepository;
    private final FollowingInteractionRepository followRepository;
    private final PostLikeRepository likeRepository;
    private final CommentRepository commentRepository;
    private final MediaStorageService mediaStorageService;

    /** Own profile with follower and followee totals. */
    @Transactional(readOnly = true)
    public ProfileResponse getProfileOfUser(UUID userId) {
        return withTotals(findByUser(userId));
    }

    @Transactional(readOnly = true)
    public ProfileResponse getProfile(Long profileId) {
        Profile profile = profileRepository.findById(profileId)
                .orElseThrow(() -> ResourceNotFoundException.of("Profile", profileId));
        return withTotals(profile);
    }

    /**
     * Apply the non-null fields of {@code request} to the caller's profile.
     *
     * @throws DuplicateResourceException if the new username belongs to another profile
     */
    @Transactional
    public ProfileResponse updateProfileOfUser(UUID userId, UpdateProfileRequest request) {
        Profile profile = findByUser(userId);
        if (request.getUsername() != null && !request.getUsername().equals(profile.getUsername())) {
            if (profileRepository.existsByUsername(request.getUsername())) {
                throw DuplicateResourceException.usernameTaken(request.getUsername());
            }
            profile.setUsername(request.getUsername());
        }
        if (request.getFirstName() != null) {
            profile.setFirstName(request.getFirstName());
        }
        if (request.getLastName() != null) {
            profile.setLastName(request.getLastName());
        }
        if (request.getBio() != null) {
            profile.setBio(request.getBio());
        }
        if (request.getBirthDate() != null) {
            profile.setBirthDate(request.getBirthDate());
        }
        if (request.getPhoneNumber() != null) {
            profile.setPhoneNumber(request.getPhoneNumber());
        }
        log.info("Profile updated: profileId={}", profile.getId());
        return withTotals(profileRepository.save(profile));
    }

    /**
     * Store a new profile image and point the profile at it. The previous image
     * file is removed.
     *
     * @throws IllegalArgumentException if the file is empty, too large or not an image
     */
    @Transactional
    public ImageUploadResponse uploadImage(UUID userId, MultipartFile file) {
        Profile profile = findByUser(userId);
        String baseName = (nullToEmpty(profile.getFirstName()) + " " + nullToEmpty(profile.getLastName())).trim();
        String stored = mediaStorageService.storeImage(MediaStorageService.PROFILE_IMAGES,
                baseName.isEmpty() ? profile.getUsername() : baseName, file);

        String previous = profile.getProfileImage();
        profile.setProfileImage(stored);
        profileRepository.save(profile);
        mediaStorageService.delete(previous);

        log.info("Profile image uploaded: profileId={}, image={}", profile.getId(), stored);
        return ImageUploadResponse.uploaded(stored);
    }

    /**
     * Delete the caller's account: follows, likes and comments involving the profile,
     * the profile's posts, the profile and finally the user.
     *
     * Pending CREATE_POST jobs of the user are left in the queue and fail when they
     * run, since their author no longer exists.
     */
    @Transactional
    public void deleteCurrentUser(UUID userId) {
        Profile profile = findByUser(userId);
        Long profileId = profile.getId();

        int follows = followRepository.deleteAllInvolving(profileId);
        int likes = likeRepository.deleteAllInvolving(profileId);
        int comments = commentRepository.deleteAllInvolving(profileId);

        List<Post> posts = postRepository.findByAuthorIdOrderByCreatedAtDesc(profileId);
        posts.forEach(post -> mediaStorageService.delete(post.getImage()));
        postRepository.deleteAll(posts);

        String profileImage = profile.getProfileImage();
        User user = profile.getUser();
        profileRepository.delete(profile);
        userRepository.delete(user);
        mediaStorageService.delete(profileImage);

        log.info("Account deleted: userId={}, profileId={}, posts={}, follows={}, likes={}, comments={}",
                userId, profileId, posts.size(), follows, likes, comments);
    }

    /**
     * Case-insensitive contains search over username, first and last name.
     * Blank filters are ignored.
     */
    @Transactional(readOnly = true)
    public List<ProfileResponse> search(String username, String firstName, String lastName) {
        return profileRepository.search(blankToNull(username), blankToNull(firstName), blankToNull(lastName))
                .stream()
                .map(ProfileResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Profile findByUser(UUID userId) {
        return profileRepository.findByUserId(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("Profile of user", userId));
    }

    private ProfileResponse withTotals(Profile profile) {
        return ProfileResponse.withTotals(profile,
                followRepository.countByFolloweeId(profile.getId()),
                followRepository.countByFollowerId(profile.getId()));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
