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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProfileService Unit Tests")
class ProfileServiceTest {

    @Mock
    private ProfileRepository profileRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private PostRepository postRepository;

    @Mock
    private FollowingInteractionRepository followRepository;

    @Mock
    private PostLikeRepository likeRepository;

    @Mock
    private CommentRepository commentRepository;

    @Mock
    private MediaStorageService mediaStorageService;

    @InjectMocks
    private ProfileService profileService;

    private UUID userId;
    private User user;
    private Profile profile;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        user = new User("ada@example.com", "hashed");
        user.setId(userId);
        profile = new Profile(user, "ada", "Ada", "Lovelace");
        profile.setId(7L);
        profile.setBio("first programmer");
    }

    @Test
    @DisplayName("update changes only the fields that are present")
    void testUpdateProfile_Partial() {
        when(profileRepository.findByUserId(userId)).thenReturn(Optional.of(profile));
        when(profileRepository.save(any(Profile.class))).thenAnswer(inv -> inv.getArgument(0));

        ProfileResponse response = profileService.updateProfileOfUser(userId,
                UpdateProfileRequest.builder().bio("analyst").birthDate(LocalDate.of(1815, 12, 10)).build());

        assertEquals("analyst", response.getBio());
        assertEquals("Ada", response.getFirstName());
        assertEquals("Lovelace", response.getLastName());
        assertEquals("ada", response.getUsername());
        assertEquals(LocalDate.of(1815, 12, 10), response.getBirthDate());
    }

    @Test
    @DisplayName("changing the username to one already taken is a conflict")
    void testUpdateProfile_UsernameTaken() {
        when(profileRepository.findByUserId(userId)).thenReturn(Optional.of(profile));
        when(profileRepository.existsByUsername("grace")).thenReturn(true);

        assertThrows(DuplicateResourceException.class, () -> profileService.updateProfileOfUser(userId,
                UpdateProfileRequest.builder().username("grace").build()));
        assertEquals("ada", profile.getUsername());
        verify(profileRepository, never()).save(any());
    }

    @Test
    @DisplayName("own profile carries follower and followee totals")
    void testGetProfile_Totals() {
        when(profileRepository.findByUserId(userId)).thenReturn(Optional.of(profile));
        when(followRepository.countByFolloweeId(7L)).thenReturn(3L);
        when(followRepository.countByFollowerId(7L)).thenReturn(1L);

        ProfileResponse response = profileService.getProfileOfUser(userId);

        assertEquals(3L, response.getFollowersTotal());
        assertEquals(1L, response.getFolloweesTotal());
    }

    @Test
    @DisplayName("a user without a profile is not found")
    void testGetProfile_Missing() {
        when(profileRepository.findByUserId(userId)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> profileService.getProfileOfUser(userId));
    }

    @Test
    @DisplayName("an unknown profile id is not found")
    void testGetProfileById_Missing() {
        when(profileRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> profileService.getProfile(99L));
    }

    @Test
    @DisplayName("blank search filters are passed as null, others are trimmed")
    void testSearch_NormalizesFilters() {
        when(profileRepository.search("ad", null, null)).thenReturn(List.of(profile));

        List<ProfileResponse> results = profileService.search("  ad ", "", null);

        assertEquals(1, results.size());
        assertEquals("ada", results.get(0).getUsername());
        assertNull(results.get(0).getFollowersTotal());
        verify(profileRepository).search("ad", null, null);
    }

    @Test
    @DisplayName("deleting the account removes relations, posts, profile and user in that order")
    void testDeleteCurrentUser() {
        // Arrange
        profile.setProfileImage("profile_images/ada-lovelace-1.png");
        Post post = new Post(profile, null, "hi", "post_images/p-1.png");
        when(profileRepository.findByUserId(userId)).thenReturn(Optional.of(profile));
        when(postRepository.findByAuthorIdOrderByCreatedAtDesc(7L)).thenReturn(List.of(post));

        // Act
        profileService.deleteCurrentUser(userId);

        // Assert
        InOrder inOrder = inOrder(followRepository, likeRepository, commentRepository,
                postRepository, profileRepository, userRepository);
        inOrder.verify(followRepository).deleteAllInvolving(7L);
        inOrder.verify(likeRepository).deleteAllInvolving(7L);
        inOrder.verify(commentRepository).deleteAllInvolving(7L);
        inOrder.verify(postRepository).deleteAll(List.of(post));
        inOrder.verify(profileRepository).delete(profile);
        inOrder.verify(userRepository).delete(user);
        verify(mediaStorageService).delete("post_images/p-1.png");
        verify(mediaStorageService).delete("profile_images/ada-lovelace-1.png");
    }

    @Test
    @DisplayName("profile image is named after the full name and stored under profile_images")
    void testUploadImage() {
        // Arrange
        MockMultipartFile file = new MockMultipartFile("file", "me.jpg", "image/jpeg", new byte[]{1});
        when(profileRepository.findByUserId(userId)).thenReturn(Optional.of(profile));
        when(mediaStorageService.storeImage(MediaStorageService.PROFILE_IMAGES, "Ada Lovelace", file))
                .thenReturn("profile_images/ada-lovelace-x.jpg");

        // Act
        ImageUploadResponse response = profileService.uploadImage(userId, file);

        // Assert
        assertEquals("profile_images/ada-lovelace-x.jpg", response.getImage());
        assertEquals("profile_images/ada-lovelace-x.jpg", profile.getProfileImage());
        verify(profileRepository).save(profile);
        verify(mediaStorageService).delete(null);
    }
}
