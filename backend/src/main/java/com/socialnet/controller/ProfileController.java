package com.socialnet.controller;

import com.socialnet.dto.request.UpdateProfileRequest;
import com.socialnet.dto.response.FollowResponse;
import com.socialnet.dto.response.ImageUploadResponse;
import com.socialnet.dto.response.MessageResponse;
import com.socialnet.dto.response.ProfileResponse;
import com.socialnet.security.CurrentUser;
import com.socialnet.service.FollowService;
import com.socialnet.service.ProfileService;
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

/**
 * Profile endpoints: the caller's own profile and account, profile search and
 * detail, and the follow graph.
 *
 * Error Responses:
 * - 400 Bad Request: unfollowing a profile that is not followed, invalid image
 * - 404 Not Found: unknown profile id
 * - 409 Conflict: following oneself, following twice, username taken
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ProfileController {

    private final ProfileService profileService;
    private final FollowService followService;

    @GetMapping("/me")
    public ResponseEntity<ProfileResponse> getMyProfile(Authentication authentication) {
        return ResponseEntity.ok(profileService.getProfileOfUser(CurrentUser.id(authentication)));
    }

    @PutMapping("/me")
    public ResponseEntity<ProfileResponse> updateMyProfile(@Valid @RequestBody UpdateProfileRequest request,
                                                           Authentication authentication) {
        return ResponseEntity.ok(profileService.updateProfileOfUser(CurrentUser.id(authentication), request));
    }

    /**
     * Delete the caller's account with everything it owns. The caller's tokens
     * stop resolving to a profile afterwards.
     */
    @DeleteMapping("/me")
    public ResponseEntity<Void> deleteMyAccount(Authentication authentication) {
        profileService.deleteCurrentUser(CurrentUser.id(authentication));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/me/followers")
    public ResponseEntity<List<FollowResponse>> getMyFollowers(Authentication authentication) {
        return ResponseEntity.ok(followService.followersOf(CurrentUser.id(authentication)));
    }

    @GetMapping("/me/followees")
    public ResponseEntity<List<FollowResponse>> getMyFollowees(Authentication authentication) {
        return ResponseEntity.ok(followService.followeesOf(CurrentUser.id(authentication)));
    }

    /**
     * Upload the caller's profile image.
     *
     * Endpoint: POST /api/me/upload-image (multipart/form-data, part "file")
     */
    @PostMapping(value = "/me/upload-image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImageUploadResponse> uploadMyImage(@RequestParam("file") MultipartFile file,
                                                             Authentication authentication) {
        log.info("Profile image upload: file={}, size={}KB", file.getOriginalFilename(), file.getSize() / 1024);
        return ResponseEntity.ok(profileService.uploadImage(CurrentUser.id(authentication), file));
    }

    @GetMapping("/profiles/{id}")
    public ResponseEntity<ProfileResponse> getProfile(@PathVariable Long id) {
        return ResponseEntity.ok(profileService.getProfile(id));
    }

    @PostMapping("/profiles/{id}/follow")
    public ResponseEntity<FollowResponse> follow(@PathVariable Long id, Authentication authentication) {
        return ResponseEntity.status(HttpStatus.CREATED).body(followService.follow(CurrentUser.id(authentication), id));
    }

    @PostMapping("/profiles/{id}/unfollow")
    public ResponseEntity<MessageResponse> unfollow(@PathVariable Long id, Authentication authentication) {
        followService.unfollow(CurrentUser.id(authentication), id);
        return ResponseEntity.ok(new MessageResponse("Unfollowed successfully"));
    }

    /**
     * Search profiles. Each filter is an optional case-insensitive substring match.
     *
     * Endpoint: GET /api/profiles?username=jo&amp;firstName=&amp;lastName=
     */
    @GetMapping("/profiles")
    public ResponseEntity<List<ProfileResponse>> searchProfiles(
            @RequestParam(required = false) String username,
            @RequestParam(required = false) String firstName,
            @RequestParam(required = false) String lastName) {
        return ResponseEntity.ok(profileService.search(username, firstName, lastName));
    }
}
