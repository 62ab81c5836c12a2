package com.socialnet.dto.response;

import com.socialnet.entity.Profile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Public view of a profile.
 *
 * The follower and followee totals are filled in only where the caller asked
 * for them (own profile and profile detail); list views leave them null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {

    private Long id;

    private String username;

    private String firstName;

    private String lastName;

    private String bio;

    private LocalDate birthDate;

    private String phoneNumber;

    private String profileImage;

    private Long followersTotal;

    private Long followeesTotal;

    public static ProfileResponse from(Profile profile) {
        return ProfileResponse.builder()
                .id(profile.getId())
                .username(profile.getUsername())
                .firstName(profile.getFirstName())
                .lastName(profile.getLastName())
                .bio(profile.getBio())
                .birthDate(profile.getBirthDate())
                .phoneNumber(profile.getPhoneNumber())
                .profileImage(profile.getProfileImage())
                .build();
    }

    public static ProfileResponse withTotals(Profile profile, long followersTotal, long followeesTotal) {
        ProfileResponse response = from(profile);
        response.setFollowersTotal(followersTotal);
        response.setFolloweesTotal(followeesTotal);
        return response;
    }
}
