package com.socialnet.dto.response;

import com.socialnet.entity.Profile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One entry of a follower or followee list: the other profile and when the edge was made.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FollowResponse {

    private Long profileId;

    private String username;

    private LocalDateTime followedAt;

    public static FollowResponse of(Profile other, LocalDateTime followedAt) {
        return FollowResponse.builder()
                .profileId(other.getId())
                .username(other.getUsername())
                .followedAt(followedAt)
                .build();
    }
}
