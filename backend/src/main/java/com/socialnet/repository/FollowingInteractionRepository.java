package com.socialnet.repository;

import com.socialnet.entity.FollowingInteraction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for follow edges between profiles.
 */
@Repository
public interface FollowingInteractionRepository extends JpaRepository<FollowingInteraction, Long> {

    boolean existsByFollowerIdAndFolloweeId(Long followerId, Long followeeId);

    Optional<FollowingInteraction> findByFollowerIdAndFolloweeId(Long followerId, Long followeeId);

    long countByFolloweeId(Long followeeId);

    long countByFollowerId(Long followerId);

    /** Edges pointing at a profile, with the follower loaded. */
    @Query("SELECT f FROM FollowingInteraction f JOIN FETCH f.follower " +
           "WHERE f.followee.id = :profileId ORDER BY f.followedAt DESC")
    List<FollowingInteraction> findFollowersOf(@Param("profileId") Long profileId);

    /** Edges leaving a profile, with the followee loaded. */
    @Query("SELECT f FROM FollowingInteraction f JOIN FETCH f.followee " +
           "WHERE f.follower.id = :profileId ORDER BY f.followedAt DESC")
    List<FollowingInteraction> findFolloweesOf(@Param("profileId") Long profileId);

    /**
     * Delete every edge in which the profile takes part.
     *
     * @return number of rows deleted
     */
    @Modifying
    @Query("DELETE FROM FollowingInteraction f WHERE f.follower.id = :profileId OR f.followee.id = :profileId")
    int deleteAllInvolving(@Param("profileId") Long profileId);
}
