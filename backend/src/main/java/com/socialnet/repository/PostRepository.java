package com.socialnet.repository;

import com.socialnet.entity.Post;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Post entity.
 */
@Repository
public interface PostRepository extends JpaRepository<Post, Long> {

    List<Post> findByAuthorIdOrderByCreatedAtDesc(Long authorId);

    /**
     * Filter posts by hashtag caption and/or author username. Null filters match everything.
     *
     * @param hashtag exact hashtag caption
     * @param authorUsername exact author username
     * @return matching posts, newest first
     */
    @Query("SELECT DISTINCT p FROM Post p " +
           "JOIN FETCH p.author a " +
           "LEFT JOIN p.hashtags h " +
           "WHERE (:hashtag IS NULL OR h.caption = :hashtag) " +
           "AND (:authorUsername IS NULL OR a.username = :authorUsername) " +
           "ORDER BY p.createdAt DESC")
    List<Post> search(@Param("hashtag") String hashtag,
                      @Param("authorUsername") String authorUsername);

    /** Posts liked by a profile, most recently liked first. */
    @Query("SELECT p FROM PostLike l JOIN l.post p JOIN FETCH p.author " +
           "WHERE l.profile.id = :profileId ORDER BY l.likedAt DESC")
    List<Post> findLikedBy(@Param("profileId") Long profileId);

    /** Posts authored by the profiles that {@code followerId} follows, newest first. */
    @Query("SELECT p FROM Post p JOIN FETCH p.author a " +
           "WHERE a.id IN (SELECT f.followee.id FROM FollowingInteraction f WHERE f.follower.id = :followerId) " +
           "ORDER BY p.createdAt DESC")
    List<Post> findByFolloweesOf(@Param("followerId") Long followerId);
}
