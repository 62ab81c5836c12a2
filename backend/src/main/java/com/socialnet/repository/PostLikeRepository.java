package com.socialnet.repository;

import com.socialnet.entity.PostLike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for post likes.
 */
@Repository
public interface PostLikeRepository extends JpaRepository<PostLike, Long> {

    boolean existsByPostIdAndProfileId(Long postId, Long profileId);

    Optional<PostLike> findByPostIdAndProfileId(Long postId, Long profileId);

    long countByPostId(Long postId);

    @Modifying
    @Query("DELETE FROM PostLike l WHERE l.post.id = :postId")
    int deleteByPost(@Param("postId") Long postId);

    /**
     * Delete likes given by the profile and likes on the profile's posts.
     *
     * @return number of rows deleted
     */
    @Modifying
    @Query("DELETE FROM PostLike l WHERE l.profile.id = :profileId " +
           "OR l.post.id IN (SELECT p.id FROM Post p WHERE p.author.id = :profileId)")
    int deleteAllInvolving(@Param("profileId") Long profileId);
}
