package com.socialnet.repository;

import com.socialnet.entity.Comment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for post comments.
 */
@Repository
public interface CommentRepository extends JpaRepository<Comment, Long> {

    /** Comments of a post, oldest first, with their authors loaded. */
    @Query("SELECT c FROM Comment c JOIN FETCH c.author " +
           "WHERE c.post.id = :postId ORDER BY c.commentedAt ASC, c.id ASC")
    List<Comment> findByPostOrdered(@Param("postId") Long postId);

    Optional<Comment> findByIdAndPostId(Long id, Long postId);

    long countByPostId(Long postId);

    @Modifying
    @Query("DELETE FROM Comment c WHERE c.post.id = :postId")
    int deleteByPost(@Param("postId") Long postId);

    /**
     * Delete comments written by the profile and comments on the profile's posts.
     *
     * @return number of rows deleted
     */
    @Modifying
    @Query("DELETE FROM Comment c WHERE c.author.id = :profileId " +
           "OR c.post.id IN (SELECT p.id FROM Post p WHERE p.author.id = :profileId)")
    int deleteAllInvolving(@Param("profileId") Long profileId);
}
