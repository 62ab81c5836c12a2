package com.socialnet.service;

import com.socialnet.dto.request.CommentRequest;
import com.socialnet.dto.response.CommentResponse;
import com.socialnet.entity.Comment;
import com.socialnet.entity.Post;
import com.socialnet.entity.Profile;
import com.socialnet.exception.ResourceNotFoundException;
import com.socialnet.exception.UnauthorizedException;
import com.socialnet.repository.CommentRepository;
import com.socialnet.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for comments under a post. Anyone authenticated may read and write
 * comments; only the comment's author may edit or delete it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CommentService {

    private final CommentRepository commentRepository;
    private final PostRepository postRepository;
    private final ProfileService profileService;

    @Transactional(readOnly = true)
    public List<CommentResponse> listComments(Long postId) {
        findPost(postId);
        return commentRepository.findByPostOrdered(postId).stream()
                .map(CommentResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public CommentResponse createComment(UUID userId, Long postId, CommentRequest request) {
        Profile author = profileService.findByUser(userId);
        Post post = findPost(postId);
        Comment saved = commentRepository.save(new Comment(post, author, request.getContent()));
        log.info("Comment created: commentId={}, postId={}, authorId={}", saved.getId(), postId, author.getId());
        return CommentResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public CommentResponse getComment(Long postId, Long commentId) {
        return CommentResponse.from(findComment(postId, commentId));
    }

    /**
     * Replace the content of a comment.
     *
     * @throws UnauthorizedException if the caller did not write the comment
     */
    @Transactional
    public CommentResponse updateComment(UUID userId, Long postId, Long commentId, CommentRequest request) {
        Comment comment = findComment(postId, commentId);
        requireAuthor(comment, userId, "edit");
        comment.setContent(request.getContent());
        log.info("Comment updated: commentId={}", commentId);
        return CommentResponse.from(commentRepository.save(comment));
    }

    /**
     * @throws UnauthorizedException if the caller did not write the comment
     */
    @Transactional
    public void deleteComment(UUID userId, Long postId, Long commentId) {
        Comment comment = findComment(postId, commentId);
        requireAuthor(comment, userId, "delete");
        commentRepository.delete(comment);
        log.info("Comment deleted: commentId={}", commentId);
    }

    private void requireAuthor(Comment comment, UUID userId, String action) {
        if (!comment.getAuthor().getUser().getId().equals(userId)) {
            log.warn("Comment action rejected: action={}, commentId={}, requester={}", action, comment.getId(), userId);
            throw UnauthorizedException.insufficientPermissions(action, "this comment");
        }
    }

    private Post findPost(Long postId) {
        return postRepository.findById(postId)
                .orElseThrow(() -> ResourceNotFoundException.of("Post", postId));
    }

    /** A comment is found only under the post it belongs to. */
    private Comment findComment(Long postId, Long commentId) {
        findPost(postId);
        return commentRepository.findByIdAndPostId(commentId, postId)
                .orElseThrow(() -> ResourceNotFoundException.of("Comment", commentId));
    }
}
