package com.socialnet.controller;

import com.socialnet.dto.request.CommentRequest;
import com.socialnet.dto.response.CommentResponse;
import com.socialnet.security.CurrentUser;
import com.socialnet.service.CommentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Comments nested under a post.
 *
 * Error Responses:
 * - 400 Bad Request: blank content
 * - 403 Forbidden: editing or deleting another user's comment
 * - 404 Not Found: unknown post, or a comment that is not under this post
 */
@RestController
@RequestMapping("/api/posts/{postId}/comments")
@RequiredArgsConstructor
public class CommentController {

    private final CommentService commentService;

    @GetMapping
    public ResponseEntity<List<CommentResponse>> listComments(@PathVariable Long postId) {
        return ResponseEntity.ok(commentService.listComments(postId));
    }

    @PostMapping
    public ResponseEntity<CommentResponse> createComment(@PathVariable Long postId,
                                                         @Valid @RequestBody CommentRequest request,
                                                         Authentication authentication) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(commentService.createComment(CurrentUser.id(authentication), postId, request));
    }

    @GetMapping("/{commentId}")
    public ResponseEntity<CommentResponse> getComment(@PathVariable Long postId, @PathVariable Long commentId) {
        return ResponseEntity.ok(commentService.getComment(postId, commentId));
    }

    @PutMapping("/{commentId}")
    public ResponseEntity<CommentResponse> updateComment(@PathVariable Long postId,
                                                         @PathVariable Long commentId,
                                                         @Valid @RequestBody CommentRequest request,
                                                         Authentication authentication) {
        return ResponseEntity.ok(commentService.updateComment(CurrentUser.id(authentication), postId, commentId, request));
    }

    @DeleteMapping("/{commentId}")
    public ResponseEntity<Void> deleteComment(@PathVariable Long postId,
                                              @PathVariable Long commentId,
                                              Authentication authentication) {
        commentService.deleteComment(CurrentUser.id(authentication), postId, commentId);
        return ResponseEntity.noContent().build();
    }
}
