package com.socialnet.service;

import com.socialnet.dto.request.CommentRequest;
import com.socialnet.dto.response.CommentResponse;
import com.socialnet.entity.Comment;
import com.socialnet.entity.Post;
import com.socialnet.entity.Profile;
import com.socialnet.entity.User;
import com.socialnet.exception.ResourceNotFoundException;
import com.socialnet.exception.UnauthorizedException;
import com.socialnet.repository.CommentRepository;
import com.socialnet.repository.PostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CommentService.
 *
 * Comments are looked up under their post, and only the comment's author may
 * change or remove it.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CommentService Unit Tests")
class CommentServiceTest {

    @Mock
    private CommentRepository commentRepository;

    @Mock
    private PostRepository postRepository;

    @Mock
    private ProfileService profileService;

    @InjectMocks
    private CommentService commentService;

    private UUID authorUserId;
    private Profile author;
    private Post post;
    private Comment comment;

    @BeforeEach
    void setUp() {
        authorUserId = UUID.randomUUID();
        User user = new User("c@example.com", "hashed");
        user.setId(authorUserId);
        author = new Profile(user, "commenter", null, null);
        author.setId(5L);
        post = new Post(author, null, "post", null);
        post.setId(20L);
        comment = new Comment(post, author, "first!");
        comment.setId(30L);
    }

    @Test
    @DisplayName("createComment should save the comment under the post")
    void testCreateComment() {
        when(profileService.findByUser(authorUserId)).thenReturn(author);
        when(postRepository.findById(20L)).thenReturn(Optional.of(post));
        when(commentRepository.save(any(Comment.class))).thenAnswer(inv -> inv.getArgument(0));

        CommentResponse response = commentService.createComment(authorUserId, 20L,
                CommentRequest.builder().content("nice").build());

        assertEquals("nice", response.getContent());
        assertEquals(20L, response.getPostId());
        assertEquals("commenter", response.getAuthorUsername());
    }

    @Test
    @DisplayName("commenting on an unknown post is not found")
    void testCreateComment_UnknownPost() {
        when(profileService.findByUser(authorUserId)).thenReturn(author);
        when(postRepository.findById(20L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> commentService.createComment(authorUserId, 20L,
                CommentRequest.builder().content("nice").build()));
        verify(commentRepository, never()).save(any());
    }

    @Test
    @DisplayName("a comment requested under another post is not found")
    void testGetComment_WrongPost() {
        when(postRepository.findById(21L)).thenReturn(Optional.of(new Post()));
        when(commentRepository.findByIdAndPostId(30L, 21L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> commentService.getComment(21L, 30L));
    }

    @Test
    @DisplayName("listComments should return the post's comments in order")
    void testListComments() {
        Comment second = new Comment(post, author, "second");
        second.setId(31L);
        when(postRepository.findById(20L)).thenReturn(Optional.of(post));
        when(commentRepository.findByPostOrdered(20L)).thenReturn(List.of(comment, second));

        List<CommentResponse> comments = commentService.listComments(20L);

        assertEquals(List.of(30L, 31L), comments.stream().map(CommentResponse::getId).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("only the author may edit a comment")
    void testUpdateComment_NotAuthor() {
        when(postRepository.findById(20L)).thenReturn(Optional.of(post));
        when(commentRepository.findByIdAndPostId(30L, 20L)).thenReturn(Optional.of(comment));

        assertThrows(UnauthorizedException.class, () -> commentService.updateComment(UUID.randomUUID(), 20L, 30L,
                CommentRequest.builder().content("edited").build()));
        assertEquals("first!", comment.getContent());
        verify(commentRepository, never()).save(any());
    }

    @Test
    @DisplayName("the author may edit a comment")
    void testUpdateComment_Author() {
        when(postRepository.findById(20L)).thenReturn(Optional.of(post));
        when(commentRepository.findByIdAndPostId(30L, 20L)).thenReturn(Optional.of(comment));
        when(commentRepository.save(comment)).thenReturn(comment);

        CommentResponse response = commentService.updateComment(authorUserId, 20L, 30L,
                CommentRequest.builder().content("edited").build());

        assertEquals("edited", response.getContent());
    }

    @Test
    @DisplayName("only the author may delete a comment")
    void testDeleteComment() {
        when(postRepository.findById(20L)).thenReturn(Optional.of(post));
        when(commentRepository.findByIdAndPostId(30L, 20L)).thenReturn(Optional.of(comment));

        assertThrows(UnauthorizedException.class,
                () -> commentService.deleteComment(UUID.randomUUID(), 20L, 30L));
        verify(commentRepository, never()).delete(any());

        commentService.deleteComment(authorUserId, 20L, 30L);
        verify(commentRepository).delete(comment);
    }
}
