package com.postboard.backend.services;

import com.postboard.backend.dto.PostDto;
import com.postboard.backend.dto.PublishedPost;
import com.postboard.backend.exceptions.NotificationFanoutException;
import com.postboard.backend.exceptions.PostCreationException;
import com.postboard.backend.exceptions.UserNotFoundException;
import com.postboard.backend.models.Post;
import com.postboard.backend.models.User;
import com.postboard.backend.repositories.PostRepository;
import com.postboard.backend.repositories.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PostService. The transaction manager is a mock so each commit and rollback
 * issued by the service can be counted.
 */
@ExtendWith(MockitoExtension.class)
class PostServiceTest {

    @Mock
    private PostRepository postRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private NotificationService notificationService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private PostService postService;
    private User alice;

    @BeforeEach
    void setUp() {
        postService = new PostService(postRepository, userRepository, notificationService,
                new TransactionTemplate(transactionManager),
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));

        alice = User.builder().id(1L).username("alice").email("alice@x.com").build();
    }

    private void stubPostInsert() {
        when(postRepository.saveAndFlush(any(Post.class))).thenAnswer(invocation -> {
            Post post = invocation.getArgument(0);
            post.setId(10L);
            return post;
        });
    }

    @Test
    void publish_ShouldCommitPostBeforeNotificationBatch() {
        // Given
        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(alice));
        stubPostInsert();
        when(notificationService.fanOut(any(Post.class))).thenReturn(2);

        // When
        PublishedPost result = postService.publish("alice", "T", "C");

        // Then
        assertThat(result.getNotified()).isEqualTo(2);
        assertThat(result.getPost().getId()).isEqualTo(10L);
        assertThat(result.getPost().getAuthor()).isEqualTo("alice");
        assertThat(result.getPost().getTitle()).isEqualTo("T");

        InOrder inOrder = inOrder(postRepository, transactionManager, notificationService);
        inOrder.verify(postRepository).saveAndFlush(any(Post.class));
        inOrder.verify(transactionManager).commit(any());
        inOrder.verify(notificationService).fanOut(argThat(post -> post.getId().equals(10L)));
        inOrder.verify(transactionManager).commit(any());
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    void publish_WhenNotificationBatchFails_ShouldKeepCommittedPost() {
        // Given
        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(alice));
        stubPostInsert();
        when(notificationService.fanOut(any(Post.class)))
                .thenThrow(new DataIntegrityViolationException("notification insert failed"));

        // When / Then
        assertThatThrownBy(() -> postService.publish("alice", "T", "C"))
                .isInstanceOf(NotificationFanoutException.class)
                .satisfies(ex -> assertThat(((NotificationFanoutException) ex).getPostId()).isEqualTo(10L));

        // the post transaction committed, only the batch rolled back
        verify(transactionManager, times(1)).commit(any());
        verify(transactionManager, times(1)).rollback(any());
    }

    @Test
    void publish_InAtomicMode_ShouldRollBackPostWithFailedBatch() {
        // Given
        ReflectionTestUtils.setField(postService, "atomicFanOut", true);
        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(alice));
        stubPostInsert();
        when(notificationService.fanOut(any(Post.class)))
                .thenThrow(new DataIntegrityViolationException("notification insert failed"));

        // When / Then
        assertThatThrownBy(() -> postService.publish("alice", "T", "C"))
                .isInstanceOf(PostCreationException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);

        verify(transactionManager, never()).commit(any());
        verify(transactionManager, times(1)).rollback(any());
    }

    @Test
    void publish_InAtomicMode_ShouldCommitOnce() {
        // Given
        ReflectionTestUtils.setField(postService, "atomicFanOut", true);
        when(userRepository.findByUsername("alice")).thenReturn(Optional.of(alice));
        stubPostInsert();
        when(notificationService.fanOut(any(Post.class))).thenReturn(1);

        // When
        PublishedPost result = postService.publish("alice", "T", "C");

        // Then
        assertThat(result.getNotified()).isEqualTo(1);
        verify(transactionManager, times(1)).commit(any());
    }

    @Test
    void publish_WithUnknownAuthor_ShouldThrowWithoutWriting() {
        when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> postService.publish("ghost", "T", "C"))
                .isInstanceOf(UserNotFoundException.class);

        verifyNoInteractions(postRepository, notificationService, transactionManager);
    }

    @Test
    void createForUser_ShouldNotFanOutByDefault() {
        // Given
        when(userRepository.getReferenceById(1L)).thenReturn(alice);
        stubPostInsert();

        // When
        PostDto created = postService.createForUser(1L, "Form title", "Form body");

        // Then
        assertThat(created.getId()).isEqualTo(10L);
        assertThat(created.getAuthor()).isEqualTo("alice");
        verifyNoInteractions(notificationService);
    }

    @Test
    void createForUser_WithFormFanOutEnabled_ShouldNotifyOtherUsers() {
        // Given
        ReflectionTestUtils.setField(postService, "fanOutOnFormPosts", true);
        when(userRepository.findById(1L)).thenReturn(Optional.of(alice));
        stubPostInsert();
        when(notificationService.fanOut(any(Post.class))).thenReturn(4);

        // When
        postService.createForUser(1L, "Form title", "Form body");

        // Then
        verify(notificationService).fanOut(any(Post.class));
    }

    @Test
    void createForUser_WhenInsertFails_ShouldRollBackAndReportGenerically() {
        // Given
        when(userRepository.getReferenceById(1L)).thenReturn(alice);
        when(postRepository.saveAndFlush(any(Post.class)))
                .thenThrow(new DataIntegrityViolationException("value too long for type character varying(200)"));

        // When / Then
        assertThatThrownBy(() -> postService.createForUser(1L, "T", "C"))
                .isInstanceOf(PostCreationException.class)
                .hasMessage("Failed to create post. Please try again.");

        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }
}
