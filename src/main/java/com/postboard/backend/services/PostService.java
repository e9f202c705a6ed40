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
import com.postboard.backend.util.PostMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Post creation and listing.
 *
 * <p>Two creation paths exist. The form path stores a post for the session user and, unless
 * {@code postboard.notifications.fan-out-on-form-posts} is set, notifies nobody. The publish
 * path (public JSON API) stores the post and then fans out one notification per other user.
 *
 * <p>By default publishing has two commit points: the post commits on its own, then the
 * notification batch commits. A failure in between leaves the post durable with nobody notified
 * and surfaces as {@link NotificationFanoutException}. Setting
 * {@code postboard.notifications.atomic-fan-out} puts both writes in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostService {

    static final String CREATE_FAILED = "Failed to create post. Please try again.";

    private final PostRepository postRepository;
    private final UserRepository userRepository;
    private final NotificationService notificationService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Value("${postboard.notifications.atomic-fan-out:false}")
    private boolean atomicFanOut;

    @Value("${postboard.notifications.fan-out-on-form-posts:false}")
    private boolean fanOutOnFormPosts;

    /**
     * Form path: stores a post owned by the given (session) user.
     *
     * @throws PostCreationException with a display-safe message when persistence fails
     */
    public PostDto createForUser(Long authorId, String title, String content) {
        try {
            if (fanOutOnFormPosts) {
                User author = userRepository.findById(authorId)
                        .orElseThrow(() -> new PostCreationException(CREATE_FAILED,
                                new IllegalStateException("Session user " + authorId + " no longer exists")));
                return publish(author, title, content).getPost();
            }

            PostDto created = transactionTemplate.execute(status ->
                    PostMapper.toDTO(savePost(userRepository.getReferenceById(authorId), title, content)));
            log.info("✅ Post {} created by user {} via form", created.getId(), authorId);
            return created;
        } catch (DataAccessException | TransactionException | NotificationFanoutException e) {
            log.error("❌ Failed to create post for user {}: {}", authorId, e.getMessage(), e);
            throw new PostCreationException(CREATE_FAILED, e);
        }
    }

    /**
     * Publish path: stores a post for the named author and notifies every other user.
     *
     * @throws UserNotFoundException        when no user has that username
     * @throws NotificationFanoutException  when the post committed but the notification batch did not
     * @throws PostCreationException        when nothing was committed; the cause carries the store error
     */
    public PublishedPost publish(String authorUsername, String title, String content) {
        User author = userRepository.findByUsername(authorUsername)
                .orElseThrow(() -> new UserNotFoundException(authorUsername));
        try {
            return publish(author, title, content);
        } catch (DataAccessException | TransactionException e) {
            log.error("❌ Failed to publish post for {}: {}", authorUsername, e.getMessage(), e);
            throw new PostCreationException(CREATE_FAILED, e);
        }
    }

    PublishedPost publish(User author, String title, String content) {
        if (atomicFanOut) {
            return transactionTemplate.execute(status -> {
                Post post = savePost(author, title, content);
                int notified = notificationService.fanOut(post);
                log.info("✅ Post {} by {} published with {} notifications", post.getId(), author.getUsername(), notified);
                return new PublishedPost(PostMapper.toDTO(post), notified);
            });
        }

        // first commit point: the post alone
        Post post = transactionTemplate.execute(status -> savePost(author, title, content));
        log.info("Post {} by {} committed, fanning out notifications", post.getId(), author.getUsername());

        // second commit point: the notification batch
        try {
            Integer notified = transactionTemplate.execute(status -> notificationService.fanOut(post));
            return new PublishedPost(PostMapper.toDTO(post), notified != null ? notified : 0);
        } catch (RuntimeException e) {
            log.error("❌ Post {} is saved but its notifications were not: {}", post.getId(), e.getMessage(), e);
            throw new NotificationFanoutException(post.getId(), e);
        }
    }

    private Post savePost(User author, String title, String content) {
        Post post = Post.builder()
                .title(title)
                .content(content)
                .author(author)
                .createdAt(OffsetDateTime.now(clock))
                .build();
        return postRepository.saveAndFlush(post);
    }

    @Transactional(readOnly = true)
    public List<PostDto> getAllPosts() {
        return PostMapper.toDTOList(postRepository.findAllWithAuthorNewestFirst());
    }

    @Transactional(readOnly = true)
    public List<PostDto> getRecentPostsForUser(Long userId) {
        return PostMapper.toDTOList(postRepository.findTop5ByAuthorIdOrderByCreatedAtDescIdDesc(userId));
    }

    @Transactional(readOnly = true)
    public long countPostsForUser(Long userId) {
        return postRepository.countByAuthorId(userId);
    }
}
