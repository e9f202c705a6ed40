package com.postboard.backend.services;

import com.postboard.backend.dto.NotificationDto;
import com.postboard.backend.exceptions.UserNotFoundException;
import com.postboard.backend.models.Notification;
import com.postboard.backend.models.Post;
import com.postboard.backend.models.User;
import com.postboard.backend.repositories.NotificationRepository;
import com.postboard.backend.repositories.UserRepository;
import com.postboard.backend.util.NotificationMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    /**
     * Writes one unread notification per user other than the post's author.
     * Joins the caller's transaction when there is one.
     *
     * @return number of notifications written
     */
    @Transactional
    public int fanOut(Post post) {
        User author = post.getAuthor();
        List<User> recipients = userRepository.findByIdNotOrderByIdAsc(author.getId());

        String message = buildMessage(author.getUsername(), post.getTitle());
        OffsetDateTime now = OffsetDateTime.now(clock);

        List<Notification> batch = recipients.stream()
                .map(recipient -> Notification.builder()
                        .recipient(recipient)
                        .post(post)
                        .message(message)
                        .read(false)
                        .createdAt(now)
                        .build())
                .collect(Collectors.toList());

        notificationRepository.saveAll(batch);
        log.info("Fanned out post {} by {} to {} users", post.getId(), author.getUsername(), batch.size());
        return batch.size();
    }

    static String buildMessage(String authorUsername, String title) {
        String message = String.format("New post by %s: %s", authorUsername, title);
        if (message.length() > Notification.MAX_MESSAGE_LENGTH) {
            return message.substring(0, Notification.MAX_MESSAGE_LENGTH);
        }
        return message;
    }

    @Transactional(readOnly = true)
    public List<NotificationDto> getForUser(Long userId) {
        return NotificationMapper.toDTOList(
                notificationRepository.findByRecipientIdOrderByCreatedAtDescIdDesc(userId));
    }

    @Transactional(readOnly = true)
    public List<NotificationDto> getForUsername(String username) {
        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> new UserNotFoundException(username));
        return getForUser(user.getId());
    }

    @Transactional(readOnly = true)
    public long countUnread(Long userId) {
        return notificationRepository.countByRecipientIdAndReadFalse(userId);
    }

    /**
     * Flips every unread notification of the named user to read in one bulk update.
     * Calling it again when nothing is unread changes nothing and still succeeds.
     *
     * @return number of notifications that were unread before the call
     */
    @Transactional
    public int markAllRead(String username) {
        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> new UserNotFoundException(username));

        int updated = notificationRepository.markAllReadForRecipient(user.getId());
        log.info("Marked {} notifications read for {}", updated, username);
        return updated;
    }
}
