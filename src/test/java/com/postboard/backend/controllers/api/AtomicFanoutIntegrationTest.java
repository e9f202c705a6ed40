package com.postboard.backend.controllers.api;

import com.postboard.backend.IntegrationTestSupport;
import com.postboard.backend.models.Post;
import com.postboard.backend.services.NotificationService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * With atomic fan-out the post and its notifications share one transaction.
 */
@TestPropertySource(properties = "postboard.notifications.atomic-fan-out=true")
class AtomicFanoutIntegrationTest extends IntegrationTestSupport {

    @MockBean
    private NotificationService notificationService;

    @Test
    void createPost_WhenBatchFails_ShouldRollBackThePostToo() throws Exception {
        createUser("alice");
        createUser("bob");
        when(notificationService.fanOut(any(Post.class)))
                .thenThrow(new DataIntegrityViolationException("notification insert failed"));

        mockMvc.perform(post("/api/public/posts_21201532")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"T\",\"content\":\"C\",\"username\":\"alice\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Failed to create post"))
                .andExpect(jsonPath("$.details").value("notification insert failed"))
                .andExpect(jsonPath("$.post_id").doesNotExist());

        assertThat(postRepository.count()).isZero();
    }
}
