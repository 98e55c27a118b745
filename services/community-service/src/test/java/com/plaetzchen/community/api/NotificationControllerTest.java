package com.plaetzchen.community.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plaetzchen.community.support.CommunityApi;
import com.plaetzchen.community.support.CommunityApi.Member;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Notifications API")
class NotificationControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    private CommunityApi api;
    private Member recipient;
    private long threadId;

    @BeforeEach
    void setUp() throws Exception {
        api = new CommunityApi(mockMvc, objectMapper);
        recipient = api.register();
        threadId = api.createThread(recipient, "Fragen").get("id").asLong();
    }

    private void receiveReplies(int count) throws Exception {
        for (int i = 0; i < count; i++) {
            api.createPost(api.register(), threadId, "Antwort " + i);
        }
    }

    @Test
    @DisplayName("requires authentication")
    void anonymous() throws Exception {
        mockMvc.perform(get("/api/v1/notifications")).andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("stats count unread notifications by type")
    void stats() throws Exception {
        receiveReplies(2);

        mockMvc.perform(api.as(recipient, get("/api/v1/notifications/stats")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalUnread").value(2))
                .andExpect(jsonPath("$.unreadByType.forum_reply").value(2))
                .andExpect(jsonPath("$.latestNotifications.length()").value(2));
    }

    @Test
    @DisplayName("marking one as read leaves the others unread")
    void markRead() throws Exception {
        receiveReplies(2);
        long id = api.notifications(recipient).get(0).get("id").asLong();

        mockMvc.perform(
                        api.as(recipient, put("/api/v1/notifications/" + id + "/read"))
                                .content(api.write(Map.of("isRead", true))))
                .andExpect(status().isOk());

        mockMvc.perform(api.as(recipient, get("/api/v1/notifications")).param("unreadOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("read-all and delete-read clear the inbox")
    void readAllAndDelete() throws Exception {
        receiveReplies(3);

        mockMvc.perform(api.as(recipient, put("/api/v1/notifications/read-all")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.markedRead").value(3));
        mockMvc.perform(api.as(recipient, delete("/api/v1/notifications/read")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(3));

        assertThat(api.notifications(recipient)).isEmpty();
    }

    @Test
    @DisplayName("members cannot touch someone else's notification")
    void foreignNotification() throws Exception {
        receiveReplies(1);
        long id = api.notifications(recipient).get(0).get("id").asLong();

        mockMvc.perform(api.as(api.register(), delete("/api/v1/notifications/" + id)))
                .andExpect(status().isForbidden());
        mockMvc.perform(api.as(recipient, delete("/api/v1/notifications/" + id)))
                .andExpect(status().isNoContent());
        mockMvc.perform(api.as(recipient, delete("/api/v1/notifications/" + id)))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("opting out of a type suppresses it")
    void optOut() throws Exception {
        mockMvc.perform(
                        api.as(recipient, put("/api/v1/users/me"))
                                .content(api.write(Map.of("notifyForumReply", false))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notifyForumReply").value(false));

        receiveReplies(1);

        assertThat(api.notifications(recipient)).isEmpty();
    }
}
