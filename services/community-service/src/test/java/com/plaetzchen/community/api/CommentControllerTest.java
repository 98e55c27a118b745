package com.plaetzchen.community.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plaetzchen.community.domain.user.UserRepository;
import com.plaetzchen.community.support.CommunityApi;
import com.plaetzchen.community.support.CommunityApi.Member;
import java.util.HashMap;
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
@DisplayName("Comments API")
class CommentControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private UserRepository users;

    private CommunityApi api;
    private Member organizer;
    private long eventId;

    @BeforeEach
    void setUp() throws Exception {
        api = new CommunityApi(mockMvc, objectMapper);
        organizer = api.register();
        eventId = api.createEvent(organizer, null, 7).get("id").asLong();
    }

    private JsonNode comment(Member author, String content, Long parentId) throws Exception {
        Map<String, Object> body = new HashMap<>();
        body.put("content", content);
        body.put("eventId", eventId);
        body.put("parentId", parentId);
        return api.read(
                mockMvc.perform(api.as(author, post("/api/v1/comments")).content(api.write(body)))
                        .andExpect(status().isCreated())
                        .andReturn());
    }

    @Test
    @DisplayName("lists comments of an event as a reply tree")
    void tree() throws Exception {
        long root = comment(organizer, "Wer bringt Ausstecher mit?", null).get("id").asLong();
        Member guest = api.register();
        long reply = comment(guest, "Ich bringe Sterne mit", root).get("id").asLong();
        comment(organizer, "Super, danke!", reply);
        comment(guest, "Und Puderzucker?", null);

        mockMvc.perform(get("/api/v1/comments").param("eventId", String.valueOf(eventId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value(root))
                .andExpect(jsonPath("$[0].replies[0].id").value(reply))
                .andExpect(jsonPath("$[0].replies[0].replies[0].content").value("Super, danke!"))
                .andExpect(jsonPath("$[1].replies.length()").value(0));

        mockMvc.perform(
                        get("/api/v1/comments")
                                .param("eventId", String.valueOf(eventId))
                                .param("parentId", String.valueOf(root)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].author.id").value(guest.id()));
    }

    @Test
    @DisplayName("a reply notifies the parent's author")
    void replyNotifies() throws Exception {
        long root = comment(organizer, "Treffpunkt am Eingang", null).get("id").asLong();

        comment(api.register(), "Bis dann!", root);

        JsonNode notifications = api.notifications(organizer);
        assertThat(notifications).hasSize(1);
        assertThat(notifications.get(0).get("type").asText()).isEqualTo("comment_reply");
    }

    @Test
    @DisplayName("a comment needs exactly one target")
    void target() throws Exception {
        mockMvc.perform(
                        api.as(organizer, post("/api/v1/comments"))
                                .content(api.write(Map.of("content", "Wohin damit?"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Must specify event_id or service_id"));

        mockMvc.perform(
                        api.as(organizer, post("/api/v1/comments"))
                                .content(
                                        api.write(
                                                Map.of("content", "Beides", "eventId", eventId, "serviceId", 1))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Comment cannot belong to both event and service"));
    }

    @Test
    @DisplayName("a parent from another event is rejected")
    void foreignParent() throws Exception {
        long otherEvent = api.createEvent(organizer, null, 8).get("id").asLong();
        long foreign =
                api.read(
                                mockMvc.perform(
                                                api.as(organizer, post("/api/v1/comments"))
                                                        .content(
                                                                api.write(
                                                                        Map.of(
                                                                                "content", "Woanders",
                                                                                "eventId", otherEvent))))
                                        .andExpect(status().isCreated())
                                        .andReturn())
                        .get("id")
                        .asLong();

        mockMvc.perform(
                        api.as(organizer, post("/api/v1/comments"))
                                .content(
                                        api.write(
                                                Map.of(
                                                        "content", "Antwort",
                                                        "eventId", eventId,
                                                        "parentId", foreign))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Parent comment must belong to the same event or service"));
    }

    @Test
    @DisplayName("comments on a deactivated event are not found")
    void inactiveTarget() throws Exception {
        mockMvc.perform(api.as(organizer, delete("/api/v1/events/" + eventId)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/comments").param("eventId", String.valueOf(eventId)))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("replies of a deactivated event stay hidden behind another event")
    void repliesNeedTheirOwnTarget() throws Exception {
        long root = comment(organizer, "Nur fuer Teilnehmer", null).get("id").asLong();
        comment(api.register(), "Antwort nur fuer Teilnehmer", root);
        long liveEvent = api.createEvent(organizer, null, 9).get("id").asLong();
        mockMvc.perform(api.as(organizer, delete("/api/v1/events/" + eventId)))
                .andExpect(status().isNoContent());

        mockMvc.perform(
                        get("/api/v1/comments")
                                .param("eventId", String.valueOf(liveEvent))
                                .param("parentId", String.valueOf(root)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Parent comment must belong to the same event or service"));

        mockMvc.perform(
                        get("/api/v1/comments")
                                .param("eventId", String.valueOf(liveEvent))
                                .param("parentId", "999999999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Parent comment not found"));
    }

    @Test
    @DisplayName("admins may edit and delete any comment, members only their own")
    void ownership() throws Exception {
        long id = comment(organizer, "Ursprung", null).get("id").asLong();

        mockMvc.perform(
                        api.as(api.register(), put("/api/v1/comments/" + id))
                                .content(api.write(Map.of("content", "Fremd"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.detail").value("Not authorized to modify this comment"));

        Member admin = api.registerAdmin(users);
        mockMvc.perform(
                        api.as(admin, put("/api/v1/comments/" + id))
                                .content(api.write(Map.of("content", "Moderiert"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("Moderiert"));

        mockMvc.perform(api.as(admin, delete("/api/v1/comments/" + id)))
                .andExpect(status().isNoContent());
        mockMvc.perform(api.as(admin, delete("/api/v1/comments/" + id)))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("flagged comments are rejected")
    void moderation() throws Exception {
        mockMvc.perform(
                        api.as(organizer, post("/api/v1/comments"))
                                .content(api.write(Map.of("content", "Du Hurensohn", "eventId", eventId))))
                .andExpect(status().isBadRequest())
                .andExpect(
                        result ->
                                assertThat(result.getResponse().getContentAsString())
                                        .contains("Comment rejected by moderation"));
    }
}
