package com.plaetzchen.community.api;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.plaetzchen.community.domain.user.UserRepository;
import com.plaetzchen.community.support.CommunityApi;
import com.plaetzchen.community.support.CommunityApi.Member;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Admin API")
class AdminControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private UserRepository users;

    private CommunityApi api;
    private Member admin;

    @BeforeEach
    void setUp() throws Exception {
        api = new CommunityApi(mockMvc, objectMapper);
        admin = api.registerAdmin(users);
    }

    @Test
    @DisplayName("the dashboard is closed to members")
    void membersForbidden() throws Exception {
        mockMvc.perform(api.as(api.register(), get("/api/v1/admin/dashboard")))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/v1/admin/dashboard")).andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("the dashboard aggregates platform counters")
    void dashboard() throws Exception {
        mockMvc.perform(api.as(admin, get("/api/v1/admin/dashboard")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.users.total").value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.users.admins").value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.users.newLast7Days").value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.events.active").isNumber())
                .andExpect(jsonPath("$.polls.totalVotes").isNumber())
                .andExpect(jsonPath("$.generatedAt").isNotEmpty());
    }

    @Test
    @DisplayName("migrations report the applied Flyway versions")
    void migrations() throws Exception {
        mockMvc.perform(api.as(admin, get("/api/v1/admin/migrations")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentVersion").value("2"))
                .andExpect(jsonPath("$.appliedMigrations").value(2))
                .andExpect(jsonPath("$.pendingMigrations").value(0));
    }

    @Nested
    @DisplayName("moderation")
    class Moderation {

        @Test
        @DisplayName("previews the analysis of a text")
        void analyze() throws Exception {
            mockMvc.perform(
                            api.as(admin, post("/api/v1/admin/moderation/analyze"))
                                    .content(api.write(Map.of("content", "Ruf an: 015123456789"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.confidence").value(0.5))
                    .andExpect(jsonPath("$.reasons[0]").value("Contains phone number"));
        }

        @Test
        @DisplayName("reports on a member's recent content")
        void userReport() throws Exception {
            Member member = api.register();
            long threadId = api.createThread(member, "Hallo").get("id").asLong();
            api.createPost(member, threadId, "Besucht https://example.org fuer mehr");

            mockMvc.perform(api.as(admin, get("/api/v1/admin/moderation/users/" + member.id())))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.userId").value(member.id()))
                    .andExpect(jsonPath("$.totalItemsChecked").value(1))
                    .andExpect(jsonPath("$.flaggedItems").value(0))
                    .andExpect(jsonPath("$.needsAdminReview").value(false));
        }

        @Test
        @DisplayName("answers 404 for unknown members")
        void unknownUser() throws Exception {
            mockMvc.perform(api.as(admin, get("/api/v1/admin/moderation/users/987654321")))
                    .andExpect(status().isNotFound());
        }
    }
}
