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
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
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
@DisplayName("Events API")
class EventControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private UserRepository users;

    private CommunityApi api;
    private Member organizer;

    @BeforeEach
    void setUp() throws Exception {
        api = new CommunityApi(mockMvc, objectMapper);
        organizer = api.register();
    }

    @Nested
    @DisplayName("creating")
    class Creating {

        @Test
        @DisplayName("requires authentication")
        void anonymous() throws Exception {
            mockMvc.perform(
                            api.json(post("/api/v1/events"))
                                    .content(
                                            api.write(
                                                    Map.of(
                                                            "title", "Flohmarkt",
                                                            "startDatetime", Instant.now().plus(5, ChronoUnit.DAYS).toString(),
                                                            "endDatetime", Instant.now().plus(6, ChronoUnit.DAYS).toString(),
                                                            "categoryId", api.firstEventCategoryId()))))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("returns the event with its capacity")
        void creates() throws Exception {
            JsonNode event = api.createEvent(organizer, 10, 5);

            assertThat(event.get("creator").get("id").asLong()).isEqualTo(organizer.id());
            assertThat(event.get("participantCount").asLong()).isZero();
            assertThat(event.get("capacity").get("availableSpots").asLong()).isEqualTo(10);
            assertThat(event.get("categoryName").asText()).isNotBlank();
        }

        @Test
        @DisplayName("rejects a start time in the past")
        void pastStart() throws Exception {
            Instant start = Instant.now().minus(1, ChronoUnit.DAYS);
            mockMvc.perform(
                            api.as(organizer, post("/api/v1/events"))
                                    .content(
                                            api.write(
                                                    Map.of(
                                                            "title", "Gestern",
                                                            "startDatetime", start.toString(),
                                                            "endDatetime", start.plus(1, ChronoUnit.HOURS).toString(),
                                                            "categoryId", api.firstEventCategoryId()))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Event start time must be in the future"));
        }

        @Test
        @DisplayName("rejects an end before the start")
        void endBeforeStart() throws Exception {
            Instant start = Instant.now().plus(3, ChronoUnit.DAYS);
            mockMvc.perform(
                            api.as(organizer, post("/api/v1/events"))
                                    .content(
                                            api.write(
                                                    Map.of(
                                                            "title", "Rueckwaerts",
                                                            "startDatetime", start.toString(),
                                                            "endDatetime", start.minus(1, ChronoUnit.HOURS).toString(),
                                                            "categoryId", api.firstEventCategoryId()))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Event end time must be after start time"));
        }
    }

    @Nested
    @DisplayName("joining")
    class Joining {

        @Test
        @DisplayName("registers the member and notifies the organizer")
        void joinNotifiesOrganizer() throws Exception {
            long eventId = api.createEvent(organizer, null, 5).get("id").asLong();
            Member guest = api.register();

            mockMvc.perform(api.as(guest, post("/api/v1/events/" + eventId + "/join")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.participantCount").value(1));

            JsonNode notifications = api.notifications(organizer);
            assertThat(notifications).hasSize(1);
            assertThat(notifications.get(0).get("type").asText()).isEqualTo("event_participant_joined");
            assertThat(notifications.get(0).get("data").get("eventId").asLong()).isEqualTo(eventId);

            mockMvc.perform(get("/api/v1/events/" + eventId + "/participants"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].user.id").value(guest.id()))
                    .andExpect(jsonPath("$[0].status").value("REGISTERED"));
        }

        @Test
        @DisplayName("refuses a second registration")
        void alreadyRegistered() throws Exception {
            long eventId = api.createEvent(organizer, null, 5).get("id").asLong();
            Member guest = api.register();
            mockMvc.perform(api.as(guest, post("/api/v1/events/" + eventId + "/join")))
                    .andExpect(status().isOk());

            mockMvc.perform(api.as(guest, post("/api/v1/events/" + eventId + "/join")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Already registered for this event"));
        }

        @Test
        @DisplayName("refuses members once the event is full")
        void full() throws Exception {
            long eventId = api.createEvent(organizer, 1, 5).get("id").asLong();
            mockMvc.perform(api.as(api.register(), post("/api/v1/events/" + eventId + "/join")))
                    .andExpect(status().isOk());

            mockMvc.perform(api.as(api.register(), post("/api/v1/events/" + eventId + "/join")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Event is full"));
        }

        @Test
        @DisplayName("closes registration a day before the start")
        void deadline() throws Exception {
            long eventId = api.createEvent(organizer, null, 1).get("id").asLong();

            mockMvc.perform(api.as(api.register(), post("/api/v1/events/" + eventId + "/join")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Registration deadline passed (24h before event)"));
        }

        @Test
        @DisplayName("a member can leave and rejoin")
        void leaveAndRejoin() throws Exception {
            long eventId = api.createEvent(organizer, null, 5).get("id").asLong();
            Member guest = api.register();
            mockMvc.perform(api.as(guest, post("/api/v1/events/" + eventId + "/join")))
                    .andExpect(status().isOk());

            mockMvc.perform(api.as(guest, delete("/api/v1/events/" + eventId + "/join")))
                    .andExpect(status().isOk());
            mockMvc.perform(get("/api/v1/events/" + eventId))
                    .andExpect(jsonPath("$.participantCount").value(0));

            mockMvc.perform(api.as(guest, post("/api/v1/events/" + eventId + "/join")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.participantCount").value(1));
            mockMvc.perform(api.as(guest, get("/api/v1/events/my/joined")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].id").value(eventId));
        }
    }

    @Nested
    @DisplayName("editing")
    class Editing {

        @Test
        @DisplayName("only the organizer may edit")
        void notOwner() throws Exception {
            long eventId = api.createEvent(organizer, null, 5).get("id").asLong();

            mockMvc.perform(
                            api.as(api.register(), put("/api/v1/events/" + eventId))
                                    .content(api.write(Map.of("title", "Gekapert"))))
                    .andExpect(status().isForbidden());

            mockMvc.perform(
                            api.as(organizer, put("/api/v1/events/" + eventId))
                                    .content(api.write(Map.of("title", "Weihnachtsbaeckerei"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.title").value("Weihnachtsbaeckerei"));
        }

        @Test
        @DisplayName("deleting deactivates the event")
        void deleteDeactivates() throws Exception {
            long eventId = api.createEvent(organizer, null, 5).get("id").asLong();

            mockMvc.perform(api.as(organizer, delete("/api/v1/events/" + eventId)))
                    .andExpect(status().isNoContent());

            mockMvc.perform(get("/api/v1/events/" + eventId)).andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("admin attendance")
    class Attendance {

        @Test
        @DisplayName("is forbidden for members")
        void membersForbidden() throws Exception {
            long eventId = api.createEvent(organizer, null, 5).get("id").asLong();

            mockMvc.perform(
                            api.as(organizer, post("/api/v1/events/" + eventId + "/attendance"))
                                    .content(api.write(Map.of("userIds", List.of(organizer.id())))))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("marks registered participants as attended")
        void marksAttendance() throws Exception {
            Member admin = api.registerAdmin(users);
            long eventId = api.createEvent(organizer, null, 5).get("id").asLong();
            Member guest = api.register();
            mockMvc.perform(api.as(guest, post("/api/v1/events/" + eventId + "/join")))
                    .andExpect(status().isOk());

            mockMvc.perform(
                            api.as(admin, post("/api/v1/events/" + eventId + "/attendance"))
                                    .content(api.write(Map.of("userIds", List.of(guest.id())))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.updated").value(1));

            mockMvc.perform(api.as(guest, get("/api/v1/events/my/stats")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.eventsAttended").value(1));
        }
    }
}
