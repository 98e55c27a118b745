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
@DisplayName("Polls API")
class PollControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private UserRepository users;

    private CommunityApi api;
    private Member creator;
    private long threadId;

    @BeforeEach
    void setUp() throws Exception {
        api = new CommunityApi(mockMvc, objectMapper);
        creator = api.register();
        threadId = api.createThread(creator, "Adventsmarkt").get("id").asLong();
    }

    private JsonNode createThreadPoll(List<String> options) throws Exception {
        return api.read(
                mockMvc.perform(
                                api.as(creator, post("/api/v1/polls"))
                                        .content(
                                                api.write(
                                                        Map.of(
                                                                "question", "Welcher Samstag?",
                                                                "pollType", "THREAD",
                                                                "threadId", threadId,
                                                                "options", options))))
                        .andExpect(status().isCreated())
                        .andReturn());
    }

    private long optionId(JsonNode poll, int index) {
        return poll.get("options").get(index).get("id").asLong();
    }

    @Nested
    @DisplayName("creating")
    class Creating {

        @Test
        @DisplayName("stores options in order and suggests an end date")
        void creates() throws Exception {
            JsonNode poll = createThreadPoll(List.of("Erster Advent", "Zweiter Advent", "Dritter Advent"));

            assertThat(poll.get("options")).hasSize(3);
            assertThat(poll.get("options").get(0).get("text").asText()).isEqualTo("Erster Advent");
            assertThat(poll.get("endsAt").isNull()).isFalse();
            assertThat(poll.get("totalVotes").asLong()).isZero();
        }

        @Test
        @DisplayName("requires at least two options")
        void tooFewOptions() throws Exception {
            mockMvc.perform(
                            api.as(creator, post("/api/v1/polls"))
                                    .content(
                                            api.write(
                                                    Map.of(
                                                            "question", "Nur eine Wahl?",
                                                            "pollType", "THREAD",
                                                            "threadId", threadId,
                                                            "options", List.of("Ja")))))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("thread polls need a thread")
        void threadPollWithoutThread() throws Exception {
            mockMvc.perform(
                            api.as(creator, post("/api/v1/polls"))
                                    .content(
                                            api.write(
                                                    Map.of(
                                                            "question", "Ohne Thread?",
                                                            "pollType", "THREAD",
                                                            "options", List.of("Ja", "Nein")))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Thread polls require a threadId"));
        }

        @Test
        @DisplayName("admin polls are reserved for admins")
        void adminPolls() throws Exception {
            Map<String, Object> body =
                    Map.of(
                            "question", "Neues Logo?",
                            "pollType", "ADMIN",
                            "options", List.of("Ja", "Nein"));

            mockMvc.perform(api.as(creator, post("/api/v1/polls")).content(api.write(body)))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.detail").value("Only admins can create admin polls"));

            mockMvc.perform(api.as(api.registerAdmin(users), post("/api/v1/polls")).content(api.write(body)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.pollType").value("ADMIN"));
        }
    }

    @Nested
    @DisplayName("voting")
    class Voting {

        @Test
        @DisplayName("counts one vote per member and lets them switch")
        void voteAndSwitch() throws Exception {
            JsonNode poll = createThreadPoll(List.of("Samstag", "Sonntag"));
            long pollId = poll.get("id").asLong();
            Member voter = api.register();

            mockMvc.perform(
                            api.as(voter, post("/api/v1/polls/" + pollId + "/vote"))
                                    .content(api.write(Map.of("optionId", optionId(poll, 0)))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.totalVotes").value(1))
                    .andExpect(jsonPath("$.userVoteOptionId").value(optionId(poll, 0)));

            mockMvc.perform(
                            api.as(voter, post("/api/v1/polls/" + pollId + "/vote"))
                                    .content(api.write(Map.of("optionId", optionId(poll, 1)))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.totalVotes").value(1))
                    .andExpect(jsonPath("$.options[1].voteCount").value(1))
                    .andExpect(jsonPath("$.options[0].voteCount").value(0));
        }

        @Test
        @DisplayName("rejects an option of another poll")
        void foreignOption() throws Exception {
            JsonNode first = createThreadPoll(List.of("A", "B"));
            JsonNode second = createThreadPoll(List.of("C", "D"));

            mockMvc.perform(
                            api.as(creator, post("/api/v1/polls/" + first.get("id").asLong() + "/vote"))
                                    .content(api.write(Map.of("optionId", optionId(second, 0)))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Invalid option for this poll"));
        }

        @Test
        @DisplayName("removing a vote needs an existing vote")
        void removeVote() throws Exception {
            JsonNode poll = createThreadPoll(List.of("Ja", "Nein"));
            long pollId = poll.get("id").asLong();

            mockMvc.perform(api.as(creator, delete("/api/v1/polls/" + pollId + "/vote")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("No vote to remove"));

            mockMvc.perform(
                            api.as(creator, post("/api/v1/polls/" + pollId + "/vote"))
                                    .content(api.write(Map.of("optionId", optionId(poll, 0)))))
                    .andExpect(status().isOk());
            mockMvc.perform(api.as(creator, delete("/api/v1/polls/" + pollId + "/vote")))
                    .andExpect(status().isOk());
            mockMvc.perform(api.as(creator, get("/api/v1/polls/" + pollId)))
                    .andExpect(jsonPath("$.totalVotes").value(0));
        }

        @Test
        @DisplayName("options are frozen once voting started")
        void frozenOptions() throws Exception {
            JsonNode poll = createThreadPoll(List.of("Ja", "Nein"));
            long pollId = poll.get("id").asLong();
            mockMvc.perform(
                            api.as(api.register(), post("/api/v1/polls/" + pollId + "/vote"))
                                    .content(api.write(Map.of("optionId", optionId(poll, 0)))))
                    .andExpect(status().isOk());

            mockMvc.perform(
                            api.as(creator, put("/api/v1/polls/" + pollId))
                                    .content(api.write(Map.of("options", List.of("Vielleicht", "Nie")))))
                    .andExpect(status().isBadRequest());

            mockMvc.perform(
                            api.as(creator, put("/api/v1/polls/" + pollId))
                                    .content(api.write(Map.of("question", "Welcher Tag passt?"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.question").value("Welcher Tag passt?"));
        }
    }

    @Nested
    @DisplayName("results")
    class Results {

        @Test
        @DisplayName("report a clear winner with percentages")
        void clearWinner() throws Exception {
            JsonNode poll = createThreadPoll(List.of("Zimtsterne", "Makronen"));
            long pollId = poll.get("id").asLong();
            for (int i = 0; i < 2; i++) {
                mockMvc.perform(
                                api.as(api.register(), post("/api/v1/polls/" + pollId + "/vote"))
                                        .content(api.write(Map.of("optionId", optionId(poll, 0)))))
                        .andExpect(status().isOk());
            }
            mockMvc.perform(
                            api.as(api.register(), post("/api/v1/polls/" + pollId + "/vote"))
                                    .content(api.write(Map.of("optionId", optionId(poll, 1)))))
                    .andExpect(status().isOk());

            mockMvc.perform(get("/api/v1/polls/" + pollId + "/results"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.totalVotes").value(3))
                    .andExpect(jsonPath("$.resultType").value("clear_winner"))
                    .andExpect(jsonPath("$.winners[0].text").value("Zimtsterne"))
                    .andExpect(jsonPath("$.options[0].percentage").value(66.7));
        }

        @Test
        @DisplayName("summary form omits the option breakdown")
        void summary() throws Exception {
            long pollId = createThreadPoll(List.of("Ja", "Nein")).get("id").asLong();

            mockMvc.perform(get("/api/v1/polls/" + pollId + "/results").param("detailed", "false"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.resultType").value("no_votes"))
                    .andExpect(jsonPath("$.options").doesNotExist());
        }
    }

    @Test
    @DisplayName("suggests a duration for the expected turnout")
    void suggestDuration() throws Exception {
        mockMvc.perform(get("/api/v1/polls/suggest-duration")
                                .param("pollType", "THREAD")
                                .param("expectedParticipants", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hours").isNumber());
    }
}
