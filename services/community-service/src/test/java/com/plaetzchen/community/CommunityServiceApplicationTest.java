package com.plaetzchen.community;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.plaetzchen.community.config.CommunityServiceProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Integration tests for the community service Spring Boot application.
 *
 * <p>WHY: Verifies that the full Spring context loads, Flyway migrates the in-memory database and
 * all filters and endpoints work together. The 'test' profile requires no external
 * infrastructure.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Community Service Application")
class CommunityServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("Spring context loads successfully")
    void contextLoads() {
        assertThat(context).isNotNull();
    }

    @Test
    @DisplayName("Service properties are loaded from test profile")
    void servicePropertiesAreLoaded() {
        var props = context.getBean(CommunityServiceProperties.class);
        assertThat(props.name()).isEqualTo("community-service-test");
        assertThat(props.environment()).isEqualTo("test");
    }

    @Test
    @DisplayName("Service info endpoint returns service name")
    void serviceInfoEndpointReturnsServiceName() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("community-service-test"))
                .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    @DisplayName("Health endpoint reports healthy")
    void healthEndpoint() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("community-service-test"));
    }

    @Test
    @DisplayName("Actuator health endpoint is available")
    void actuatorHealthEndpointIsAvailable() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }

    @Test
    @DisplayName("Seeded categories are served")
    void seededCategories() throws Exception {
        mockMvc.perform(get("/api/v1/event-categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.name == 'Community')]").exists());
        mockMvc.perform(get("/api/v1/forum-categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.name == 'General')]").exists());
    }

    @Test
    @DisplayName("Unknown resources answer 404 as problem detail")
    void notFoundProblem() throws Exception {
        mockMvc.perform(get("/api/v1/events/999999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Event not found"))
                .andExpect(jsonPath("$.correlationId").isNotEmpty());
    }

    @Test
    @DisplayName("Correlation ID header is set on responses")
    void correlationIdHeaderIsSetOnResponse() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(
                        result ->
                                assertThat(result.getResponse().getHeader("X-Correlation-ID"))
                                        .isNotBlank());
    }
}
