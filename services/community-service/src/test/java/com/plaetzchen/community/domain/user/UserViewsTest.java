package com.plaetzchen.community.domain.user;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.reflect.Field;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("User views")
class UserViewsTest {

    private static User user() throws Exception {
        User user = new User("anna", "anna@plaetzchen.test", "hash", Instant.parse("2026-01-01T00:00:00Z"));
        user.setFirstName("Anna");
        user.setLastName("Becker");
        user.setBio("Bakes a lot");
        user.setLocation("Hamburg");
        Field id = User.class.getDeclaredField("id");
        id.setAccessible(true);
        id.set(user, 7L);
        return user;
    }

    @Nested
    @DisplayName("UserPublicView")
    class PublicView {

        @Test
        @DisplayName("hides the email by default and shows everything else")
        void defaults() throws Exception {
            UserPublicView view = UserPublicView.of(user());

            assertThat(view.email()).isNull();
            assertThat(view.firstName()).isEqualTo("Anna");
            assertThat(view.isActive()).isTrue();
            assertThat(view.createdAt()).isNotNull();
        }

        @Test
        @DisplayName("nulls every field marked private but keeps the display name")
        void privateFields() throws Exception {
            User user = user();
            user.setEmailPrivate(false);
            user.setFirstNamePrivate(true);
            user.setLastNamePrivate(true);
            user.setBioPrivate(true);
            user.setLocationPrivate(true);
            user.setCreatedAtPrivate(true);
            user.setActivePrivate(true);

            UserPublicView view = UserPublicView.of(user);

            assertThat(view.displayName()).isEqualTo("anna");
            assertThat(view.email()).isEqualTo("anna@plaetzchen.test");
            assertThat(view.firstName()).isNull();
            assertThat(view.lastName()).isNull();
            assertThat(view.bio()).isNull();
            assertThat(view.location()).isNull();
            assertThat(view.createdAt()).isNull();
            assertThat(view.isActive()).isNull();
        }
    }

    @Nested
    @DisplayName("UserStatsView")
    class Stats {

        @Test
        @DisplayName("weighs attended, organized and offered activity")
        void score() {
            UserStatsView stats = UserStatsView.of(2, 1, 1);

            assertThat(stats.communityScore()).isEqualTo(28);
            assertThat(stats.totalConnections()).isEqualTo(3);
        }

        @Test
        @DisplayName("caps the score at 100")
        void capped() {
            assertThat(UserStatsView.of(30, 5, 5).communityScore()).isEqualTo(UserStatsView.MAX_SCORE);
        }
    }

    @Test
    @DisplayName("deactivation frees the email address")
    void deactivate() throws Exception {
        User user = user();

        user.deactivateAccount();

        assertThat(user.isActive()).isFalse();
        assertThat(user.getEmail()).isEqualTo("deleted_7@deleted.local");
    }
}
