package com.plaetzchen.community.domain.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.plaetzchen.community.domain.user.User;
import com.plaetzchen.community.domain.user.UserRepository;
import com.plaetzchen.eventmodel.EntityType;
import com.plaetzchen.eventmodel.EventEntity;
import com.plaetzchen.eventmodel.EventEnvelope;
import com.plaetzchen.eventmodel.EventFactory;
import com.plaetzchen.eventmodel.EventType;
import com.plaetzchen.eventmodel.payload.ActorSummary;
import com.plaetzchen.eventmodel.payload.ForumPostPayload;
import com.plaetzchen.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationDispatcher")
class NotificationDispatcherTest {

    private static final long ACTOR = 1L;
    private static final long RECIPIENT = 2L;

    @Mock private NotificationRepository notifications;
    @Mock private UserRepository users;

    private SimpleMeterRegistry registry;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        dispatcher = new NotificationDispatcher(notifications, users, new MetricFactory(registry, "test"));
    }

    private static EventEnvelope<ForumPostPayload> reply(Long recipient) {
        return EventFactory.create(
                EventType.FORUM_REPLY,
                "test",
                ACTOR,
                recipient,
                EventEntity.of(EntityType.FORUM_POST, 10L),
                new ForumPostPayload(5L, 10L, "Rezepte", "Hallo", new ActorSummary(ACTOR, "anna"), null));
    }

    private static User recipient() {
        return new User("ben", "ben@plaetzchen.test", "hash", Instant.now());
    }

    @Test
    @DisplayName("stores a notification with the serialized payload")
    void storesNotification() {
        when(users.findById(RECIPIENT)).thenReturn(Optional.of(recipient()));

        dispatcher.onDomainEvent(reply(RECIPIENT));

        ArgumentCaptor<Notification> saved = ArgumentCaptor.forClass(Notification.class);
        verify(notifications).save(saved.capture());
        assertThat(saved.getValue().getUserId()).isEqualTo(RECIPIENT);
        assertThat(saved.getValue().getType()).isEqualTo("forum_reply");
        assertThat(saved.getValue().getPayload()).contains("\"threadTitle\":\"Rezepte\"");
        assertThat(saved.getValue().isRead()).isFalse();
        assertThat(registry.find(NotificationDispatcher.METRIC_CREATED).tag("type", "forum_reply").counter())
                .isNotNull();
    }

    @Test
    @DisplayName("skips events addressed to their own actor")
    void skipsSelf() {
        dispatcher.onDomainEvent(reply(ACTOR));

        verify(notifications, never()).save(any());
    }

    @Test
    @DisplayName("skips events without a recipient")
    void skipsMissingRecipient() {
        dispatcher.onDomainEvent(reply(null));

        verify(notifications, never()).save(any());
    }

    @Test
    @DisplayName("skips inactive recipients")
    void skipsInactive() {
        User inactive = recipient();
        inactive.setActive(false);
        when(users.findById(RECIPIENT)).thenReturn(Optional.of(inactive));

        dispatcher.onDomainEvent(reply(RECIPIENT));

        verify(notifications, never()).save(any());
    }

    @Test
    @DisplayName("respects the recipient's preference for the event type")
    void respectsPreference() {
        User optedOut = recipient();
        optedOut.setNotifyForumReply(false);
        when(users.findById(RECIPIENT)).thenReturn(Optional.of(optedOut));

        dispatcher.onDomainEvent(reply(RECIPIENT));

        verify(notifications, never()).save(any());
    }
}
