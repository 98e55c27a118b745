package com.plaetzchen.community.domain.event;

import com.plaetzchen.community.config.EventRulesProperties;
import com.plaetzchen.community.domain.common.BusinessRuleException;
import com.plaetzchen.community.domain.common.OffsetLimit;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import com.plaetzchen.community.domain.notification.NotificationPublisher;
import com.plaetzchen.community.domain.user.UserLookup;
import com.plaetzchen.community.domain.user.UserSummary;
import com.plaetzchen.eventmodel.EntityType;
import com.plaetzchen.eventmodel.EventEntity;
import com.plaetzchen.eventmodel.EventType;
import com.plaetzchen.eventmodel.payload.ActorSummary;
import com.plaetzchen.eventmodel.payload.EventJoinPayload;
import com.plaetzchen.observability.MetricFactory;
import com.plaetzchen.security.OwnershipEnforcer;
import com.plaetzchen.security.PlatformSecurityContext;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Events, participation and attendance.
 *
 * <p>Participant counts only include {@code REGISTERED} rows. Attended members stay visible in the
 * participant list but no longer occupy a spot.
 */
@Service
public class EventService {

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    static final String METRIC_JOINED = "community.events.joined";

    private static final Set<ParticipationStatus> JOINED =
            Set.of(ParticipationStatus.REGISTERED, ParticipationStatus.ATTENDED);

    private final CommunityEventRepository events;
    private final EventCategoryRepository categories;
    private final EventParticipationRepository participations;
    private final UserLookup userLookup;
    private final NotificationPublisher notificationPublisher;
    private final MetricFactory metrics;
    private final EventRulesProperties rules;
    private final EventJoinPolicy joinPolicy;
    private final Clock clock;

    public EventService(
            CommunityEventRepository events,
            EventCategoryRepository categories,
            EventParticipationRepository participations,
            UserLookup userLookup,
            NotificationPublisher notificationPublisher,
            MetricFactory metrics,
            EventRulesProperties rules,
            Clock clock) {
        this.events = events;
        this.categories = categories;
        this.participations = participations;
        this.userLookup = userLookup;
        this.notificationPublisher = notificationPublisher;
        this.metrics = metrics;
        this.rules = rules;
        this.joinPolicy = new EventJoinPolicy(rules.registrationDeadline());
        this.clock = clock;
    }

    // ── Queries ──

    @Transactional(readOnly = true)
    public List<EventView> list(boolean upcomingOnly, Long categoryId, int skip, int limit) {
        Instant now = Instant.now(clock);
        Specification<CommunityEvent> spec = (root, query, cb) -> cb.isTrue(root.get("active"));
        if (upcomingOnly) {
            spec = spec.and((root, query, cb) -> cb.greaterThan(root.get("startDatetime"), now));
        }
        if (categoryId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("categoryId"), categoryId));
        }
        var page = OffsetLimit.of(skip, limit, Sort.by("startDatetime").ascending());
        return toViews(events.findAll(spec, page).getContent());
    }

    @Transactional(readOnly = true)
    public EventDetailView get(long eventId) {
        CommunityEvent event = activeEvent(eventId);
        return EventDetailView.of(
                event,
                userLookup.summary(event.getCreatorId()),
                categoryName(event.getCategoryId()),
                registeredCount(eventId));
    }

    @Transactional(readOnly = true)
    public List<ParticipantView> participants(long eventId) {
        activeEvent(eventId);
        List<EventParticipation> rows =
                participations.findByEventIdAndStatusInOrderByRegisteredAtAsc(eventId, JOINED);
        Map<Long, UserSummary> people =
                userLookup.summaries(rows.stream().map(EventParticipation::getUserId).toList());
        return rows.stream()
                .map(
                        p ->
                                new ParticipantView(
                                        UserLookup.from(people, p.getUserId()),
                                        p.getStatus(),
                                        p.getRegisteredAt()))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<EventView> createdBy(long userId, int skip, int limit) {
        var page = OffsetLimit.of(skip, limit, Sort.by("startDatetime").descending());
        return toViews(events.findByCreatorId(userId, page));
    }

    @Transactional(readOnly = true)
    public List<EventView> joinedBy(long userId, int skip, int limit) {
        var page = OffsetLimit.of(skip, limit, Sort.by("registeredAt").descending());
        List<Long> eventIds =
                participations.findByUserIdAndStatusIn(userId, JOINED, page).stream()
                        .map(EventParticipation::getEventId)
                        .toList();
        Map<Long, CommunityEvent> byId =
                events.findAllById(eventIds).stream()
                        .collect(Collectors.toMap(CommunityEvent::getId, Function.identity()));
        return toViews(eventIds.stream().map(byId::get).filter(e -> e != null).toList());
    }

    @Transactional(readOnly = true)
    public EventHistoryView history(long userId) {
        return EventHistoryView.of(
                participations.countByUserIdAndStatus(userId, ParticipationStatus.REGISTERED),
                participations.countByUserIdAndStatus(userId, ParticipationStatus.ATTENDED),
                participations.countByUserIdAndStatus(userId, ParticipationStatus.CANCELLED));
    }

    // ── Commands ──

    @Transactional
    public EventDetailView create(PlatformSecurityContext ctx, EventCreate request) {
        if (!categories.existsById(request.categoryId())) {
            throw new ResourceNotFoundException("Category not found");
        }
        Instant now = Instant.now(clock);
        checkTimes(request.startDatetime(), request.endDatetime(), now);
        CommunityEvent event =
                events.save(
                        new CommunityEvent(
                                request.title().trim(),
                                request.description(),
                                request.startDatetime(),
                                request.endDatetime(),
                                request.location(),
                                request.maxParticipants(),
                                ctx.userId(),
                                request.categoryId(),
                                now));
        log.info("User {} created event {} '{}'", ctx.userId(), event.getId(), event.getTitle());
        return get(event.getId());
    }

    @Transactional
    public EventDetailView update(PlatformSecurityContext ctx, long eventId, EventUpdate request) {
        CommunityEvent event = activeEvent(eventId);
        OwnershipEnforcer.enforce(ctx, event.getCreatorId(), "Not authorized to edit this event");

        if (request.startDatetime() != null || request.endDatetime() != null) {
            Instant start =
                    request.startDatetime() != null ? request.startDatetime() : event.getStartDatetime();
            Instant end = request.endDatetime() != null ? request.endDatetime() : event.getEndDatetime();
            checkTimes(start, end, Instant.now(clock));
            event.setStartDatetime(start);
            event.setEndDatetime(end);
        }
        if (request.categoryId() != null) {
            if (!categories.existsById(request.categoryId())) {
                throw new ResourceNotFoundException("Category not found");
            }
            event.setCategoryId(request.categoryId());
        }
        if (request.title() != null) {
            event.setTitle(request.title().trim());
        }
        if (request.description() != null) {
            event.setDescription(request.description());
        }
        if (request.location() != null) {
            event.setLocation(request.location());
        }
        if (request.maxParticipants() != null) {
            event.setMaxParticipants(request.maxParticipants());
        }
        return get(eventId);
    }

    @Transactional
    public void delete(PlatformSecurityContext ctx, long eventId) {
        CommunityEvent event = activeEvent(eventId);
        OwnershipEnforcer.enforce(ctx, event.getCreatorId(), "Not authorized to delete this event");
        event.setActive(false);
        log.info("User {} deactivated event {}", ctx.userId(), eventId);
    }

    /**
     * Registers the caller for an event and notifies the organizer.
     *
     * @throws BusinessRuleException if {@link EventJoinPolicy} refuses the registration
     */
    @Transactional
    public EventDetailView join(PlatformSecurityContext ctx, long eventId) {
        CommunityEvent event =
                events.findById(eventId)
                        .orElseThrow(() -> new ResourceNotFoundException("Event not found"));
        Instant now = Instant.now(clock);
        EventParticipation existing =
                participations.findByEventIdAndUserId(eventId, ctx.userId()).orElse(null);
        joinPolicy.check(
                event,
                existing != null ? existing.getStatus() : null,
                registeredCount(eventId),
                now);

        if (existing != null) {
            existing.changeStatus(ParticipationStatus.REGISTERED, now);
        } else {
            participations.save(new EventParticipation(eventId, ctx.userId(), now));
        }
        metrics.increment(METRIC_JOINED, "Event registrations");
        log.info("User {} joined event {}", ctx.userId(), eventId);

        notificationPublisher.publish(
                EventType.EVENT_PARTICIPANT_JOINED,
                ctx.userId(),
                event.getCreatorId(),
                EventEntity.of(EntityType.EVENT, eventId),
                new EventJoinPayload(
                        eventId,
                        event.getTitle(),
                        new ActorSummary(ctx.userId(), ctx.user().displayName())));
        return get(eventId);
    }

    @Transactional
    public void leave(PlatformSecurityContext ctx, long eventId) {
        if (!events.existsById(eventId)) {
            throw new ResourceNotFoundException("Event not found");
        }
        EventParticipation participation =
                participations
                        .findByEventIdAndUserId(eventId, ctx.userId())
                        .filter(p -> p.getStatus() == ParticipationStatus.REGISTERED)
                        .orElseThrow(() -> new BusinessRuleException("Not participating in this event"));
        participation.changeStatus(ParticipationStatus.CANCELLED, Instant.now(clock));
        log.info("User {} left event {}", ctx.userId(), eventId);
    }

    /** Marks the given registered members as attended. Returns the number of rows changed. */
    @Transactional
    public int markAttendance(long eventId, Collection<Long> userIds) {
        if (!events.existsById(eventId)) {
            throw new ResourceNotFoundException("Event not found");
        }
        if (userIds == null || userIds.isEmpty()) {
            return 0;
        }
        int updated =
                participations.updateStatusForUsers(
                        eventId,
                        userIds,
                        ParticipationStatus.REGISTERED,
                        ParticipationStatus.ATTENDED,
                        Instant.now(clock));
        log.info("Marked {} participants of event {} as attended", updated, eventId);
        return updated;
    }

    /**
     * Marks every registered participant as attended once the event ended at least {@code
     * autoAttendanceDelay} ago.
     */
    @Transactional
    public AutoAttendanceResult completeEvent(long eventId) {
        CommunityEvent event =
                events.findById(eventId)
                        .orElseThrow(() -> new ResourceNotFoundException("Event not found"));
        return autoAttend(event, Instant.now(clock));
    }

    /**
     * Runs auto-attendance for one batch of ended events.
     *
     * @return number of events whose participants were updated
     */
    @Transactional
    public int processCompletedEvents() {
        Instant now = Instant.now(clock);
        List<CommunityEvent> candidates =
                events.findCompletionCandidates(
                        now.minus(rules.autoAttendanceDelay()),
                        ParticipationStatus.REGISTERED,
                        OffsetLimit.first(rules.completionBatchSize(), Sort.by("id")));
        int processed = 0;
        for (CommunityEvent event : candidates) {
            if (autoAttend(event, now).success()) {
                processed++;
            }
        }
        return processed;
    }

    private AutoAttendanceResult autoAttend(CommunityEvent event, Instant now) {
        if (now.isBefore(event.effectiveEnd().plus(rules.autoAttendanceDelay()))) {
            return AutoAttendanceResult.tooEarly(rules.autoAttendanceDelay().toHours());
        }
        int updated =
                participations.updateStatus(
                        event.getId(),
                        ParticipationStatus.REGISTERED,
                        ParticipationStatus.ATTENDED,
                        now);
        if (updated == 0) {
            return AutoAttendanceResult.nothingToDo();
        }
        log.info("Auto-attendance marked {} participants of event {}", updated, event.getId());
        return AutoAttendanceResult.processed(updated);
    }

    // ── Helpers ──

    private CommunityEvent activeEvent(long eventId) {
        return events.findById(eventId)
                .filter(CommunityEvent::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("Event not found"));
    }

    private void checkTimes(Instant start, Instant end, Instant now) {
        if (!start.isAfter(now)) {
            throw new BusinessRuleException("Event start time must be in the future");
        }
        if (end != null && !end.isAfter(start)) {
            throw new BusinessRuleException("Event end time must be after start time");
        }
    }

    private long registeredCount(long eventId) {
        return participations.countByEventIdAndStatus(eventId, ParticipationStatus.REGISTERED);
    }

    private String categoryName(Long categoryId) {
        return categories.findById(categoryId).map(EventCategory::getName).orElse(null);
    }

    private List<EventView> toViews(List<CommunityEvent> page) {
        if (page.isEmpty()) {
            return List.of();
        }
        List<Long> ids = page.stream().map(CommunityEvent::getId).toList();
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : participations.countByEventIds(ids, ParticipationStatus.REGISTERED)) {
            counts.put((Long) row[0], ((Number) row[1]).longValue());
        }
        Map<Long, UserSummary> creators =
                userLookup.summaries(page.stream().map(CommunityEvent::getCreatorId).toList());
        Map<Long, String> categoryNames =
                categories.findAllById(page.stream().map(CommunityEvent::getCategoryId).distinct().toList())
                        .stream()
                        .collect(Collectors.toMap(EventCategory::getId, EventCategory::getName));
        return page.stream()
                .map(
                        e ->
                                EventView.of(
                                        e,
                                        UserLookup.from(creators, e.getCreatorId()),
                                        categoryNames.get(e.getCategoryId()),
                                        counts.getOrDefault(e.getId(), 0L)))
                .toList();
    }
}
