package com.plaetzchen.community.domain.user;

import com.plaetzchen.community.domain.common.BusinessRuleException;
import com.plaetzchen.community.domain.common.ConflictException;
import com.plaetzchen.community.domain.common.OffsetLimit;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import com.plaetzchen.community.domain.event.CommunityEventRepository;
import com.plaetzchen.community.domain.event.EventParticipationRepository;
import com.plaetzchen.community.domain.event.ParticipationStatus;
import com.plaetzchen.community.domain.listing.ServiceListingRepository;
import com.plaetzchen.security.PlatformSecurityContext;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Member profiles, the public directory and admin account management. */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final String DISPLAY_NAME_TAKEN = "Display name already taken";

    private static final Sort BY_DISPLAY_NAME = Sort.by(Sort.Order.asc("displayName"), Sort.Order.asc("id"));
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final UserRepository users;
    private final CommunityEventRepository events;
    private final EventParticipationRepository participations;
    private final ServiceListingRepository listings;

    public UserService(
            UserRepository users,
            CommunityEventRepository events,
            EventParticipationRepository participations,
            ServiceListingRepository listings) {
        this.users = users;
        this.events = events;
        this.participations = participations;
        this.listings = listings;
    }

    @Transactional(readOnly = true)
    public List<UserPublicView> listPublic(String search, int skip, int limit) {
        Specification<User> spec =
                Specification.where(UserSpecifications.active())
                        .and(UserSpecifications.matches(search, false));
        return users.findAll(spec, OffsetLimit.of(skip, limit, BY_DISPLAY_NAME)).stream()
                .map(UserPublicView::of)
                .toList();
    }

    /**
     * The full record when the viewer looks at themselves, the privacy-filtered one otherwise.
     * Returned as {@code Object} because the two views have different shapes on the wire.
     */
    @Transactional(readOnly = true)
    public Object profile(Long viewerId, long userId) {
        User user = user(userId);
        if (viewerId != null && viewerId == userId) {
            return UserPrivateView.of(user);
        }
        return UserPublicView.of(user);
    }

    @Transactional(readOnly = true)
    public UserPrivateView me(long userId) {
        return UserPrivateView.of(user(userId));
    }

    @Transactional
    public UserPrivateView updateMe(PlatformSecurityContext ctx, ProfileUpdate update) {
        User user = user(ctx.userId());
        if (update.displayName() != null && !update.displayName().equals(user.getDisplayName())) {
            String displayName = update.displayName().trim();
            if (users.existsByDisplayNameAndIdNot(displayName, user.getId())) {
                throw new ConflictException(DISPLAY_NAME_TAKEN);
            }
            user.setDisplayName(displayName);
        }
        apply(update.firstName(), user::setFirstName);
        apply(update.lastName(), user::setLastName);
        apply(update.bio(), user::setBio);
        apply(update.location(), user::setLocation);

        apply(update.emailPrivate(), user::setEmailPrivate);
        apply(update.firstNamePrivate(), user::setFirstNamePrivate);
        apply(update.lastNamePrivate(), user::setLastNamePrivate);
        apply(update.bioPrivate(), user::setBioPrivate);
        apply(update.locationPrivate(), user::setLocationPrivate);
        apply(update.createdAtPrivate(), user::setCreatedAtPrivate);
        apply(update.isActivePrivate(), user::setActivePrivate);

        apply(update.notifyForumReply(), user::setNotifyForumReply);
        apply(update.notifyForumMention(), user::setNotifyForumMention);
        apply(update.notifyForumQuote(), user::setNotifyForumQuote);
        apply(update.notifyEventJoin(), user::setNotifyEventJoin);
        apply(update.notifyCommentReply(), user::setNotifyCommentReply);
        apply(update.emailNotificationsEvents(), user::setEmailNotificationsEvents);
        apply(update.emailNotificationsMessages(), user::setEmailNotificationsMessages);
        apply(update.emailNotificationsNewsletter(), user::setEmailNotificationsNewsletter);

        log.info("User {} updated their profile", user.getId());
        return UserPrivateView.of(user);
    }

    @Transactional(readOnly = true)
    public UserStatsView stats(long userId) {
        return UserStatsView.of(
                participations.countByUserIdAndStatus(userId, ParticipationStatus.ATTENDED),
                events.countByCreatorId(userId),
                listings.countByOwnerIdAndActiveTrueAndOfferingTrue(userId));
    }

    // ── Admin ──

    @Transactional(readOnly = true)
    public List<UserPrivateView> adminList(
            String search, Boolean isActive, Boolean isAdmin, Boolean emailVerified, int skip, int limit) {
        Specification<User> spec =
                Specification.where(UserSpecifications.matches(search, true))
                        .and(UserSpecifications.flag("active", isActive))
                        .and(UserSpecifications.flag("admin", isAdmin))
                        .and(UserSpecifications.flag("emailVerified", emailVerified));
        return users.findAll(spec, OffsetLimit.of(skip, limit, NEWEST_FIRST)).stream()
                .map(UserPrivateView::of)
                .toList();
    }

    @Transactional
    public UserPrivateView setActive(PlatformSecurityContext ctx, long userId, boolean active) {
        if (ctx.userId() == userId) {
            throw new BusinessRuleException("Cannot change your own account status");
        }
        User user = user(userId);
        user.setActive(active);
        log.info("Admin {} set active={} for user {}", ctx.userId(), active, userId);
        return UserPrivateView.of(user);
    }

    @Transactional
    public UserPrivateView setAdmin(PlatformSecurityContext ctx, long userId, boolean admin) {
        if (ctx.userId() == userId) {
            throw new BusinessRuleException("Cannot change your own admin status");
        }
        User user = user(userId);
        user.setAdmin(admin);
        log.info("Admin {} set admin={} for user {}", ctx.userId(), admin, userId);
        return UserPrivateView.of(user);
    }

    private User user(long userId) {
        return users.findById(userId).orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }

    private static <T> void apply(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
