package com.plaetzchen.community.domain.user;

import com.plaetzchen.eventmodel.EventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * A registered member of the platform.
 *
 * <p>Profile fields can individually be hidden from other members through the {@code *Private}
 * flags; {@link UserPublicView} applies them. Members are never hard-deleted: closing an account
 * deactivates it and frees the email address and display name.
 */
@Entity
@Table(name = "users")
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "display_name", nullable = false, length = 20)
    private String displayName;

    @Column(nullable = false)
    private String email;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    private String bio;

    private String location;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "is_admin", nullable = false)
    private boolean admin;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "email_verified_at")
    private Instant emailVerifiedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // ── Privacy ──

    @Column(name = "email_private", nullable = false)
    private boolean emailPrivate = true;

    @Column(name = "first_name_private", nullable = false)
    private boolean firstNamePrivate;

    @Column(name = "last_name_private", nullable = false)
    private boolean lastNamePrivate;

    @Column(name = "bio_private", nullable = false)
    private boolean bioPrivate;

    @Column(name = "location_private", nullable = false)
    private boolean locationPrivate;

    @Column(name = "created_at_private", nullable = false)
    private boolean createdAtPrivate;

    @Column(name = "is_active_private", nullable = false)
    private boolean activePrivate;

    // ── In-app notification preferences ──

    @Column(name = "notify_forum_reply", nullable = false)
    private boolean notifyForumReply = true;

    @Column(name = "notify_forum_mention", nullable = false)
    private boolean notifyForumMention = true;

    @Column(name = "notify_forum_quote", nullable = false)
    private boolean notifyForumQuote = true;

    @Column(name = "notify_event_join", nullable = false)
    private boolean notifyEventJoin = true;

    @Column(name = "notify_comment_reply", nullable = false)
    private boolean notifyCommentReply = true;

    // ── Email preferences ──

    @Column(name = "email_notifications_events", nullable = false)
    private boolean emailNotificationsEvents = true;

    @Column(name = "email_notifications_messages", nullable = false)
    private boolean emailNotificationsMessages;

    @Column(name = "email_notifications_newsletter", nullable = false)
    private boolean emailNotificationsNewsletter;

    protected User() {
        // JPA
    }

    public User(String displayName, String email, String passwordHash, Instant createdAt) {
        this.displayName = displayName;
        this.email = email;
        this.passwordHash = passwordHash;
        this.createdAt = createdAt;
    }

    /** Whether this member wants an in-app notification of the given type. */
    public boolean wantsNotification(EventType type) {
        switch (type) {
            case FORUM_REPLY:
                return notifyForumReply;
            case FORUM_MENTION:
                return notifyForumMention;
            case FORUM_QUOTE:
                return notifyForumQuote;
            case EVENT_PARTICIPANT_JOINED:
                return notifyEventJoin;
            case COMMENT_REPLY:
                return notifyCommentReply;
            default:
                return true;
        }
    }

    public void markEmailVerified(Instant at) {
        this.emailVerified = true;
        this.emailVerifiedAt = at;
    }

    /** Switches to a new, not yet verified email address. */
    public void changeEmail(String newEmail) {
        this.email = newEmail;
        this.emailVerified = false;
        this.emailVerifiedAt = null;
    }

    /** Closes the account and frees its email address and display name for reuse. */
    public void deactivateAccount() {
        this.active = false;
        this.email = "deleted_" + id + "@deleted.local";
        this.displayName = "deleted_user_" + id;
    }

    public Long getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getEmail() {
        return email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getBio() {
        return bio;
    }

    public void setBio(String bio) {
        this.bio = bio;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isAdmin() {
        return admin;
    }

    public void setAdmin(boolean admin) {
        this.admin = admin;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public Instant getEmailVerifiedAt() {
        return emailVerifiedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isEmailPrivate() {
        return emailPrivate;
    }

    public void setEmailPrivate(boolean emailPrivate) {
        this.emailPrivate = emailPrivate;
    }

    public boolean isFirstNamePrivate() {
        return firstNamePrivate;
    }

    public void setFirstNamePrivate(boolean firstNamePrivate) {
        this.firstNamePrivate = firstNamePrivate;
    }

    public boolean isLastNamePrivate() {
        return lastNamePrivate;
    }

    public void setLastNamePrivate(boolean lastNamePrivate) {
        this.lastNamePrivate = lastNamePrivate;
    }

    public boolean isBioPrivate() {
        return bioPrivate;
    }

    public void setBioPrivate(boolean bioPrivate) {
        this.bioPrivate = bioPrivate;
    }

    public boolean isLocationPrivate() {
        return locationPrivate;
    }

    public void setLocationPrivate(boolean locationPrivate) {
        this.locationPrivate = locationPrivate;
    }

    public boolean isCreatedAtPrivate() {
        return createdAtPrivate;
    }

    public void setCreatedAtPrivate(boolean createdAtPrivate) {
        this.createdAtPrivate = createdAtPrivate;
    }

    public boolean isActivePrivate() {
        return activePrivate;
    }

    public void setActivePrivate(boolean activePrivate) {
        this.activePrivate = activePrivate;
    }

    public boolean isNotifyForumReply() {
        return notifyForumReply;
    }

    public void setNotifyForumReply(boolean notifyForumReply) {
        this.notifyForumReply = notifyForumReply;
    }

    public boolean isNotifyForumMention() {
        return notifyForumMention;
    }

    public void setNotifyForumMention(boolean notifyForumMention) {
        this.notifyForumMention = notifyForumMention;
    }

    public boolean isNotifyForumQuote() {
        return notifyForumQuote;
    }

    public void setNotifyForumQuote(boolean notifyForumQuote) {
        this.notifyForumQuote = notifyForumQuote;
    }

    public boolean isNotifyEventJoin() {
        return notifyEventJoin;
    }

    public void setNotifyEventJoin(boolean notifyEventJoin) {
        this.notifyEventJoin = notifyEventJoin;
    }

    public boolean isNotifyCommentReply() {
        return notifyCommentReply;
    }

    public void setNotifyCommentReply(boolean notifyCommentReply) {
        this.notifyCommentReply = notifyCommentReply;
    }

    public boolean isEmailNotificationsEvents() {
        return emailNotificationsEvents;
    }

    public void setEmailNotificationsEvents(boolean emailNotificationsEvents) {
        this.emailNotificationsEvents = emailNotificationsEvents;
    }

    public boolean isEmailNotificationsMessages() {
        return emailNotificationsMessages;
    }

    public void setEmailNotificationsMessages(boolean emailNotificationsMessages) {
        this.emailNotificationsMessages = emailNotificationsMessages;
    }

    public boolean isEmailNotificationsNewsletter() {
        return emailNotificationsNewsletter;
    }

    public void setEmailNotificationsNewsletter(boolean emailNotificationsNewsletter) {
        this.emailNotificationsNewsletter = emailNotificationsNewsletter;
    }
}
