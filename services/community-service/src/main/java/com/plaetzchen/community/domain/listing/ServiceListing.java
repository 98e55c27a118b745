package com.plaetzchen.community.domain.listing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * A service a member offers to, or requests from, the neighbourhood.
 *
 * <p>Listings flagged by content moderation stay visible until an admin reviews them; a rejected
 * review deactivates the listing.
 */
@Entity
@Table(name = "services")
public class ServiceListing {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String title;

    @Column(nullable = false, length = 2000)
    private String description;

    @Column(name = "is_offering", nullable = false)
    private boolean offering;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "service_type", nullable = false, length = 30)
    private ServiceType serviceType = ServiceType.USER_SERVICE;

    @Column(nullable = false, length = 150)
    private String slug;

    @Column(name = "view_count", nullable = false)
    private int viewCount;

    @Column(name = "interest_count", nullable = false)
    private int interestCount;

    @Column(name = "is_completed", nullable = false)
    private boolean completed;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "price_type", nullable = false, length = 20)
    private PriceType priceType = PriceType.FREE;

    @Column(name = "price_amount", precision = 10, scale = 2)
    private BigDecimal priceAmount;

    @Column(name = "price_currency", nullable = false, length = 3)
    private String priceCurrency = "EUR";

    @Column(name = "estimated_duration_hours")
    private Integer estimatedDurationHours;

    @Column(name = "contact_method", nullable = false, length = 50)
    private String contactMethod = "message";

    @Column(name = "admin_notes")
    private String adminNotes;

    @Column(name = "flagged_at")
    private Instant flaggedAt;

    @Column(name = "flagged_reason")
    private String flaggedReason;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "reviewed_by")
    private Long reviewedBy;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected ServiceListing() {
        // JPA
    }

    public ServiceListing(
            String title,
            String description,
            boolean offering,
            String slug,
            Long ownerId,
            Instant createdAt) {
        this.title = title;
        this.description = description;
        this.offering = offering;
        this.slug = slug;
        this.ownerId = ownerId;
        this.createdAt = createdAt;
    }

    public void recordView() {
        viewCount++;
    }

    public void recordInterest() {
        interestCount++;
    }

    public void flag(String reason, Instant at) {
        this.flaggedAt = at;
        this.flaggedReason = reason;
    }

    public void review(boolean approve, String notes, Long reviewerId, Instant at) {
        this.reviewedAt = at;
        this.reviewedBy = reviewerId;
        this.adminNotes = notes;
        if (!approve) {
            this.active = false;
        }
    }

    public void complete(Instant at) {
        this.completed = true;
        this.completedAt = at;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isOffering() {
        return offering;
    }

    public void setOffering(boolean offering) {
        this.offering = offering;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public ServiceType getServiceType() {
        return serviceType;
    }

    public void setServiceType(ServiceType serviceType) {
        this.serviceType = serviceType;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public int getViewCount() {
        return viewCount;
    }

    public int getInterestCount() {
        return interestCount;
    }

    public boolean isCompleted() {
        return completed;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public PriceType getPriceType() {
        return priceType;
    }

    public void setPriceType(PriceType priceType) {
        this.priceType = priceType;
    }

    public BigDecimal getPriceAmount() {
        return priceAmount;
    }

    public void setPriceAmount(BigDecimal priceAmount) {
        this.priceAmount = priceAmount;
    }

    public String getPriceCurrency() {
        return priceCurrency;
    }

    public void setPriceCurrency(String priceCurrency) {
        this.priceCurrency = priceCurrency;
    }

    public Integer getEstimatedDurationHours() {
        return estimatedDurationHours;
    }

    public void setEstimatedDurationHours(Integer estimatedDurationHours) {
        this.estimatedDurationHours = estimatedDurationHours;
    }

    public String getContactMethod() {
        return contactMethod;
    }

    public void setContactMethod(String contactMethod) {
        this.contactMethod = contactMethod;
    }

    public String getAdminNotes() {
        return adminNotes;
    }

    public Instant getFlaggedAt() {
        return flaggedAt;
    }

    public String getFlaggedReason() {
        return flaggedReason;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public Long getReviewedBy() {
        return reviewedBy;
    }

    public Long getOwnerId() {
        return ownerId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
