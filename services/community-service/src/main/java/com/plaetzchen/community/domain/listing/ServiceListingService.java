package com.plaetzchen.community.domain.listing;

import com.plaetzchen.community.domain.common.BusinessRuleException;
import com.plaetzchen.community.domain.common.OffsetLimit;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import com.plaetzchen.community.domain.moderation.ContentModerator;
import com.plaetzchen.community.domain.moderation.ModerationResult;
import com.plaetzchen.community.domain.user.UserLookup;
import com.plaetzchen.community.domain.user.UserSummary;
import com.plaetzchen.security.AccessDeniedException;
import com.plaetzchen.security.OwnershipEnforcer;
import com.plaetzchen.security.PlatformSecurityContext;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service listings: members offering or requesting help.
 *
 * <p>New listings run through {@link ContentModerator}. Flagged listings are published anyway and
 * queued for admin review.
 */
@Service
public class ServiceListingService {

    private static final Logger log = LoggerFactory.getLogger(ServiceListingService.class);

    static final int MIN_SEARCH_LENGTH = 3;
    static final String NOT_AUTHORIZED = "Not authorized to modify this service";

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final ServiceListingRepository listings;
    private final UserLookup userLookup;
    private final ContentModerator moderator;
    private final Clock clock;

    public ServiceListingService(
            ServiceListingRepository listings,
            UserLookup userLookup,
            ContentModerator moderator,
            Clock clock) {
        this.listings = listings;
        this.userLookup = userLookup;
        this.moderator = moderator;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<ServiceListingView> list(Boolean isOffering, String search, int skip, int limit) {
        Specification<ServiceListing> spec = (root, query, cb) -> cb.isTrue(root.get("active"));
        if (isOffering != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("offering"), isOffering));
        }
        if (search != null) {
            String term = search.trim();
            if (term.length() < MIN_SEARCH_LENGTH) {
                throw new BusinessRuleException("Search term must be at least 3 characters");
            }
            String pattern = "%" + term.toLowerCase(Locale.ROOT) + "%";
            spec =
                    spec.and(
                            (root, query, cb) ->
                                    cb.or(
                                            cb.like(cb.lower(root.get("title")), pattern),
                                            cb.like(cb.lower(root.get("description")), pattern)));
        }
        return toViews(listings.findAll(spec, OffsetLimit.of(skip, limit, NEWEST_FIRST)).getContent());
    }

    /** Returns an active listing and counts the view. */
    @Transactional
    public ServiceListingView view(long listingId) {
        ServiceListing listing = active(listingId);
        listing.recordView();
        return toView(listing);
    }

    @Transactional(readOnly = true)
    public List<ServiceListingView> ownedBy(long userId, int skip, int limit) {
        return toViews(listings.findByOwnerId(userId, OffsetLimit.of(skip, limit, NEWEST_FIRST)));
    }

    @Transactional(readOnly = true)
    public ServiceStatsView stats() {
        return new ServiceStatsView(
                listings.countByActiveTrue(),
                listings.countByActiveTrueAndOfferingTrue(),
                listings.countByActiveTrueAndOfferingFalse());
    }

    @Transactional
    public ServiceListingView create(PlatformSecurityContext ctx, ServiceCreate request) {
        ServiceType type = request.serviceType() != null ? request.serviceType() : ServiceType.USER_SERVICE;
        if (type == ServiceType.PLATFORM_FEATURE && !ctx.isAdmin()) {
            throw new AccessDeniedException("Only admins can create platform features");
        }
        Instant now = Instant.now(clock);
        String title = request.title().trim();
        ServiceListing listing =
                new ServiceListing(
                        title,
                        request.description().trim(),
                        request.isOffering(),
                        SlugGenerator.unique(title, listings::existsBySlug),
                        ctx.userId(),
                        now);
        listing.setServiceType(type);
        applyPricing(
                listing,
                request.priceType(),
                request.priceAmount(),
                request.priceCurrency(),
                request.estimatedDurationHours(),
                request.contactMethod());

        ModerationResult moderation = moderator.analyze(title + " " + listing.getDescription());
        if (moderation.isFlagged()) {
            listing.flag(moderation.summary(), now);
        }
        listing = listings.save(listing);
        log.info(
                "User {} created service {} (offering={}, flagged={})",
                ctx.userId(),
                listing.getId(),
                listing.isOffering(),
                moderation.isFlagged());
        return toView(listing);
    }

    @Transactional
    public ServiceListingView update(PlatformSecurityContext ctx, long listingId, ServiceUpdate request) {
        ServiceListing listing = active(listingId);
        OwnershipEnforcer.enforce(ctx, listing.getOwnerId(), NOT_AUTHORIZED);
        if (request.title() != null && !request.title().trim().equals(listing.getTitle())) {
            String title = request.title().trim();
            listing.setTitle(title);
            if (!SlugGenerator.matches(listing.getSlug(), title)) {
                listing.setSlug(SlugGenerator.unique(title, listings::existsBySlug));
            }
        }
        if (request.description() != null) {
            listing.setDescription(request.description().trim());
        }
        if (request.isOffering() != null) {
            listing.setOffering(request.isOffering());
        }
        applyPricing(
                listing,
                request.priceType(),
                request.priceAmount(),
                request.priceCurrency(),
                request.estimatedDurationHours(),
                request.contactMethod());
        listing.setUpdatedAt(Instant.now(clock));
        return toView(listing);
    }

    @Transactional
    public void delete(PlatformSecurityContext ctx, long listingId) {
        ServiceListing listing = active(listingId);
        OwnershipEnforcer.enforce(ctx, listing.getOwnerId(), NOT_AUTHORIZED);
        listing.setActive(false);
        listing.setUpdatedAt(Instant.now(clock));
        log.info("User {} deactivated service {}", ctx.userId(), listingId);
    }

    @Transactional
    public ServiceListingView expressInterest(PlatformSecurityContext ctx, long listingId) {
        ServiceListing listing = active(listingId);
        if (listing.getOwnerId().equals(ctx.userId())) {
            throw new BusinessRuleException("Cannot express interest in your own service");
        }
        listing.recordInterest();
        return toView(listing);
    }

    @Transactional
    public ServiceListingView complete(PlatformSecurityContext ctx, long listingId) {
        ServiceListing listing = active(listingId);
        OwnershipEnforcer.enforce(ctx, listing.getOwnerId(), NOT_AUTHORIZED);
        Instant now = Instant.now(clock);
        listing.complete(now);
        listing.setUpdatedAt(now);
        return toView(listing);
    }

    // ── Admin review ──

    @Transactional(readOnly = true)
    public List<ServiceListingView> flagged(int skip, int limit) {
        var page = OffsetLimit.of(skip, limit, Sort.by(Sort.Order.asc("flaggedAt"), Sort.Order.asc("id")));
        return toViews(listings.findByFlaggedAtIsNotNullAndReviewedAtIsNull(page));
    }

    @Transactional
    public ServiceListingView review(PlatformSecurityContext admin, long listingId, ServiceReview review) {
        ServiceListing listing =
                listings.findById(listingId)
                        .orElseThrow(() -> new ResourceNotFoundException("Service not found"));
        listing.review(review.approve(), review.adminNotes(), admin.userId(), Instant.now(clock));
        log.info(
                "Admin {} {} service {}",
                admin.userId(),
                review.approve() ? "approved" : "rejected",
                listingId);
        return toView(listing);
    }

    private void applyPricing(
            ServiceListing listing,
            PriceType priceType,
            BigDecimal priceAmount,
            String priceCurrency,
            Integer estimatedDurationHours,
            String contactMethod) {
        if (priceType != null) {
            listing.setPriceType(priceType);
        }
        if (priceAmount != null) {
            listing.setPriceAmount(priceAmount);
        }
        if (priceCurrency != null) {
            listing.setPriceCurrency(priceCurrency.toUpperCase(Locale.ROOT));
        }
        if (estimatedDurationHours != null) {
            listing.setEstimatedDurationHours(estimatedDurationHours);
        }
        if (contactMethod != null && !contactMethod.isBlank()) {
            listing.setContactMethod(contactMethod);
        }
    }

    private ServiceListing active(long listingId) {
        return listings.findById(listingId)
                .filter(ServiceListing::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("Service not found"));
    }

    private ServiceListingView toView(ServiceListing listing) {
        return ServiceListingView.of(listing, userLookup.summary(listing.getOwnerId()));
    }

    private List<ServiceListingView> toViews(List<ServiceListing> page) {
        Map<Long, UserSummary> owners =
                userLookup.summaries(page.stream().map(ServiceListing::getOwnerId).toList());
        return page.stream()
                .map(s -> ServiceListingView.of(s, UserLookup.from(owners, s.getOwnerId())))
                .toList();
    }
}
