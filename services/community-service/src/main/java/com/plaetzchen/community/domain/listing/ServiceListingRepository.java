package com.plaetzchen.community.domain.listing;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface ServiceListingRepository
        extends JpaRepository<ServiceListing, Long>, JpaSpecificationExecutor<ServiceListing> {

    boolean existsBySlug(String slug);

    List<ServiceListing> findByOwnerId(Long ownerId, Pageable pageable);

    List<ServiceListing> findByFlaggedAtIsNotNullAndReviewedAtIsNull(Pageable pageable);

    long countByActiveTrue();

    long countByActiveTrueAndOfferingTrue();

    long countByActiveTrueAndOfferingFalse();

    long countByOwnerIdAndActiveTrueAndOfferingTrue(Long ownerId);

    long countByFlaggedAtIsNotNullAndReviewedAtIsNull();
}
