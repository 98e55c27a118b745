package com.plaetzchen.community.domain.event;

import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommunityEventRepository
        extends JpaRepository<CommunityEvent, Long>, JpaSpecificationExecutor<CommunityEvent> {

    List<CommunityEvent> findByCreatorId(Long creatorId, Pageable pageable);

    long countByCreatorId(Long creatorId);

    boolean existsByCategoryId(Long categoryId);

    long countByActiveTrue();

    long countByActiveTrueAndStartDatetimeAfter(Instant now);

    /**
     * Active events that ended before {@code cutoff} and still have participants in {@code status}.
     */
    @Query(
            "select e from CommunityEvent e where e.active = true"
                    + " and coalesce(e.endDatetime, e.startDatetime) <= :cutoff"
                    + " and exists (select p.id from EventParticipation p"
                    + " where p.eventId = e.id and p.status = :status)")
    List<CommunityEvent> findCompletionCandidates(
            @Param("cutoff") Instant cutoff,
            @Param("status") ParticipationStatus status,
            Pageable pageable);
}
