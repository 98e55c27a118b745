package com.plaetzchen.community.domain.event;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EventParticipationRepository extends JpaRepository<EventParticipation, Long> {

    Optional<EventParticipation> findByEventIdAndUserId(Long eventId, Long userId);

    long countByEventIdAndStatus(Long eventId, ParticipationStatus status);

    long countByUserIdAndStatus(Long userId, ParticipationStatus status);

    List<EventParticipation> findByEventIdAndStatusInOrderByRegisteredAtAsc(
            Long eventId, Collection<ParticipationStatus> statuses);

    List<EventParticipation> findByUserIdAndStatusIn(
            Long userId, Collection<ParticipationStatus> statuses, Pageable pageable);

    /** Rows of {@code [eventId, count]} for the given events. */
    @Query(
            "select p.eventId, count(p) from EventParticipation p"
                    + " where p.eventId in :eventIds and p.status = :status group by p.eventId")
    List<Object[]> countByEventIds(
            @Param("eventIds") Collection<Long> eventIds,
            @Param("status") ParticipationStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update EventParticipation p set p.status = :to, p.statusUpdatedAt = :at"
                    + " where p.eventId = :eventId and p.status = :from")
    int updateStatus(
            @Param("eventId") Long eventId,
            @Param("from") ParticipationStatus from,
            @Param("to") ParticipationStatus to,
            @Param("at") Instant at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update EventParticipation p set p.status = :to, p.statusUpdatedAt = :at"
                    + " where p.eventId = :eventId and p.status = :from and p.userId in :userIds")
    int updateStatusForUsers(
            @Param("eventId") Long eventId,
            @Param("userIds") Collection<Long> userIds,
            @Param("from") ParticipationStatus from,
            @Param("to") ParticipationStatus to,
            @Param("at") Instant at);
}
