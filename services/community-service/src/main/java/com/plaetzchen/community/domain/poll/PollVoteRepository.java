package com.plaetzchen.community.domain.poll;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PollVoteRepository extends JpaRepository<PollVote, Long> {

    Optional<PollVote> findByPollIdAndUserId(Long pollId, Long userId);

    List<PollVote> findByUserIdAndPollIdIn(Long userId, Collection<Long> pollIds);

    List<PollVote> findByUserId(Long userId, Pageable pageable);

    long countByPollId(Long pollId);

    long countByUserId(Long userId);

    /** Rows of {@code [optionId, count]} for the given polls. */
    @Query(
            "select v.optionId, count(v) from PollVote v"
                    + " where v.pollId in :pollIds group by v.optionId")
    List<Object[]> countByOption(@Param("pollIds") Collection<Long> pollIds);
}
