package com.plaetzchen.community.domain.poll;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface PollRepository extends JpaRepository<Poll, Long>, JpaSpecificationExecutor<Poll> {

    List<Poll> findByCreatorId(Long creatorId, Pageable pageable);

    long countByCreatorId(Long creatorId);

    long countByActiveTrue();
}
