package com.plaetzchen.community.domain.poll;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PollOptionRepository extends JpaRepository<PollOption, Long> {

    List<PollOption> findByPollIdOrderByOrderIndexAsc(Long pollId);

    List<PollOption> findByPollIdInOrderByOrderIndexAsc(Collection<Long> pollIds);

    void deleteByPollId(Long pollId);
}
