package com.plaetzchen.community.domain.forum;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ForumPostRepository extends JpaRepository<ForumPost, Long> {

    List<ForumPost> findByThreadId(Long threadId, Pageable pageable);

    List<ForumPost> findByAuthorId(Long authorId, Pageable pageable);

    Optional<ForumPost> findFirstByThreadIdOrderByCreatedAtDescIdDesc(Long threadId);

    /** Rows of {@code [threadId, count]}. */
    @Query(
            "select p.threadId, count(p) from ForumPost p"
                    + " where p.threadId in :threadIds group by p.threadId")
    List<Object[]> countByThreadIds(@Param("threadIds") Collection<Long> threadIds);
}
