package com.plaetzchen.community.domain.forum;

import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ForumThreadRepository extends JpaRepository<ForumThread, Long> {

    List<ForumThread> findByCategoryId(Long categoryId, Pageable pageable);

    List<ForumThread> findByCreatorId(Long creatorId, Pageable pageable);

    long countByCategoryId(Long categoryId);

    /** Rows of {@code [categoryId, count]}. */
    @Query(
            "select t.categoryId, count(t) from ForumThread t"
                    + " where t.categoryId in :categoryIds group by t.categoryId")
    List<Object[]> countByCategoryIds(@Param("categoryIds") Collection<Long> categoryIds);
}
