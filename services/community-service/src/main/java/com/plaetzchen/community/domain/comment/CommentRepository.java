package com.plaetzchen.community.domain.comment;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CommentRepository extends JpaRepository<Comment, Long> {

    List<Comment> findByEventIdOrderByCreatedAtAscIdAsc(Long eventId);

    List<Comment> findByServiceIdOrderByCreatedAtAscIdAsc(Long serviceId);

    List<Comment> findByParentIdOrderByCreatedAtAscIdAsc(Long parentId, Pageable pageable);

    List<Comment> findByAuthorId(Long authorId, Pageable pageable);

    long countByAuthorId(Long authorId);
}
