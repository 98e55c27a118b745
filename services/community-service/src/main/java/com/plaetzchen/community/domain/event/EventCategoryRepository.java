package com.plaetzchen.community.domain.event;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EventCategoryRepository extends JpaRepository<EventCategory, Long> {

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, Long id);

    List<EventCategory> findAllByOrderByNameAsc();
}
