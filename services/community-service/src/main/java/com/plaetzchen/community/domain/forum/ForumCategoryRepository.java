package com.plaetzchen.community.domain.forum;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ForumCategoryRepository extends JpaRepository<ForumCategory, Long> {

    List<ForumCategory> findByActiveTrueOrderByDisplayOrderAscNameAsc();

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, Long id);
}
