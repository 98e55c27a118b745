package com.plaetzchen.community.domain.forum;

import com.plaetzchen.community.domain.common.BusinessRuleException;
import com.plaetzchen.community.domain.common.ConflictException;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ForumCategoryService {

    private static final Logger log = LoggerFactory.getLogger(ForumCategoryService.class);

    private final ForumCategoryRepository categories;
    private final ForumThreadRepository threads;
    private final Clock clock;

    public ForumCategoryService(
            ForumCategoryRepository categories, ForumThreadRepository threads, Clock clock) {
        this.categories = categories;
        this.threads = threads;
        this.clock = clock;
    }

    /** Active categories by display order, then name, each with its thread count. */
    @Transactional(readOnly = true)
    public List<ForumCategoryView> list() {
        List<ForumCategory> active = categories.findByActiveTrueOrderByDisplayOrderAscNameAsc();
        if (active.isEmpty()) {
            return List.of();
        }
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : threads.countByCategoryIds(active.stream().map(ForumCategory::getId).toList())) {
            counts.put((Long) row[0], ((Number) row[1]).longValue());
        }
        return active.stream()
                .map(c -> ForumCategoryView.of(c, counts.getOrDefault(c.getId(), 0L)))
                .toList();
    }

    @Transactional(readOnly = true)
    public ForumCategoryView get(long categoryId) {
        ForumCategory category = find(categoryId);
        return ForumCategoryView.of(category, threads.countByCategoryId(categoryId));
    }

    @Transactional
    public ForumCategoryView create(ForumCategoryRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new BusinessRuleException("Category name is required");
        }
        String name = request.name().trim();
        if (categories.existsByName(name)) {
            throw new ConflictException("Category name already exists");
        }
        ForumCategory category = new ForumCategory(name, Instant.now(clock));
        apply(category, request);
        category = categories.save(category);
        log.info("Created forum category {} '{}'", category.getId(), name);
        return ForumCategoryView.of(category, 0);
    }

    @Transactional
    public ForumCategoryView update(long categoryId, ForumCategoryRequest request) {
        ForumCategory category = find(categoryId);
        if (request.name() != null && !request.name().isBlank()) {
            String name = request.name().trim();
            if (categories.existsByNameAndIdNot(name, categoryId)) {
                throw new ConflictException("Category name already exists");
            }
            category.setName(name);
        }
        apply(category, request);
        return ForumCategoryView.of(category, threads.countByCategoryId(categoryId));
    }

    @Transactional
    public void delete(long categoryId) {
        ForumCategory category = find(categoryId);
        long threadCount = threads.countByCategoryId(categoryId);
        if (threadCount > 0) {
            throw new ConflictException(
                    "Cannot delete category. " + threadCount + " threads exist in this category.");
        }
        categories.delete(category);
        log.info("Deleted forum category {}", categoryId);
    }

    private void apply(ForumCategory category, ForumCategoryRequest request) {
        if (request.description() != null) {
            category.setDescription(request.description());
        }
        if (request.color() != null) {
            category.setColor(request.color());
        }
        if (request.icon() != null) {
            category.setIcon(request.icon());
        }
        if (request.isActive() != null) {
            category.setActive(request.isActive());
        }
        if (request.displayOrder() != null) {
            category.setDisplayOrder(request.displayOrder());
        }
    }

    private ForumCategory find(long categoryId) {
        return categories
                .findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found"));
    }
}
