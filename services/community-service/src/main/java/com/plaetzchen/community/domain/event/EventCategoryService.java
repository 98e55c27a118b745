package com.plaetzchen.community.domain.event;

import com.plaetzchen.community.domain.common.ConflictException;
import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Event categories. Reading is public; changes are admin-only (enforced by the controller). */
@Service
public class EventCategoryService {

    private static final Logger log = LoggerFactory.getLogger(EventCategoryService.class);

    private final EventCategoryRepository categories;
    private final CommunityEventRepository events;
    private final Clock clock;

    public EventCategoryService(
            EventCategoryRepository categories, CommunityEventRepository events, Clock clock) {
        this.categories = categories;
        this.events = events;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<EventCategoryView> list() {
        return categories.findAllByOrderByNameAsc().stream().map(EventCategoryView::of).toList();
    }

    @Transactional
    public EventCategoryView create(EventCategoryRequest request) {
        String name = request.name().trim();
        if (categories.existsByName(name)) {
            throw new ConflictException("Category already exists");
        }
        EventCategory category =
                categories.save(new EventCategory(name, request.description(), Instant.now(clock)));
        log.info("Created event category {} '{}'", category.getId(), name);
        return EventCategoryView.of(category);
    }

    @Transactional
    public EventCategoryView update(long categoryId, EventCategoryRequest request) {
        EventCategory category = find(categoryId);
        String name = request.name().trim();
        if (categories.existsByNameAndIdNot(name, categoryId)) {
            throw new ConflictException("Category already exists");
        }
        category.setName(name);
        category.setDescription(request.description());
        return EventCategoryView.of(category);
    }

    @Transactional
    public void delete(long categoryId) {
        EventCategory category = find(categoryId);
        if (events.existsByCategoryId(categoryId)) {
            throw new ConflictException("Cannot delete category with existing events");
        }
        categories.delete(category);
        log.info("Deleted event category {}", categoryId);
    }

    private EventCategory find(long categoryId) {
        return categories
                .findById(categoryId)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found"));
    }
}
