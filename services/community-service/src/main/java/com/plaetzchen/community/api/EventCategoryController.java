package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.event.EventCategoryRequest;
import com.plaetzchen.community.domain.event.EventCategoryService;
import com.plaetzchen.community.domain.event.EventCategoryView;
import com.plaetzchen.security.CurrentUserHolder;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/event-categories")
public class EventCategoryController {

    private final EventCategoryService categoryService;

    public EventCategoryController(EventCategoryService categoryService) {
        this.categoryService = categoryService;
    }

    @GetMapping
    public List<EventCategoryView> list() {
        return categoryService.list();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public EventCategoryView create(@Valid @RequestBody EventCategoryRequest request) {
        CurrentUserHolder.requireAdmin();
        return categoryService.create(request);
    }

    @PutMapping("/{id}")
    public EventCategoryView update(@PathVariable long id, @Valid @RequestBody EventCategoryRequest request) {
        CurrentUserHolder.requireAdmin();
        return categoryService.update(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable long id) {
        CurrentUserHolder.requireAdmin();
        categoryService.delete(id);
    }
}
