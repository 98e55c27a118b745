package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.forum.ForumCategoryRequest;
import com.plaetzchen.community.domain.forum.ForumCategoryService;
import com.plaetzchen.community.domain.forum.ForumCategoryView;
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
@RequestMapping("/api/v1/forum-categories")
public class ForumCategoryController {

    private final ForumCategoryService categoryService;

    public ForumCategoryController(ForumCategoryService categoryService) {
        this.categoryService = categoryService;
    }

    @GetMapping
    public List<ForumCategoryView> list() {
        return categoryService.list();
    }

    @GetMapping("/{id}")
    public ForumCategoryView get(@PathVariable long id) {
        return categoryService.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ForumCategoryView create(@Valid @RequestBody ForumCategoryRequest request) {
        CurrentUserHolder.requireAdmin();
        return categoryService.create(request);
    }

    @PutMapping("/{id}")
    public ForumCategoryView update(@PathVariable long id, @Valid @RequestBody ForumCategoryRequest request) {
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
