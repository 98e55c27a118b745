package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.comment.CommentCreate;
import com.plaetzchen.community.domain.comment.CommentService;
import com.plaetzchen.community.domain.comment.CommentUpdate;
import com.plaetzchen.community.domain.comment.CommentView;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/comments")
public class CommentController {

    private final CommentService commentService;

    public CommentController(CommentService commentService) {
        this.commentService = commentService;
    }

    @GetMapping
    public List<CommentView> list(
            @RequestParam(required = false) Long eventId,
            @RequestParam(required = false) Long serviceId,
            @RequestParam(required = false) Long parentId,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "50") int limit) {
        return commentService.list(eventId, serviceId, parentId, skip, limit);
    }

    @GetMapping("/my")
    public List<CommentView> mine(
            @RequestParam(defaultValue = "0") int skip, @RequestParam(defaultValue = "20") int limit) {
        return commentService.writtenBy(CurrentUserHolder.require().userId(), skip, limit);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CommentView create(@Valid @RequestBody CommentCreate request) {
        return commentService.create(CurrentUserHolder.require(), request);
    }

    @PutMapping("/{id}")
    public CommentView update(@PathVariable long id, @Valid @RequestBody CommentUpdate request) {
        return commentService.update(CurrentUserHolder.require(), id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable long id) {
        commentService.delete(CurrentUserHolder.require(), id);
    }
}
