package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.forum.ForumService;
import com.plaetzchen.community.domain.forum.PostCreate;
import com.plaetzchen.community.domain.forum.PostUpdate;
import com.plaetzchen.community.domain.forum.PostView;
import com.plaetzchen.community.domain.forum.ThreadCreate;
import com.plaetzchen.community.domain.forum.ThreadUpdate;
import com.plaetzchen.community.domain.forum.ThreadView;
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

/** Forum threads and posts. */
@RestController
@RequestMapping("/api/v1/discussions")
public class DiscussionController {

    private final ForumService forumService;

    public DiscussionController(ForumService forumService) {
        this.forumService = forumService;
    }

    // ── Threads ──

    @GetMapping("/threads")
    public List<ThreadView> listThreads(
            @RequestParam(required = false) Long categoryId,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "20") int limit) {
        return forumService.listThreads(categoryId, skip, limit);
    }

    @GetMapping("/threads/{id}")
    public ThreadView getThread(@PathVariable long id) {
        return forumService.getThread(id);
    }

    @PostMapping("/threads")
    @ResponseStatus(HttpStatus.CREATED)
    public ThreadView createThread(@Valid @RequestBody ThreadCreate request) {
        return forumService.createThread(CurrentUserHolder.require(), request);
    }

    @PutMapping("/threads/{id}")
    public ThreadView updateThread(@PathVariable long id, @Valid @RequestBody ThreadUpdate request) {
        return forumService.updateThread(CurrentUserHolder.require(), id, request);
    }

    @DeleteMapping("/threads/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteThread(@PathVariable long id) {
        forumService.deleteThread(CurrentUserHolder.require(), id);
    }

    // ── Posts ──

    @GetMapping("/threads/{id}/posts")
    public List<PostView> listPosts(
            @PathVariable long id,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "50") int limit) {
        return forumService.listPosts(id, skip, limit);
    }

    @PostMapping("/threads/{id}/posts")
    @ResponseStatus(HttpStatus.CREATED)
    public PostView createPost(@PathVariable long id, @Valid @RequestBody PostCreate request) {
        return forumService.createPost(CurrentUserHolder.require(), id, request);
    }

    @PutMapping("/posts/{id}")
    public PostView updatePost(@PathVariable long id, @Valid @RequestBody PostUpdate request) {
        return forumService.updatePost(CurrentUserHolder.require(), id, request);
    }

    @DeleteMapping("/posts/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deletePost(@PathVariable long id) {
        forumService.deletePost(CurrentUserHolder.require(), id);
    }

    // ── Mine ──

    @GetMapping("/my/threads")
    public List<ThreadView> myThreads(
            @RequestParam(defaultValue = "0") int skip, @RequestParam(defaultValue = "20") int limit) {
        return forumService.threadsBy(CurrentUserHolder.require().userId(), skip, limit);
    }

    @GetMapping("/my/posts")
    public List<PostView> myPosts(
            @RequestParam(defaultValue = "0") int skip, @RequestParam(defaultValue = "20") int limit) {
        return forumService.postsBy(CurrentUserHolder.require().userId(), skip, limit);
    }
}
