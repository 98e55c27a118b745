package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.notification.NotificationService;
import com.plaetzchen.community.domain.notification.NotificationStatsView;
import com.plaetzchen.community.domain.notification.NotificationView;
import com.plaetzchen.community.domain.notification.ReadUpdate;
import com.plaetzchen.security.CurrentUserHolder;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** The caller's in-app notifications. Every endpoint is scoped to the authenticated member. */
@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public List<NotificationView> list(
            @RequestParam(defaultValue = "false") boolean unreadOnly,
            @RequestParam(required = false) String type,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "50") int limit) {
        return notificationService.list(CurrentUserHolder.require().userId(), unreadOnly, type, skip, limit);
    }

    @GetMapping("/stats")
    public NotificationStatsView stats() {
        return notificationService.stats(CurrentUserHolder.require().userId());
    }

    @PutMapping("/read-all")
    public Map<String, Object> markAllRead() {
        return Map.of("markedRead", notificationService.markAllRead(CurrentUserHolder.require().userId()));
    }

    @PutMapping("/{id}/read")
    public NotificationView markRead(@PathVariable long id, @Valid @RequestBody ReadUpdate update) {
        return notificationService.markRead(CurrentUserHolder.require().userId(), id, update.isRead());
    }

    @DeleteMapping("/read")
    public Map<String, Object> deleteRead() {
        return Map.of("deleted", notificationService.deleteRead(CurrentUserHolder.require().userId()));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable long id) {
        notificationService.delete(CurrentUserHolder.require().userId(), id);
    }
}
