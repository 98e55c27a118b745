package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.event.AttendanceRequest;
import com.plaetzchen.community.domain.event.AutoAttendanceResult;
import com.plaetzchen.community.domain.event.EventCreate;
import com.plaetzchen.community.domain.event.EventDetailView;
import com.plaetzchen.community.domain.event.EventHistoryView;
import com.plaetzchen.community.domain.event.EventService;
import com.plaetzchen.community.domain.event.EventUpdate;
import com.plaetzchen.community.domain.event.EventView;
import com.plaetzchen.community.domain.event.ParticipantView;
import com.plaetzchen.security.CurrentUserHolder;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
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

/** Community events, participation and the admin attendance tools. */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventService eventService;

    public EventController(EventService eventService) {
        this.eventService = eventService;
    }

    @GetMapping
    public List<EventView> list(
            @RequestParam(defaultValue = "true") boolean upcomingOnly,
            @RequestParam(required = false) Long categoryId,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "50") int limit) {
        return eventService.list(upcomingOnly, categoryId, skip, limit);
    }

    @GetMapping("/{id}")
    public EventDetailView get(@PathVariable long id) {
        return eventService.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public EventDetailView create(@Valid @RequestBody EventCreate request) {
        return eventService.create(CurrentUserHolder.require(), request);
    }

    @PutMapping("/{id}")
    public EventDetailView update(@PathVariable long id, @Valid @RequestBody EventUpdate request) {
        return eventService.update(CurrentUserHolder.require(), id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable long id) {
        eventService.delete(CurrentUserHolder.require(), id);
    }

    // ── Participation ──

    @PostMapping("/{id}/join")
    public EventDetailView join(@PathVariable long id) {
        return eventService.join(CurrentUserHolder.require(), id);
    }

    @DeleteMapping("/{id}/join")
    public Map<String, Object> leave(@PathVariable long id) {
        eventService.leave(CurrentUserHolder.require(), id);
        return Map.of("message", "Successfully left event");
    }

    @GetMapping("/{id}/participants")
    public List<ParticipantView> participants(@PathVariable long id) {
        return eventService.participants(id);
    }

    @GetMapping("/my/created")
    public List<EventView> myCreated(
            @RequestParam(defaultValue = "0") int skip, @RequestParam(defaultValue = "20") int limit) {
        return eventService.createdBy(CurrentUserHolder.require().userId(), skip, limit);
    }

    @GetMapping("/my/joined")
    public List<EventView> myJoined(
            @RequestParam(defaultValue = "0") int skip, @RequestParam(defaultValue = "20") int limit) {
        return eventService.joinedBy(CurrentUserHolder.require().userId(), skip, limit);
    }

    @GetMapping("/my/stats")
    public EventHistoryView myStats() {
        return eventService.history(CurrentUserHolder.require().userId());
    }

    // ── Admin ──

    @PostMapping("/{id}/attendance")
    public Map<String, Object> markAttendance(
            @PathVariable long id, @Valid @RequestBody AttendanceRequest request) {
        CurrentUserHolder.requireAdmin();
        return Map.of("updated", eventService.markAttendance(id, request.userIds()));
    }

    @PostMapping("/{id}/complete")
    public AutoAttendanceResult complete(@PathVariable long id) {
        CurrentUserHolder.requireAdmin();
        return eventService.completeEvent(id);
    }
}
