package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.poll.PollCreate;
import com.plaetzchen.community.domain.poll.PollResults;
import com.plaetzchen.community.domain.poll.PollRules;
import com.plaetzchen.community.domain.poll.PollService;
import com.plaetzchen.community.domain.poll.PollStatsView;
import com.plaetzchen.community.domain.poll.PollType;
import com.plaetzchen.community.domain.poll.PollUpdate;
import com.plaetzchen.community.domain.poll.PollView;
import com.plaetzchen.community.domain.poll.VoteRequest;
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

@RestController
@RequestMapping("/api/v1/polls")
public class PollController {

    private final PollService pollService;

    public PollController(PollService pollService) {
        this.pollService = pollService;
    }

    @GetMapping
    public List<PollView> list(
            @RequestParam(required = false) PollType pollType,
            @RequestParam(required = false) Long threadId,
            @RequestParam(defaultValue = "true") boolean activeOnly,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "20") int limit) {
        Long viewerId = CurrentUserHolder.currentUserId().orElse(null);
        return pollService.list(viewerId, pollType, threadId, activeOnly, skip, limit);
    }

    @GetMapping("/suggest-duration")
    public Map<String, Object> suggestDuration(
            @RequestParam PollType pollType, @RequestParam(required = false) Integer expectedParticipants) {
        return Map.of("hours", PollRules.suggestedDuration(pollType, expectedParticipants).toHours());
    }

    @GetMapping("/my/created")
    public List<PollView> myCreated(
            @RequestParam(defaultValue = "0") int skip, @RequestParam(defaultValue = "20") int limit) {
        return pollService.createdBy(CurrentUserHolder.require().userId(), skip, limit);
    }

    @GetMapping("/my/votes")
    public List<PollView> myVotes(
            @RequestParam(defaultValue = "0") int skip, @RequestParam(defaultValue = "20") int limit) {
        return pollService.votedBy(CurrentUserHolder.require().userId(), skip, limit);
    }

    @GetMapping("/my/stats")
    public PollStatsView myStats() {
        return pollService.stats(CurrentUserHolder.require().userId());
    }

    @GetMapping("/{id}")
    public PollView get(@PathVariable long id) {
        return pollService.get(CurrentUserHolder.currentUserId().orElse(null), id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public PollView create(@Valid @RequestBody PollCreate request) {
        return pollService.create(CurrentUserHolder.require(), request);
    }

    @PutMapping("/{id}")
    public PollView update(@PathVariable long id, @Valid @RequestBody PollUpdate request) {
        return pollService.update(CurrentUserHolder.require(), id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable long id) {
        pollService.delete(CurrentUserHolder.require(), id);
    }

    @PostMapping("/{id}/vote")
    public PollView vote(@PathVariable long id, @Valid @RequestBody VoteRequest request) {
        return pollService.vote(CurrentUserHolder.require(), id, request.optionId());
    }

    @DeleteMapping("/{id}/vote")
    public Map<String, Object> removeVote(@PathVariable long id) {
        pollService.removeVote(CurrentUserHolder.require(), id);
        return Map.of("message", "Vote removed");
    }

    /** Full tally, or only the headline numbers with {@code detailed=false}. */
    @GetMapping("/{id}/results")
    public Object results(@PathVariable long id, @RequestParam(defaultValue = "true") boolean detailed) {
        PollResults results = pollService.results(id);
        return detailed ? results : results.summary();
    }
}
