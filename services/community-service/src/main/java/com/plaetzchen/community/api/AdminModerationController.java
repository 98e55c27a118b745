package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.moderation.AnalyzeRequest;
import com.plaetzchen.community.domain.moderation.ModerationResult;
import com.plaetzchen.community.domain.moderation.ModerationService;
import com.plaetzchen.community.domain.moderation.UserModerationReport;
import com.plaetzchen.security.CurrentUserHolder;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/moderation")
public class AdminModerationController {

    private final ModerationService moderationService;

    public AdminModerationController(ModerationService moderationService) {
        this.moderationService = moderationService;
    }

    @GetMapping("/users/{id}")
    public UserModerationReport userReport(@PathVariable long id) {
        CurrentUserHolder.requireAdmin();
        return moderationService.reportFor(id);
    }

    @PostMapping("/analyze")
    public ModerationResult analyze(@Valid @RequestBody AnalyzeRequest request) {
        CurrentUserHolder.requireAdmin();
        return moderationService.analyze(request.content());
    }
}
