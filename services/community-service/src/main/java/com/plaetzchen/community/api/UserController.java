package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.user.ProfileUpdate;
import com.plaetzchen.community.domain.user.UserPrivateView;
import com.plaetzchen.community.domain.user.UserPublicView;
import com.plaetzchen.community.domain.user.UserService;
import com.plaetzchen.community.domain.user.UserStatsView;
import com.plaetzchen.security.CurrentUserHolder;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public List<UserPublicView> list(
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "100") int limit) {
        return userService.listPublic(search, skip, limit);
    }

    @GetMapping("/me/stats")
    public UserStatsView myStats() {
        return userService.stats(CurrentUserHolder.require().userId());
    }

    @PutMapping("/me")
    public UserPrivateView updateMe(@Valid @RequestBody ProfileUpdate update) {
        return userService.updateMe(CurrentUserHolder.require(), update);
    }

    @GetMapping("/{id}")
    public Object profile(@PathVariable long id) {
        return userService.profile(CurrentUserHolder.currentUserId().orElse(null), id);
    }
}
