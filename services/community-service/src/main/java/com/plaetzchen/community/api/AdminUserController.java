package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.user.AccountStatusUpdate;
import com.plaetzchen.community.domain.user.AdminRoleUpdate;
import com.plaetzchen.community.domain.user.UserPrivateView;
import com.plaetzchen.community.domain.user.UserService;
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
@RequestMapping("/api/v1/admin/users")
public class AdminUserController {

    private final UserService userService;

    public AdminUserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public List<UserPrivateView> list(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Boolean isActive,
            @RequestParam(required = false) Boolean isAdmin,
            @RequestParam(required = false) Boolean emailVerified,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "100") int limit) {
        CurrentUserHolder.requireAdmin();
        return userService.adminList(search, isActive, isAdmin, emailVerified, skip, limit);
    }

    @PutMapping("/{id}/status")
    public UserPrivateView setStatus(@PathVariable long id, @Valid @RequestBody AccountStatusUpdate update) {
        return userService.setActive(CurrentUserHolder.requireAdmin(), id, update.isActive());
    }

    @PutMapping("/{id}/admin")
    public UserPrivateView setAdmin(@PathVariable long id, @Valid @RequestBody AdminRoleUpdate update) {
        return userService.setAdmin(CurrentUserHolder.requireAdmin(), id, update.isAdmin());
    }
}
