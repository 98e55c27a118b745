package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.admin.AdminDashboardService;
import com.plaetzchen.community.domain.admin.DashboardView;
import com.plaetzchen.database.migration.MigrationService;
import com.plaetzchen.security.CurrentUserHolder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
public class AdminDashboardController {

    private final AdminDashboardService dashboardService;

    public AdminDashboardController(AdminDashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/dashboard")
    public DashboardView dashboard() {
        CurrentUserHolder.requireAdmin();
        return dashboardService.dashboard();
    }

    @GetMapping("/migrations")
    public MigrationService.DatabaseStatus migrations() {
        CurrentUserHolder.requireAdmin();
        return dashboardService.migrations();
    }
}
