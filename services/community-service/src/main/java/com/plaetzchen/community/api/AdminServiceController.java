package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.listing.ServiceListingService;
import com.plaetzchen.community.domain.listing.ServiceListingView;
import com.plaetzchen.community.domain.listing.ServiceReview;
import com.plaetzchen.security.CurrentUserHolder;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/services")
public class AdminServiceController {

    private final ServiceListingService listingService;

    public AdminServiceController(ServiceListingService listingService) {
        this.listingService = listingService;
    }

    @GetMapping("/flagged")
    public List<ServiceListingView> flagged(
            @RequestParam(defaultValue = "0") int skip, @RequestParam(defaultValue = "50") int limit) {
        CurrentUserHolder.requireAdmin();
        return listingService.flagged(skip, limit);
    }

    @PostMapping("/{id}/review")
    public ServiceListingView review(@PathVariable long id, @Valid @RequestBody ServiceReview review) {
        return listingService.review(CurrentUserHolder.requireAdmin(), id, review);
    }
}
