package com.plaetzchen.community.api;

import com.plaetzchen.community.domain.listing.ServiceCreate;
import com.plaetzchen.community.domain.listing.ServiceListingService;
import com.plaetzchen.community.domain.listing.ServiceListingView;
import com.plaetzchen.community.domain.listing.ServiceStatsView;
import com.plaetzchen.community.domain.listing.ServiceUpdate;
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

/** Service marketplace: members offering or requesting help. */
@RestController
@RequestMapping("/api/v1/services")
public class ServiceListingController {

    private final ServiceListingService listingService;

    public ServiceListingController(ServiceListingService listingService) {
        this.listingService = listingService;
    }

    @GetMapping
    public List<ServiceListingView> list(
            @RequestParam(required = false) Boolean isOffering,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "20") int limit) {
        return listingService.list(isOffering, search, skip, limit);
    }

    @GetMapping("/stats")
    public ServiceStatsView stats() {
        return listingService.stats();
    }

    @GetMapping("/my")
    public List<ServiceListingView> mine(
            @RequestParam(defaultValue = "0") int skip, @RequestParam(defaultValue = "20") int limit) {
        return listingService.ownedBy(CurrentUserHolder.require().userId(), skip, limit);
    }

    @GetMapping("/{id}")
    public ServiceListingView get(@PathVariable long id) {
        return listingService.view(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ServiceListingView create(@Valid @RequestBody ServiceCreate request) {
        return listingService.create(CurrentUserHolder.require(), request);
    }

    @PutMapping("/{id}")
    public ServiceListingView update(@PathVariable long id, @Valid @RequestBody ServiceUpdate request) {
        return listingService.update(CurrentUserHolder.require(), id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable long id) {
        listingService.delete(CurrentUserHolder.require(), id);
    }

    @PostMapping("/{id}/interest")
    public ServiceListingView expressInterest(@PathVariable long id) {
        return listingService.expressInterest(CurrentUserHolder.require(), id);
    }

    @PostMapping("/{id}/complete")
    public ServiceListingView complete(@PathVariable long id) {
        return listingService.complete(CurrentUserHolder.require(), id);
    }
}
