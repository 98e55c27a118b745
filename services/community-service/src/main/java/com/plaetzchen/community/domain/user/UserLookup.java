package com.plaetzchen.community.domain.user;

import com.plaetzchen.community.domain.common.ResourceNotFoundException;
import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Resolves member ids to {@link UserSummary} for the views of other domains, in one query per
 * page of results.
 */
@Component
public class UserLookup {

    private final UserRepository users;

    public UserLookup(UserRepository users) {
        this.users = users;
    }

    public Map<Long, UserSummary> summaries(Collection<Long> ids) {
        return users.findAllById(ids.stream().distinct().toList()).stream()
                .map(UserSummary::of)
                .collect(Collectors.toMap(UserSummary::id, Function.identity()));
    }

    public UserSummary summary(long id) {
        return users.findById(id)
                .map(UserSummary::of)
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }

    /** Summary from a pre-fetched map, falling back to a placeholder for vanished rows. */
    public static UserSummary from(Map<Long, UserSummary> summaries, Long id) {
        UserSummary summary = summaries.get(id);
        return summary != null ? summary : new UserSummary(id, "unknown");
    }
}
