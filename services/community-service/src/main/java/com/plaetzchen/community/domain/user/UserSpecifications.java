package com.plaetzchen.community.domain.user;

import java.util.Locale;
import org.springframework.data.jpa.domain.Specification;

/** Filters for member listings. */
final class UserSpecifications {

    private UserSpecifications() {}

    static Specification<User> active() {
        return (root, query, cb) -> cb.isTrue(root.get("active"));
    }

    /** Case-insensitive match on display name, first and last name (and email, for admins). */
    static Specification<User> matches(String search, boolean includeEmail) {
        if (search == null || search.isBlank()) {
            return null;
        }
        String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, query, cb) -> {
            var byName =
                    cb.or(
                            cb.like(cb.lower(root.get("displayName")), pattern),
                            cb.like(cb.lower(root.get("firstName")), pattern),
                            cb.like(cb.lower(root.get("lastName")), pattern));
            return includeEmail ? cb.or(byName, cb.like(cb.lower(root.get("email")), pattern)) : byName;
        };
    }

    static Specification<User> flag(String attribute, Boolean value) {
        if (value == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get(attribute), value);
    }
}
