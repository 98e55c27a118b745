package com.plaetzchen.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Community roles.
 * <p>
 * WHY an enum with hierarchy: the rule "an admin can do everything a member can" is encoded
 * once here instead of being repeated as {@code isAdmin || isOwner} checks in every service.
 */
public enum Role {

    MEMBER("ROLE_MEMBER"),
    ADMIN("ROLE_ADMIN");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "ROLE_ADMIN"). */
    public String value() {
        return value;
    }

    /**
     * Returns the roles this role implies. ADMIN implies MEMBER; MEMBER implies nothing.
     */
    public Set<Role> impliedRoles() {
        if (this == ADMIN) {
            return EnumSet.of(MEMBER);
        }
        return EnumSet.noneOf(Role.class);
    }

    /**
     * Checks whether this role implies the given role, directly or through the hierarchy.
     */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * Looks up a Role by its canonical string value.
     */
    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /** Roles granted to a member with the given admin flag. */
    public static Set<Role> forMember(boolean admin) {
        return admin ? EnumSet.of(MEMBER, ADMIN) : EnumSet.of(MEMBER);
    }
}
