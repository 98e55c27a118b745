package com.plaetzchen.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Role")
class RoleTest {

    @Test
    @DisplayName("ADMIN implies MEMBER")
    void adminImpliesMember() {
        assertThat(Role.ADMIN.implies(Role.MEMBER)).isTrue();
        assertThat(Role.ADMIN.implies(Role.ADMIN)).isTrue();
    }

    @Test
    @DisplayName("MEMBER does not imply ADMIN")
    void memberDoesNotImplyAdmin() {
        assertThat(Role.MEMBER.implies(Role.ADMIN)).isFalse();
        assertThat(Role.MEMBER.impliedRoles()).isEmpty();
    }

    @Test
    @DisplayName("fromString resolves canonical values only")
    void fromString() {
        assertThat(Role.fromString("ROLE_ADMIN")).contains(Role.ADMIN);
        assertThat(Role.fromString("admin")).isEmpty();
    }

    @Test
    @DisplayName("forMember grants ADMIN only to admins")
    void forMember() {
        assertThat(Role.forMember(false)).containsExactly(Role.MEMBER);
        assertThat(Role.forMember(true)).containsExactlyInAnyOrder(Role.MEMBER, Role.ADMIN);
    }
}
