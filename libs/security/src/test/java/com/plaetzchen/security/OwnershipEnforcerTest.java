package com.plaetzchen.security;

import com.plaetzchen.security.testing.TestSecurityContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WHY: the owner-or-admin rule guards every edit and delete in the platform.
 */
@DisplayName("OwnershipEnforcer")
class OwnershipEnforcerTest {

    @Test
    @DisplayName("owner passes")
    void ownerPasses() {
        var ctx = TestSecurityContextFactory.member(5L);
        assertThatCode(() -> OwnershipEnforcer.enforce(ctx, 5L, "nope")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("admin passes for someone else's resource")
    void adminPasses() {
        var ctx = TestSecurityContextFactory.admin(1L);
        assertThat(OwnershipEnforcer.isOwnerOrAdmin(ctx, 99L)).isTrue();
    }

    @Test
    @DisplayName("other member is denied with the given message")
    void otherMemberDenied() {
        var ctx = TestSecurityContextFactory.member(6L);
        assertThatThrownBy(() -> OwnershipEnforcer.enforce(ctx, 5L, "Not authorized to edit this event"))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessage("Not authorized to edit this event");
    }

    @Test
    @DisplayName("unknown owner is denied for members")
    void nullOwnerDenied() {
        var ctx = TestSecurityContextFactory.member(6L);
        assertThat(OwnershipEnforcer.isOwnerOrAdmin(ctx, null)).isFalse();
    }
}
