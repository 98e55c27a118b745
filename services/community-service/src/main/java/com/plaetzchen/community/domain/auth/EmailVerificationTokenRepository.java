package com.plaetzchen.community.domain.auth;

import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmailVerificationTokenRepository extends JpaRepository<EmailVerificationToken, Long> {

    Optional<EmailVerificationToken> findByTokenHash(String tokenHash);

    /** Marks every outstanding token of the member as used. */
    @Modifying(flushAutomatically = true)
    @Query(
            "update EmailVerificationToken t set t.usedAt = :at"
                    + " where t.userId = :userId and t.usedAt is null")
    int consumeAllForUser(@Param("userId") Long userId, @Param("at") Instant at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from EmailVerificationToken t where t.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);
}
