package com.plaetzchen.community.domain.user;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface UserRepository extends JpaRepository<User, Long>, JpaSpecificationExecutor<User> {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByDisplayName(String displayName);

    boolean existsByDisplayNameAndIdNot(String displayName, Long id);

    /** Active members addressed by {@code @DisplayName} mentions. */
    List<User> findByDisplayNameInAndActiveTrue(Collection<String> displayNames);

    long countByActiveTrue();

    long countByEmailVerifiedTrue();

    long countByAdminTrue();

    long countByCreatedAtAfter(Instant since);
}
