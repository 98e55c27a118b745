package com.plaetzchen.community.domain.notification;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository
        extends JpaRepository<Notification, Long>, JpaSpecificationExecutor<Notification> {

    long countByUserIdAndReadFalse(Long userId);

    long countByReadFalse();

    List<Notification> findTop5ByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    List<Notification> findByUserIdAndType(Long userId, String type);

    /** Rows of {@code [type, count]} of the member's unread notifications. */
    @Query(
            "select n.type, count(n) from Notification n"
                    + " where n.userId = :userId and n.read = false group by n.type")
    List<Object[]> countUnreadByType(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Notification n set n.read = true where n.userId = :userId and n.read = false")
    int markAllRead(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Notification n where n.userId = :userId and n.read = true")
    int deleteRead(@Param("userId") Long userId);
}
