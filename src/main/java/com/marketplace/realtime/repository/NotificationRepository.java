package com.marketplace.realtime.repository;

import com.marketplace.realtime.model.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    List<Notification> findTop50ByUserIdOrderByCreatedAtDesc(String userId);

    List<Notification> findByRequestId(String requestId);

    @Transactional
    @Modifying
    @Query("update Notification n set n.read = true, n.readAt = :readAt "
            + "where n.id = :id and n.userId = :userId")
    int markAsRead(@Param("id") UUID id, @Param("userId") String userId, @Param("readAt") Instant readAt);

    @Transactional
    @Modifying
    @Query("update Notification n set n.read = true, n.readAt = :readAt "
            + "where n.userId = :userId and n.read = false")
    int markAllAsRead(@Param("userId") String userId, @Param("readAt") Instant readAt);
}
