package com.communitycare.reporting.repository;

import com.communitycare.reporting.model.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface NotificationRepository extends JpaRepository<Notification, Long> {
    List<Notification> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    long countByUserIdAndReadFalse(Long userId);

    long countByUserId(Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Notification n set n.read = true where n.userId = :userId and n.read = false")
    int markAllReadForUser(@Param("userId") Long userId);

    // Cascade helpers used when the subject report or the recipient disappears
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Notification n where n.reportId in :reportIds")
    int deleteByReportIds(@Param("reportIds") Collection<Long> reportIds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Notification n where n.userId = :userId")
    int deleteByRecipient(@Param("userId") Long userId);
}
