package com.communitycare.reporting.repository;

import com.communitycare.reporting.dto.AuditLogEntryDTO;
import com.communitycare.reporting.model.AdminLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface AdminLogRepository extends JpaRepository<AdminLog, Long> {
    @Query("select new com.communitycare.reporting.dto.AuditLogEntryDTO(a.id, a.adminId, u.username, a.action, a.targetType, a.targetId, a.details, a.createdAt) " +
            "from AdminLog a left join UserAccount u on u.id = a.adminId order by a.createdAt desc, a.id desc")
    List<AuditLogEntryDTO> findRecentWithAdminName(Pageable pageable);

    // Keeps the trail of a deleted admin while dropping the dangling reference
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update AdminLog a set a.adminId = null where a.adminId = :adminId")
    int detachAdmin(@Param("adminId") Long adminId);
}
