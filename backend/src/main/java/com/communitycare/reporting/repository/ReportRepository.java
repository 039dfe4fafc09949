package com.communitycare.reporting.repository;

import com.communitycare.reporting.model.Report;
import com.communitycare.reporting.model.ReportStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ReportRepository extends JpaRepository<Report, Long> {
    // Newest first by insertion order
    List<Report> findAllByOrderByIdDesc();

    List<Report> findByUserIdOrderByIdDesc(Long userId);

    long countByStatus(ReportStatus status);

    long countByUserId(Long userId);

    @Query("select r.id from Report r where r.userId = :userId")
    List<Long> findIdsByUserId(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Report r where r.userId = :userId")
    int deleteByOwner(@Param("userId") Long userId);
}
