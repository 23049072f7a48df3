package com.libauto.job;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.QueryHint;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface AutomationLogRepository extends JpaRepository<AutomationLog, UUID> {

    @Query("SELECT l FROM AutomationLog l WHERE l.jobId = :jobId ORDER BY l.startedAt DESC")
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<AutomationLog> findRecentByJobId(@Param("jobId") String jobId, Pageable pageable);

    @Modifying
    @Query("DELETE FROM AutomationLog l WHERE l.startedAt < :threshold")
    int deleteStartedBefore(@Param("threshold") OffsetDateTime threshold);
}
