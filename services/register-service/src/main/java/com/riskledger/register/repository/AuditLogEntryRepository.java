package com.riskledger.register.repository;

import com.riskledger.register.domain.AuditLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditLogEntryRepository extends JpaRepository<AuditLogEntry, UUID> {

    List<AuditLogEntry> findByRecordIdOrderByCreatedAtDesc(UUID recordId);

    long countByRecordId(UUID recordId);

    @Modifying
    @Query("delete from AuditLogEntry a where a.recordId = :recordId")
    int deleteByRecordId(@Param("recordId") UUID recordId);
}
