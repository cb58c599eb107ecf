package com.riskledger.register.repository;

import com.riskledger.register.domain.AbstractTrackedRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Queries shared by the risk, issue and opportunity tables.
 */
@NoRepositoryBean
public interface TrackedRecordRepository<R extends AbstractTrackedRecord> extends JpaRepository<R, UUID> {

    List<R> findByOrganizationalUnitIdOrderByUpdatedAtDesc(UUID organizationalUnitId);

    /**
     * Loads the record with a write lock held until commit. Step inserts, deletes and reorders
     * take it first so that concurrent writers see each other's sequence orders.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from #{#entityName} r where r.id = :id")
    Optional<R> findByIdForUpdate(@Param("id") UUID id);
}
