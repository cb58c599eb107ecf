package com.riskledger.register.repository;

import com.riskledger.register.domain.RecordScope;
import com.riskledger.register.domain.RecordVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RecordVersionRepository extends JpaRepository<RecordVersion, UUID> {

    long countByOwnerId(UUID ownerId);

    boolean existsByOwnerId(UUID ownerId);

    Optional<RecordVersion> findTopByOwnerIdOrderByVersionDesc(UUID ownerId);

    Optional<RecordVersion> findByOwnerIdAndVersion(UUID ownerId, int version);

    List<RecordVersion> findByOwnerIdOrderByVersionAsc(UUID ownerId);

    /**
     * Versions of every step that ever belonged to the record, deleted steps included.
     */
    List<RecordVersion> findByRecordIdAndScopeOrderByCreatedAtAscVersionAsc(UUID recordId, RecordScope scope);

    List<RecordVersion> findByOwnerIdInAndVersion(Collection<UUID> ownerIds, int version);

    List<RecordVersion> findByOwnerIdInOrderByCreatedAtAscVersionAsc(Collection<UUID> ownerIds);

    @Modifying
    @Query("delete from RecordVersion v where v.recordId = :recordId")
    int deleteByRecordId(@Param("recordId") UUID recordId);
}
