package com.riskledger.register.repository;

import com.riskledger.register.domain.AbstractStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Queries shared by the three step tables.
 */
@NoRepositoryBean
public interface StepRepository<S extends AbstractStep> extends JpaRepository<S, UUID> {

    List<S> findByRecordIdOrderBySequenceOrderAsc(UUID recordId);

    Optional<S> findByIdAndRecordId(UUID id, UUID recordId);

    long countByRecordId(UUID recordId);

    @Query("select s.recordId, max(s.updatedAt) from #{#entityName} s "
        + "where s.recordId in :recordIds group by s.recordId")
    List<Object[]> findLatestUpdateByRecordIds(@Param("recordIds") Collection<UUID> recordIds);

    void deleteByRecordId(UUID recordId);

    default Optional<Instant> findLatestUpdate(UUID recordId) {
        return findLatestUpdateByRecordIds(List.of(recordId)).stream()
            .map(row -> (Instant) row[1])
            .findFirst();
    }
}
