package com.riskledger.register.repository;

import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.RecordScope;
import com.riskledger.register.domain.RecordVersion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("RecordVersionRepository Integration Tests")
class RecordVersionRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Autowired
    private RecordVersionRepository versionRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("rejects a second version with the same number for one owner")
    void uniqueOwnerVersion() {
        UUID owner = UUID.randomUUID();
        versionRepository.saveAndFlush(version(owner, owner, RecordScope.ENTITY, 1, T0));

        assertThatThrownBy(() -> versionRepository.saveAndFlush(version(owner, owner, RecordScope.ENTITY, 1, T0)))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void storesSnapshotAndReasonsAsJson() {
        UUID owner = UUID.randomUUID();
        RecordVersion version = version(owner, owner, RecordScope.ENTITY, 1, T0);
        version.setChangeReasons(new LinkedHashMap<>(Map.of("likelihoodChangeReason", "reassessed exposure")));
        versionRepository.saveAndFlush(version);
        entityManager.clear();

        RecordVersion loaded = versionRepository.findByOwnerIdAndVersion(owner, 1).orElseThrow();

        assertThat(loaded.getSnapshot()).containsEntry("likelihood", 3).containsEntry("riskName", "Supplier delay");
        assertThat(loaded.getChangeReasons()).containsEntry("likelihoodChangeReason", "reassessed exposure");
    }

    @Test
    void countsAndOrdersPerOwner() {
        UUID record = UUID.randomUUID();
        UUID step = UUID.randomUUID();
        versionRepository.save(version(record, record, RecordScope.ENTITY, 1, T0));
        versionRepository.save(version(record, record, RecordScope.ENTITY, 2, T0.plusSeconds(10)));
        versionRepository.save(version(step, record, RecordScope.STEP, 1, T0.plusSeconds(5)));
        versionRepository.flush();

        assertThat(versionRepository.countByOwnerId(record)).isEqualTo(2);
        assertThat(versionRepository.findTopByOwnerIdOrderByVersionDesc(record))
            .hasValueSatisfying(latest -> assertThat(latest.getVersion()).isEqualTo(2));
        assertThat(versionRepository.findByRecordIdAndScopeOrderByCreatedAtAscVersionAsc(record, RecordScope.STEP))
            .extracting(RecordVersion::getOwnerId)
            .containsExactly(step);
        assertThat(versionRepository.findByOwnerIdInAndVersion(List.of(record, step), 1)).hasSize(2);
    }

    @Test
    void purgesEveryVersionOfARecord() {
        UUID record = UUID.randomUUID();
        UUID step = UUID.randomUUID();
        versionRepository.save(version(record, record, RecordScope.ENTITY, 1, T0));
        versionRepository.save(version(step, record, RecordScope.STEP, 1, T0));
        versionRepository.flush();

        int purged = versionRepository.deleteByRecordId(record);

        assertThat(purged).isEqualTo(2);
        assertThat(versionRepository.existsByOwnerId(record)).isFalse();
    }

    private static RecordVersion version(UUID owner, UUID record, RecordScope scope, int number, Instant at) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("riskName", "Supplier delay");
        snapshot.put("likelihood", 3);
        return RecordVersion.builder()
            .ownerId(owner)
            .recordId(record)
            .scope(scope)
            .entityKind(EntityKind.RISK)
            .version(number)
            .snapshot(snapshot)
            .createdAt(at)
            .build();
    }
}
