package com.riskledger.register.service;

import com.riskledger.register.config.RegisterProperties;
import com.riskledger.register.domain.EntityKind;
import com.riskledger.register.domain.RecordScope;
import com.riskledger.register.domain.RecordVersion;
import com.riskledger.register.domain.Risk;
import com.riskledger.register.repository.RecordVersionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("VersionStore")
class VersionStoreTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T09:00:00Z");

    @Mock
    private RecordVersionRepository versionRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private RegisterProperties properties;
    private VersionStore versionStore;
    private Risk risk;

    @BeforeEach
    void setUp() {
        properties = new RegisterProperties();
        versionStore = new VersionStore(versionRepository, properties, transactionManager);
        risk = Risk.builder()
            .id(UUID.randomUUID())
            .organizationalUnitId(UUID.randomUUID())
            .riskName("Legacy import")
            .riskCondition("Imported without history")
            .riskIf("history is requested")
            .riskThen("version 1 is created")
            .likelihood(2)
            .consequence(4)
            .createdAt(CREATED)
            .updatedAt(CREATED)
            .build();
        risk.reclassify();
    }

    @Nested
    @DisplayName("appendVersion")
    class Append {

        @Test
        void numbersVersionsAfterExistingOnes() {
            UUID owner = UUID.randomUUID();
            when(versionRepository.findTopByOwnerIdOrderByVersionDesc(owner)).thenReturn(Optional.empty());
            when(versionRepository.countByOwnerId(owner)).thenReturn(0L);
            when(versionRepository.save(any(RecordVersion.class))).thenAnswer(invocation -> invocation.getArgument(0));

            RecordVersion version = versionStore.appendVersion(RecordScope.ENTITY, EntityKind.RISK, owner, owner,
                Map.of("likelihood", 3), Map.of("likelihoodChangeReason", "initial"), CREATED);

            assertThat(version.getVersion()).isEqualTo(1);
            assertThat(version.getCreatedAt()).isEqualTo(CREATED);
            assertThat(version.getChangeReasons()).containsEntry("likelihoodChangeReason", "initial");
        }

        @Test
        @DisplayName("moves the timestamp past the previous version")
        void keepsTimestampsStrictlyIncreasing() {
            UUID owner = UUID.randomUUID();
            RecordVersion previous = RecordVersion.builder().ownerId(owner).version(1).createdAt(CREATED).build();
            when(versionRepository.findTopByOwnerIdOrderByVersionDesc(owner)).thenReturn(Optional.of(previous));
            when(versionRepository.countByOwnerId(owner)).thenReturn(1L);
            when(versionRepository.save(any(RecordVersion.class))).thenAnswer(invocation -> invocation.getArgument(0));

            RecordVersion version = versionStore.appendVersion(RecordScope.ENTITY, EntityKind.RISK, owner, owner,
                Map.of(), null, CREATED);

            assertThat(version.getVersion()).isEqualTo(2);
            assertThat(version.getCreatedAt()).isEqualTo(CREATED.plusMillis(1));
        }
    }

    @Nested
    @DisplayName("versionsWithBackfill")
    class Backfill {

        @Test
        void returnsExistingVersionsUntouched() {
            RecordVersion existing = RecordVersion.builder().ownerId(risk.getId()).version(1).createdAt(CREATED).build();
            when(versionRepository.findByOwnerIdOrderByVersionAsc(risk.getId())).thenReturn(List.of(existing));

            assertThat(versionStore.versionsWithBackfill(risk)).containsExactly(existing);
            verify(versionRepository, never()).saveAndFlush(any());
        }

        @Test
        void persistsVersionOneFromCurrentState() {
            when(versionRepository.findByOwnerIdOrderByVersionAsc(risk.getId())).thenReturn(List.of());
            when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
            when(versionRepository.saveAndFlush(any(RecordVersion.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

            List<RecordVersion> versions = versionStore.versionsWithBackfill(risk);

            ArgumentCaptor<RecordVersion> saved = ArgumentCaptor.forClass(RecordVersion.class);
            verify(versionRepository).saveAndFlush(saved.capture());
            assertThat(saved.getValue().getVersion()).isEqualTo(1);
            assertThat(saved.getValue().getCreatedAt()).isEqualTo(CREATED);
            assertThat(saved.getValue().getSnapshot())
                .containsEntry("likelihood", 2)
                .containsEntry("consequence", 4)
                .containsEntry("riskLevel", "moderate");
            assertThat(versions).hasSize(1);
            assertThat(versions.get(0).isSynthetic()).isFalse();
        }

        @Test
        @DisplayName("re-reads version 1 when a concurrent reader backfilled first")
        void rereadsOnUniqueConflict() {
            RecordVersion stored = RecordVersion.builder().ownerId(risk.getId()).version(1).createdAt(CREATED).build();
            when(versionRepository.findByOwnerIdOrderByVersionAsc(risk.getId())).thenReturn(List.of());
            when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
            when(versionRepository.saveAndFlush(any(RecordVersion.class)))
                .thenThrow(new DataIntegrityViolationException("uk_record_versions_owner_version"));
            when(versionRepository.findByOwnerIdAndVersion(risk.getId(), 1)).thenReturn(Optional.of(stored));

            assertThat(versionStore.versionsWithBackfill(risk)).containsExactly(stored);
        }

        @Test
        @DisplayName("serves a synthetic version when the store fails")
        void fallsBackToSyntheticVersion() {
            when(versionRepository.findByOwnerIdOrderByVersionAsc(risk.getId())).thenReturn(List.of());
            when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
            when(versionRepository.saveAndFlush(any(RecordVersion.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

            List<RecordVersion> versions = versionStore.versionsWithBackfill(risk);

            assertThat(versions).hasSize(1);
            assertThat(versions.get(0).isSynthetic()).isTrue();
            assertThat(versions.get(0).getVersion()).isEqualTo(1);
            assertThat(versions.get(0).getCreatedAt()).isEqualTo(CREATED);
        }

        @Test
        void leavesRecordAloneWhenBackfillIsDisabled() {
            properties.getVersioning().setBackfillOnRead(false);
            when(versionRepository.findByOwnerIdOrderByVersionAsc(risk.getId())).thenReturn(List.of());

            assertThat(versionStore.versionsWithBackfill(risk)).isEmpty();
            verify(versionRepository, never()).saveAndFlush(any());
        }
    }
}
