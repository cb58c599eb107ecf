package com.riskledger.register.domain;

import com.riskledger.register.level.Level;
import com.riskledger.register.level.LevelAssessment;
import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.UUID;

/**
 * Columns shared by every register table.
 */
@MappedSuperclass
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder
public abstract class AbstractTrackedRecord implements TrackedRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "organizational_unit_id", nullable = false)
    private UUID organizationalUnitId;

    @Column(name = "category", length = 64)
    private String category;

    @Column(name = "owner")
    private String owner;

    @Enumerated(EnumType.STRING)
    @Column(name = "level_code", length = 16)
    private Level level;

    @Column(name = "level_rank")
    private Integer levelRank;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "row_version")
    private Long rowVersion;

    /**
     * Recomputes level and rank from the current scores.
     */
    public void reclassify() {
        LevelAssessment assessment = getKind().classify(getScores());
        this.level = assessment.level();
        this.levelRank = assessment.rank();
    }
}
