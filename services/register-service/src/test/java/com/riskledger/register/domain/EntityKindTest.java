package com.riskledger.register.domain;

import com.riskledger.common.error.ResourceNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityKindTest {

    @Test
    void gatedStatusesFollowDeclarationOrder() {
        assertThat(EntityKind.RISK.getStatusesRequiringRationale())
            .containsExactly("accepted", "closed", "realized");
        assertThat(EntityKind.OPPORTUNITY.getStatusesRequiringRationale())
            .containsExactly("defer", "reevaluate", "reject");
        assertThat(EntityKind.ISSUE.getStatusesRequiringRationale()).isEmpty();
    }

    @Test
    void gatedStatusesAreReadOnly() {
        assertThatThrownBy(() -> EntityKind.RISK.getStatusesRequiringRationale().add("open"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void readsScoresFromSnapshotKeys() {
        assertThat(EntityKind.OPPORTUNITY.scoreValues(
            EntityKind.OPPORTUNITY.scoresOf(Map.of("likelihood", 4, "impact", 2))))
            .containsEntry("likelihood", 4)
            .containsEntry("impact", 2);
        assertThat(EntityKind.ISSUE.getReorderField()).isEqualTo("resolutionStepsReordered");
    }

    @Test
    void resolvesCollectionsIgnoringCase() {
        assertThat(EntityKind.fromCollection("Opportunities")).isEqualTo(EntityKind.OPPORTUNITY);
        assertThatThrownBy(() -> EntityKind.fromCollection("hazards"))
            .isInstanceOf(ResourceNotFoundException.class);
    }
}
