package com.riskledger.register.level;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LevelMatrix")
class LevelMatrixTest {

    @Nested
    @DisplayName("Risk grid")
    class RiskGrid {

        @ParameterizedTest(name = "L{0} x C{1} -> {2}/{3}")
        @CsvSource({
            "1, 1, LOW, 1",
            "1, 4, MODERATE, 9",
            "2, 3, MODERATE, 11",
            "2, 5, HIGH, 17",
            "3, 1, LOW, 6",
            "3, 3, MODERATE, 14",
            "3, 4, HIGH, 19",
            "4, 1, MODERATE, 7",
            "4, 2, MODERATE, 13",
            "5, 2, HIGH, 16",
            "5, 3, HIGH, 20",
            "5, 5, HIGH, 25"
        })
        void classifiesCells(int likelihood, int consequence, Level level, int rank) {
            LevelAssessment assessment = LevelMatrix.RISK.classify(likelihood, consequence);

            assertThat(assessment.level()).isEqualTo(level);
            assertThat(assessment.rank()).isEqualTo(rank);
        }

        @Test
        @DisplayName("assigns every rank 1-25 exactly once")
        void ranksArePermutation() {
            Set<Integer> ranks = new HashSet<>();
            for (int l = 1; l <= 5; l++) {
                for (int c = 1; c <= 5; c++) {
                    ranks.add(LevelMatrix.RISK.classify(l, c).rank());
                }
            }

            assertThat(ranks).hasSize(25);
            assertThat(ranks).allMatch(rank -> rank >= 1 && rank <= 25);
        }

        @Test
        @DisplayName("clamps out-of-range scores instead of failing")
        void clampsInputs() {
            assertThat(LevelMatrix.RISK.classify(0, -7)).isEqualTo(LevelMatrix.RISK.classify(1, 1));
            assertThat(LevelMatrix.RISK.classify(9, 42)).isEqualTo(LevelMatrix.RISK.classify(5, 5));
        }
    }

    @Test
    @DisplayName("opportunity grid uses the same ranks as the risk grid")
    void opportunitySharesRanks() {
        for (int l = 1; l <= 5; l++) {
            for (int i = 1; i <= 5; i++) {
                assertThat(LevelMatrix.OPPORTUNITY.classify(l, i)).isEqualTo(LevelMatrix.RISK.classify(l, i));
            }
        }
    }

    @Nested
    @DisplayName("Issue row")
    class IssueRow {

        @ParameterizedTest(name = "C{0} -> {1}/{2}")
        @CsvSource({
            "1, LOW, 8",
            "2, LOW, 16",
            "3, LOW, 20",
            "4, MODERATE, 23",
            "5, MODERATE, 25"
        })
        void classifiesByConsequenceAlone(int consequence, Level level, int rank) {
            LevelAssessment assessment = LevelMatrix.ISSUE.classify(1, consequence);

            assertThat(assessment.level()).isEqualTo(level);
            assertThat(assessment.rank()).isEqualTo(rank);
        }

        @Test
        void ignoresFirstScore() {
            assertThat(LevelMatrix.ISSUE.classify(5, 4)).isEqualTo(LevelMatrix.ISSUE.classify(1, 4));
        }
    }

    @ParameterizedTest
    @EnumSource(LevelMatrix.class)
    void isTotalOverTheScoreRange(LevelMatrix matrix) {
        for (int a = -2; a <= 8; a++) {
            for (int b = -2; b <= 8; b++) {
                assertThat(matrix.classify(a, b)).isNotNull();
            }
        }
    }
}
