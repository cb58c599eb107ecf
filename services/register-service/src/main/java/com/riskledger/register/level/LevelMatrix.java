package com.riskledger.register.level;

/**
 * Lookup tables mapping a score pair to a {@link LevelAssessment}.
 *
 * <p>Rows are the first score (likelihood), columns the second (consequence or impact).
 * The rank table follows the historical ranking convention and is not a function of the
 * product of the two scores. Inputs outside [1,5] are clamped, so classification never fails.
 */
public enum LevelMatrix {

    RISK(Tables.STANDARD_LEVELS, Tables.STANDARD_RANKS),
    OPPORTUNITY(Tables.STANDARD_LEVELS, Tables.STANDARD_RANKS),
    /**
     * Likelihood is fixed at 1 since the issue already happened; ranks reuse the likelihood 5 row.
     */
    ISSUE(new Level[][]{Tables.ISSUE_LEVELS}, new int[][]{Tables.STANDARD_RANKS[4]}) {
        @Override
        int row(int first) {
            return 0;
        }
    };

    private final Level[][] levels;
    private final int[][] ranks;

    LevelMatrix(Level[][] levels, int[][] ranks) {
        this.levels = levels;
        this.ranks = ranks;
    }

    public LevelAssessment classify(int first, int second) {
        int row = row(ScorePair.clamp(first));
        int col = ScorePair.clamp(second) - 1;
        return new LevelAssessment(levels[row][col], ranks[row][col]);
    }

    public LevelAssessment classify(ScorePair scores) {
        return classify(scores.first(), scores.second());
    }

    int row(int first) {
        return first - 1;
    }

    private static final class Tables {
        private static final Level L = Level.LOW;
        private static final Level M = Level.MODERATE;
        private static final Level H = Level.HIGH;

        static final Level[][] STANDARD_LEVELS = {
            {L, L, L, M, M},
            {L, L, M, M, H},
            {L, M, M, H, H},
            {M, M, H, H, H},
            {M, H, H, H, H},
        };

        static final int[][] STANDARD_RANKS = {
            {1, 3, 5, 9, 12},
            {2, 4, 11, 15, 17},
            {6, 10, 14, 19, 21},
            {7, 13, 18, 22, 24},
            {8, 16, 20, 23, 25},
        };

        static final Level[] ISSUE_LEVELS = {L, L, L, M, M};

        private Tables() {
        }
    }
}
