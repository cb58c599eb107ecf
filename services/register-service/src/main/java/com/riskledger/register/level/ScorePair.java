package com.riskledger.register.level;

/**
 * Two ordinal scores, each held in [1,5]. For issues the first score is always 1.
 */
public record ScorePair(int first, int second) {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 5;
    public static final int DEFAULT_SCORE = 3;

    public ScorePair {
        first = clamp(first);
        second = clamp(second);
    }

    public static int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    public static int clampOrDefault(Integer score) {
        return score == null ? DEFAULT_SCORE : clamp(score);
    }
}
