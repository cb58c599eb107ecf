package com.riskledger.register.level;

/**
 * Result of classifying a score pair: the severity band and its 1-25 trend rank.
 */
public record LevelAssessment(Level level, int rank) {
}
