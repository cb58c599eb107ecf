package com.riskledger.register.dto;

import com.riskledger.register.level.Level;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One version of one record in an organizational unit's combined trend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnitWaterfallPoint {
    private UUID recordId;
    private String name;
    private int version;
    private Instant date;
    private Map<String, Integer> scores;
    private Level level;
    private int rank;
}
