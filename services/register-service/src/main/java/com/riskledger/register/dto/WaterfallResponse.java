package com.riskledger.register.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskledger.register.level.Level;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Planned and actual level trend of a record. The two series are ordered independently.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WaterfallResponse {

    @Builder.Default
    private List<PlannedPoint> planned = new ArrayList<>();

    @Builder.Default
    private List<ActualPoint> actual = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PlannedPoint {
        private UUID stepId;
        private Integer stepNumber;
        private String action;
        private LocalDate date;
        private Map<String, Integer> scores;
        private Level level;
        private int rank;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ActualPoint {
        private Instant date;
        /**
         * {@code <kind>_update} for record versions, {@code step} for completed steps.
         */
        private String source;
        private Integer version;
        private UUID stepId;
        private Integer stepNumber;
        private Map<String, Integer> scores;
        private Level level;
        private int rank;

        @JsonProperty("isOriginal")
        private boolean original;
    }
}
