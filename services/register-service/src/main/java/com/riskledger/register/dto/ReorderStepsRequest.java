package com.riskledger.register.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Step ids in their new order, first to last.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReorderStepsRequest {

    @NotNull
    private List<UUID> stepIds;
}
