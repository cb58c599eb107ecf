package com.riskledger.register.repository;

import com.riskledger.register.domain.ActionPlanStep;
import org.springframework.stereotype.Repository;

@Repository
public interface ActionPlanStepRepository extends StepRepository<ActionPlanStep> {
}
