package com.riskledger.register.repository;

import com.riskledger.register.domain.ResolutionStep;
import org.springframework.stereotype.Repository;

@Repository
public interface ResolutionStepRepository extends StepRepository<ResolutionStep> {
}
