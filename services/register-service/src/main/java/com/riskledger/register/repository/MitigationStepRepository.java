package com.riskledger.register.repository;

import com.riskledger.register.domain.MitigationStep;
import org.springframework.stereotype.Repository;

@Repository
public interface MitigationStepRepository extends StepRepository<MitigationStep> {
}
