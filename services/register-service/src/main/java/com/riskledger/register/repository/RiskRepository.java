package com.riskledger.register.repository;

import com.riskledger.register.domain.Risk;
import org.springframework.stereotype.Repository;

@Repository
public interface RiskRepository extends TrackedRecordRepository<Risk> {
}
