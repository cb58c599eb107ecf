package com.riskledger.register.repository;

import com.riskledger.register.domain.Opportunity;
import org.springframework.stereotype.Repository;

@Repository
public interface OpportunityRepository extends TrackedRecordRepository<Opportunity> {
}
