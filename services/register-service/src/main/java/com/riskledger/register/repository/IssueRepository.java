package com.riskledger.register.repository;

import com.riskledger.register.domain.Issue;
import org.springframework.stereotype.Repository;

@Repository
public interface IssueRepository extends TrackedRecordRepository<Issue> {
}
