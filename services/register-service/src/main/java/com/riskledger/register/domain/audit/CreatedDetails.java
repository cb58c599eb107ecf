package com.riskledger.register.domain.audit;

import com.riskledger.register.domain.AuditAction;
import lombok.NoArgsConstructor;

@NoArgsConstructor
public class CreatedDetails extends AuditDetails {

    public CreatedDetails(Integer stepNumber) {
        super(stepNumber);
    }

    @Override
    public AuditAction getAction() {
        return AuditAction.CREATED;
    }
}
