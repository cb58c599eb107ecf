package com.riskledger.register.domain.audit;

import com.riskledger.register.domain.AuditAction;
import lombok.NoArgsConstructor;

@NoArgsConstructor
public class DeletedDetails extends AuditDetails {

    public DeletedDetails(Integer stepNumber) {
        super(stepNumber);
    }

    @Override
    public AuditAction getAction() {
        return AuditAction.DELETED;
    }
}
