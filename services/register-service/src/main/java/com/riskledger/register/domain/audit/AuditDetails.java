package com.riskledger.register.domain.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.riskledger.register.domain.AuditAction;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Payload of an audit entry, one subtype per action.
 *
 * <p>{@code stepNumber} is the 1-based position of the step the entry concerns, absent for
 * record-level entries.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CreatedDetails.class, name = "created"),
    @JsonSubTypes.Type(value = UpdatedDetails.class, name = "updated"),
    @JsonSubTypes.Type(value = DeletedDetails.class, name = "deleted")
})
public abstract class AuditDetails {

    private Integer stepNumber;

    protected AuditDetails(Integer stepNumber) {
        this.stepNumber = stepNumber;
    }

    @JsonIgnore
    public abstract AuditAction getAction();
}
