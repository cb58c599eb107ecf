package com.riskledger.common.error;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception thrown when a requested resource is not found.
 */
@Getter
public class ResourceNotFoundException extends BusinessException {

    private static final long serialVersionUID = 2L;

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String message) {
        super(ErrorCode.RESOURCE_NOT_FOUND, message);
        this.resourceType = null;
        this.resourceId = null;
    }

    public ResourceNotFoundException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.resourceType = null;
        this.resourceId = null;
    }

    /**
     * Constructor with resource name and UUID
     */
    public ResourceNotFoundException(String resourceType, UUID id) {
        super(ErrorCode.RECORD_NOT_FOUND, String.format("%s not found with ID: %s", resourceType, id));
        this.resourceType = resourceType;
        this.resourceId = id != null ? id.toString() : null;
        withMetadata("resourceType", resourceType);
        withMetadata("resourceId", resourceId);
    }

    public static ResourceNotFoundException step(String stepType, UUID stepId) {
        ResourceNotFoundException ex = new ResourceNotFoundException(ErrorCode.STEP_NOT_FOUND,
            String.format("%s not found with ID: %s", stepType, stepId));
        ex.withMetadata("stepId", stepId);
        return ex;
    }
}
