package com.riskledger.register.service;

import com.riskledger.register.config.RegisterProperties;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Collaborators every register service needs.
 */
@Getter
@Component
@RequiredArgsConstructor
public class RegisterSupport {

    private final ChangeCaptureService changeCapture;
    private final VersionStore versionStore;
    private final AuditLogService auditLogService;
    private final RationalePolicy rationalePolicy;
    private final CategoryService categoryService;
    private final RegisterProperties properties;
}
