package com.riskledger.common.error;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;
    private SimpleMeterRegistry meterRegistry;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
        meterRegistry = new SimpleMeterRegistry();
        ReflectionTestUtils.setField(handler, "meterRegistry", meterRegistry);
        ReflectionTestUtils.setField(handler, "serviceName", "register-service");
        request = new MockHttpServletRequest("PATCH", "/api/v1/risks/42");
    }

    @Test
    @DisplayName("missing rationale maps to 400 with the missing keys as validation errors")
    void rationaleRequired() {
        ValidationException ex = new ValidationException(ErrorCode.VALIDATION_RATIONALE_REQUIRED,
            "Missing change rationale: likelihoodChangeReason",
            Map.of("likelihoodChangeReason", List.of("is required when likelihood changes")));

        ResponseEntity<ErrorResponse> response = handler.handleValidationException(ex, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        ErrorResponse body = response.getBody();
        assertThat(body).isNotNull();
        assertThat(body.getCode()).isEqualTo("VAL_7003");
        assertThat(body.getTitle()).isEqualTo("Change rationale is required");
        assertThat(body.getInstance()).isEqualTo("/api/v1/risks/42");
        assertThat(body.getValidationErrors()).containsOnlyKeys("likelihoodChangeReason");
        assertThat(body.getMetadata()).isNull();
    }

    @Test
    void notFoundCarriesResourceMetadata() {
        UUID id = UUID.randomUUID();

        ResponseEntity<ErrorResponse> response =
            handler.handleBusinessException(new ResourceNotFoundException("Risk", id), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getCode()).isEqualTo(ErrorCode.RECORD_NOT_FOUND.getCode());
        assertThat(response.getBody().getMetadata())
            .containsEntry("resourceType", "Risk")
            .containsEntry("resourceId", id.toString());
    }

    @Test
    void invalidStateTransitionIsUnprocessable() {
        BusinessException ex = new BusinessException(ErrorCode.INVALID_STATE_TRANSITION,
            "Only realized risks can raise an issue");

        ResponseEntity<ErrorResponse> response = handler.handleBusinessException(ex, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().getDetail()).isEqualTo("Only realized risks can raise an issue");
    }

    @Test
    void duplicateVersionIsConflict() {
        ResponseEntity<ErrorResponse> response =
            handler.handleConflict(new DataIntegrityViolationException("uk_record_versions_owner_version"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getCode()).isEqualTo("SYS_5009");
    }

    @Test
    void unexpectedErrorsHideDetails() {
        ResponseEntity<ErrorResponse> response =
            handler.handleGenericException(new IllegalStateException("connection reset"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getDetail()).doesNotContain("connection reset");
    }

    @Test
    void countsErrorsByCode() {
        handler.handleValidationException(ValidationException.requiredField("riskName"), request);
        handler.handleValidationException(ValidationException.requiredField("riskIf"), request);

        assertThat(meterRegistry.get("riskledger.errors")
            .tag("error_code", ErrorCode.VALIDATION_REQUIRED_FIELD.getCode())
            .tag("service", "register-service")
            .counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("conflicts of different exception types under one code are tagged separately")
    void tagsCountersByExceptionType() {
        handler.handleConflict(new DataIntegrityViolationException("duplicate version"), request);
        handler.handleConflict(new OptimisticLockingFailureException("stale record"), request);
        handler.handleConflict(new OptimisticLockingFailureException("stale record"), request);

        assertThat(meterRegistry.get("riskledger.errors")
            .tag("error_code", "SYS_5009")
            .tag("error_type", "DataIntegrityViolationException")
            .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("riskledger.errors")
            .tag("error_code", "SYS_5009")
            .tag("error_type", "OptimisticLockingFailureException")
            .counter().count()).isEqualTo(2.0);
    }
}
