package com.riskledger.register.domain;

import com.riskledger.common.error.ValidationException;

final class StatusCodes {

    private StatusCodes() {
    }

    static <S extends TrackedStatus> S resolve(S[] values, String code, String field) {
        if (code == null) {
            return null;
        }
        for (S status : values) {
            if (status.getCode().equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        throw ValidationException.invalidValue(field, code);
    }
}
