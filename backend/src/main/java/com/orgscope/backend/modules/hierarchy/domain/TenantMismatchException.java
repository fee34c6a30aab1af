package com.orgscope.backend.modules.hierarchy.domain;

import org.springframework.http.HttpStatus;

import com.orgscope.backend.global.error.ProblemException;

public class TenantMismatchException extends ProblemException {

    public static final String CODE = "hierarchy.tenant_mismatch";

    public TenantMismatchException(String detail) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE, detail);
    }
}
