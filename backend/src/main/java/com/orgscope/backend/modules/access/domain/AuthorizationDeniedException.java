package com.orgscope.backend.modules.access.domain;

import org.springframework.http.HttpStatus;

import com.orgscope.backend.global.error.ProblemException;

public class AuthorizationDeniedException extends ProblemException {

    public static final String CODE = "access.denied";

    public AuthorizationDeniedException(String detail) {
        super(HttpStatus.FORBIDDEN, CODE, detail);
    }
}
