package com.orgscope.backend.modules.hierarchy.domain;

import org.springframework.http.HttpStatus;

import com.orgscope.backend.global.error.ProblemException;

public class HierarchyDepthExceededException extends ProblemException {

    public static final String CODE = "hierarchy.depth_exceeded";

    public HierarchyDepthExceededException(String detail) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE, detail);
    }
}
