package com.orgscope.backend.modules.hierarchy.domain;

import org.springframework.http.HttpStatus;

import com.orgscope.backend.global.error.ProblemException;

/**
 * Raised when an edge would make a node its own ancestor, or when a stored chain already loops.
 */
public class HierarchyCycleException extends ProblemException {

    public static final String CODE = "hierarchy.cycle";

    public HierarchyCycleException(String detail) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE, detail);
    }
}
