package com.orgscope.backend.modules.hierarchy.domain;

import org.springframework.http.HttpStatus;

import com.orgscope.backend.global.error.ProblemException;

/**
 * Raised when a node is deactivated while it still has active children or subordinates.
 */
public class ActiveDescendantsException extends ProblemException {

    public static final String CODE = "hierarchy.active_descendants";

    public ActiveDescendantsException(String detail) {
        super(HttpStatus.CONFLICT, CODE, detail);
    }
}
