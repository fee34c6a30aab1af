package com.orgscope.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A write collided with a unique constraint. The transaction that raised it is rolled back.
 */
public class UniquenessConflictException extends ProblemException {

    public UniquenessConflictException(String code, String detail) {
        super(HttpStatus.CONFLICT, code, detail);
    }
}
