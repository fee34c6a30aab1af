package com.orgscope.backend.modules.access.domain;

public enum AccessAction {
    READ,
    CREATE,
    UPDATE,
    DELETE
}
