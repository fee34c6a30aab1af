package com.orgscope.backend.modules.organization.domain;

public interface OrgPositioned {

    OrgCoordinates coordinates();
}
