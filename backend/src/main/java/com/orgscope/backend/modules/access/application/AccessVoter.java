package com.orgscope.backend.modules.access.application;

import com.orgscope.backend.modules.access.domain.AccessRequest;
import com.orgscope.backend.modules.access.domain.AccessVerdict;

/**
 * One layer of the access decision. Implementations are stateless and side-effect free.
 */
public interface AccessVoter {

    AccessVerdict vote(AccessRequest request);
}
