package com.orgscope.backend.modules.access.domain;

/**
 * Outcome of one voter. {@link #ABSTAIN} hands the decision to the next voter in the chain.
 */
public enum AccessVerdict {
    ALLOW,
    DENY,
    ABSTAIN;

    public boolean isDecisive() {
        return this != ABSTAIN;
    }
}
