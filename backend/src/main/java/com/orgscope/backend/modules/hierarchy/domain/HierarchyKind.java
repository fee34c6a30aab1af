package com.orgscope.backend.modules.hierarchy.domain;

/**
 * The self-referencing hierarchies the validator guards.
 */
public enum HierarchyKind {

    /** Department parent/child tree, at most five links from any department to its root. */
    DEPARTMENT("department", 5),

    /** Employee supervisor/subordinate tree, unbounded depth. */
    EMPLOYEE("employee", null);

    private final String codePrefix;
    private final Integer maxLinks;

    HierarchyKind(String codePrefix, Integer maxLinks) {
        this.codePrefix = codePrefix;
        this.maxLinks = maxLinks;
    }

    public String codePrefix() {
        return codePrefix;
    }

    public boolean isDepthBounded() {
        return maxLinks != null;
    }

    public int maxLinks() {
        if (maxLinks == null) {
            throw new IllegalStateException(name() + " hierarchy has no depth bound");
        }
        return maxLinks;
    }
}
