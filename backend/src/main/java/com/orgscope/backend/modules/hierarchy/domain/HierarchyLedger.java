package com.orgscope.backend.modules.hierarchy.domain;

import java.util.List;
import java.util.Optional;

/**
 * Read and lock access to one self-referencing hierarchy, keyed by id.
 */
public interface HierarchyLedger {

    HierarchyKind kind();

    Optional<HierarchyNode> findNode(long id);

    /**
     * Direct children of {@code parentId}, active or not, ordered by id.
     */
    List<Long> findChildIds(long parentId);

    boolean hasActiveChildren(long parentId);

    /**
     * Reads the node under a row-level write lock held until the surrounding transaction ends.
     */
    Optional<HierarchyNode> lockNode(long id);
}
