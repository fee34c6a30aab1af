package com.orgscope.backend.modules.hierarchy.application;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.modules.hierarchy.domain.ActiveDescendantsException;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyCycleException;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyDepthExceededException;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyKind;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyLedger;
import com.orgscope.backend.modules.hierarchy.domain.HierarchyNode;
import com.orgscope.backend.modules.hierarchy.domain.TenantMismatchException;

/**
 * Guards the department and employee trees against cycles, cross-tenant edges and excessive depth.
 *
 * <p>Validation is read-only. Callers run it in the same transaction as the write, after locking the
 * owning company row and then both endpoints with {@link #lockEdge(HierarchyKind, Long, Long)}, and
 * apply the edge only if no exception was thrown. The company lock is what keeps two concurrent edge
 * changes in one tree from each passing validation against the other's stale state. The upward walk costs one lookup per ancestor; the depth check also
 * visits the subtree being moved.</p>
 */
@Component
public class HierarchyValidator {

    private static final Logger log = LoggerFactory.getLogger(HierarchyValidator.class);

    private final Map<HierarchyKind, HierarchyLedger> ledgers = new EnumMap<>(HierarchyKind.class);

    public HierarchyValidator(List<HierarchyLedger> ledgers) {
        for (HierarchyLedger ledger : ledgers) {
            HierarchyLedger previous = this.ledgers.put(ledger.kind(), ledger);
            if (previous != null) {
                throw new IllegalStateException("Duplicate hierarchy ledger for " + ledger.kind());
            }
        }
    }

    public void validateEdge(HierarchyKind kind, long childId, Long proposedParentId) {
        HierarchyNode child = requireNode(kind, childId);
        validateEdge(kind, child, proposedParentId);
    }

    /**
     * Checks that attaching {@code candidate} below {@code proposedParentId} keeps the tree valid. A
     * null parent detaches the node and is always accepted.
     */
    public void validateEdge(HierarchyKind kind, HierarchyNode candidate, Long proposedParentId) {
        Objects.requireNonNull(candidate, "candidate");
        if (proposedParentId == null) {
            return;
        }
        if (proposedParentId.equals(candidate.id())) {
            throw new HierarchyCycleException(kind.codePrefix() + " " + candidate.id() + " cannot be its own parent");
        }
        HierarchyNode parent = requireNode(kind, proposedParentId);
        if (!parent.sameTenantAs(candidate)) {
            throw new TenantMismatchException(kind.codePrefix() + " " + proposedParentId
                    + " belongs to company " + parent.companyId() + ", expected " + candidate.companyId());
        }
        int parentLinks = countLinksToRoot(kind, parent, candidate.id());
        if (kind.isDepthBounded()) {
            int subtreeHeight = candidate.id() == null ? 0 : subtreeHeight(kind, candidate.id());
            int resultingLinks = parentLinks + 1 + subtreeHeight;
            if (resultingLinks > kind.maxLinks()) {
                throw new HierarchyDepthExceededException(kind.codePrefix() + " chain would have " + resultingLinks
                        + " levels, at most " + kind.maxLinks() + " allowed");
            }
        }
    }

    /**
     * The node followed by its ancestors, ending at the root.
     */
    public List<HierarchyNode> ancestorPath(HierarchyKind kind, long nodeId) {
        HierarchyLedger ledger = ledger(kind);
        HierarchyNode current = requireNode(kind, nodeId);
        List<HierarchyNode> path = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        while (current != null) {
            if (!visited.add(current.id())) {
                log.error("Corrupted {} chain: node {} revisited while walking up from {}", kind, current.id(), nodeId);
                throw new HierarchyCycleException(kind.codePrefix() + " chain above " + nodeId + " loops");
            }
            path.add(current);
            current = current.isRoot() ? null : ledger.findNode(current.parentId()).orElse(null);
        }
        return Collections.unmodifiableList(path);
    }

    /**
     * Lazily walks every node below {@code nodeId} breadth-first. The returned iterable can be
     * iterated more than once.
     */
    public Iterable<Long> descendants(HierarchyKind kind, long nodeId) {
        return new DescendantIterable(ledger(kind), nodeId);
    }

    public void validateDeactivation(HierarchyKind kind, long nodeId) {
        if (ledger(kind).hasActiveChildren(nodeId)) {
            throw new ActiveDescendantsException(kind.codePrefix() + " " + nodeId + " still has active children");
        }
    }

    /**
     * Locks the child and the proposed parent in ascending id order. Edge changes on disjoint pairs
     * are not serialized by this alone; callers hold the company lock first.
     */
    public void lockEdge(HierarchyKind kind, Long childId, Long proposedParentId) {
        HierarchyLedger ledger = ledger(kind);
        List<Long> ids = new ArrayList<>(2);
        if (childId != null) {
            ids.add(childId);
        }
        if (proposedParentId != null && !proposedParentId.equals(childId)) {
            ids.add(proposedParentId);
        }
        Collections.sort(ids);
        for (Long id : ids) {
            ledger.lockNode(id).orElseThrow(() -> notFound(kind, id));
        }
    }

    private int countLinksToRoot(HierarchyKind kind, HierarchyNode start, Long candidateId) {
        HierarchyLedger ledger = ledger(kind);
        Set<Long> visited = new HashSet<>();
        visited.add(start.id());
        int links = 0;
        HierarchyNode current = start;
        while (!current.isRoot()) {
            Long nextId = current.parentId();
            if (nextId.equals(candidateId)) {
                throw new HierarchyCycleException(kind.codePrefix() + " " + candidateId
                        + " is an ancestor of " + start.id());
            }
            if (!visited.add(nextId)) {
                log.error("Corrupted {} chain: node {} revisited while walking up from {}", kind, nextId, start.id());
                throw new HierarchyCycleException(kind.codePrefix() + " chain above " + start.id() + " loops");
            }
            HierarchyNode next = ledger.findNode(nextId).orElse(null);
            if (next == null) {
                break;
            }
            links++;
            current = next;
        }
        return links;
    }

    private int subtreeHeight(HierarchyKind kind, long rootId) {
        HierarchyLedger ledger = ledger(kind);
        Set<Long> visited = new HashSet<>();
        visited.add(rootId);
        List<Long> level = List.of(rootId);
        int height = 0;
        while (true) {
            List<Long> next = new ArrayList<>();
            for (Long id : level) {
                for (Long childId : ledger.findChildIds(id)) {
                    if (visited.add(childId)) {
                        next.add(childId);
                    }
                }
            }
            if (next.isEmpty()) {
                return height;
            }
            height++;
            level = next;
        }
    }

    private HierarchyNode requireNode(HierarchyKind kind, long id) {
        return ledger(kind).findNode(id).orElseThrow(() -> notFound(kind, id));
    }

    private HierarchyLedger ledger(HierarchyKind kind) {
        HierarchyLedger ledger = ledgers.get(kind);
        if (ledger == null) {
            throw new IllegalStateException("No hierarchy ledger registered for " + kind);
        }
        return ledger;
    }

    private static ProblemException notFound(HierarchyKind kind, long id) {
        return new ProblemException(HttpStatus.NOT_FOUND, kind.codePrefix() + ".not_found",
                kind.codePrefix() + " " + id + " not found");
    }
}
