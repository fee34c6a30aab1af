package com.orgscope.backend.modules.hierarchy.application;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

import com.orgscope.backend.modules.hierarchy.domain.HierarchyLedger;

/**
 * Breadth-first walk over the ids below a root, excluding the root itself. Children are fetched one
 * level at a time as the iterator advances, and every call to {@link #iterator()} starts over.
 */
final class DescendantIterable implements Iterable<Long> {

    private final HierarchyLedger ledger;
    private final long rootId;

    DescendantIterable(HierarchyLedger ledger, long rootId) {
        this.ledger = ledger;
        this.rootId = rootId;
    }

    @Override
    public Iterator<Long> iterator() {
        return new BreadthFirstIterator();
    }

    private final class BreadthFirstIterator implements Iterator<Long> {

        private final Deque<Long> pending = new ArrayDeque<>();
        private final Set<Long> visited = new HashSet<>();

        private BreadthFirstIterator() {
            visited.add(rootId);
            enqueueChildren(rootId);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public Long next() {
            Long next = pending.poll();
            if (next == null) {
                throw new NoSuchElementException();
            }
            enqueueChildren(next);
            return next;
        }

        private void enqueueChildren(long parentId) {
            for (Long childId : ledger.findChildIds(parentId)) {
                // a looping chain must not make the walk infinite
                if (visited.add(childId)) {
                    pending.add(childId);
                }
            }
        }
    }
}
