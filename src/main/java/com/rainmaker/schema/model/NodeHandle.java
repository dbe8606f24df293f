package com.rainmaker.schema.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Stable identity of a schema node.
 *
 * Handles are allocated once per node at construction time and never reused,
 * so visited sets and metadata tables keyed by handle do not depend on the
 * equality semantics of the node classes.
 */
public record NodeHandle(long value) {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    static NodeHandle next() {
        return new NodeHandle(SEQUENCE.incrementAndGet());
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
