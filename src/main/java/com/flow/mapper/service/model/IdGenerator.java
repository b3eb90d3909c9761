package com.flow.mapper.service.model;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of node and edge ids for synthesized graph elements.
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();

    static IdGenerator uuid() {
        return () -> UUID.randomUUID().toString();
    }

    /**
     * Predictable ids ({@code prefix-1}, {@code prefix-2}, ...), for tests and replay.
     */
    static IdGenerator sequential(String prefix) {
        var counter = new AtomicLong();
        return () -> prefix + "-" + counter.incrementAndGet();
    }
}
