package io.surfworks.templar.expand;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-unique identifier of a call site.
 *
 * <p>Used to derive a naming seed for call sites that carry no node name. Ids
 * from {@link #next()} are never reused within a process.
 */
public record CallSiteId(long value) {

    private static final AtomicLong COUNTER = new AtomicLong();

    public static CallSiteId next() {
        return new CallSiteId(COUNTER.incrementAndGet());
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
