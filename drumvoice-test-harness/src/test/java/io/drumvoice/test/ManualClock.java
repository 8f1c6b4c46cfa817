package io.drumvoice.test;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/** Millisecond clock advanced by hand. Thread-safe. */
final class ManualClock implements LongSupplier {

    private final AtomicLong nowMs;

    ManualClock(long startMs) {
        this.nowMs = new AtomicLong(startMs);
    }

    ManualClock() {
        this(0L);
    }

    @Override
    public long getAsLong() { return nowMs.get(); }

    void advance(long deltaMs) { nowMs.addAndGet(deltaMs); }

    void set(long ms) { nowMs.set(ms); }
}
