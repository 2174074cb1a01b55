package org.promoharvest.test.utils;

import org.promoharvest.pipeline.utils.resilience.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock that only moves when told to. {@link #sleeper()} advances it instead of blocking and records each pause.
 */
public final class ManualClock extends Clock {

    private final AtomicLong millis;
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();

    public ManualClock() {
        this(Instant.parse("2024-03-01T12:00:00Z"));
    }

    public ManualClock(Instant start) {
        this.millis = new AtomicLong(start.toEpochMilli());
    }

    public void advance(Duration duration) {
        millis.addAndGet(duration.toMillis());
    }

    public void advanceMillis(long ms) {
        millis.addAndGet(ms);
    }

    public Sleeper sleeper() {
        return ms -> {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("sleep interrupted");
            }
            sleeps.add(ms);
            millis.addAndGet(ms);
        };
    }

    public List<Long> sleeps() {
        return List.copyOf(sleeps);
    }

    public long totalSlept() {
        return sleeps.stream().mapToLong(Long::longValue).sum();
    }

    @Override
    public long millis() {
        return millis.get();
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis.get());
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
