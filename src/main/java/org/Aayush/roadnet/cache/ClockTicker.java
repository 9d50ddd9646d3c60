package org.Aayush.roadnet.cache;

import com.google.common.base.Ticker;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Guava {@link Ticker} reading nanoseconds from a {@link Clock}, so cache expiry follows
 * whatever clock the engine was built with.
 */
public final class ClockTicker extends Ticker {
    private final Clock clock;

    public ClockTicker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public long read() {
        Instant now = clock.instant();
        return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
    }
}
