package relay.adapter.out.time;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock that never moves backwards.
 *
 * <p>Wraps another clock and returns the latest instant seen so far, so TTL
 * arithmetic is unaffected by wall-clock corrections.
 */
public final class MonotonicClock extends Clock {

    private final Clock delegate;
    private final AtomicReference<Instant> last;

    public MonotonicClock(Clock delegate) {
        this(delegate, new AtomicReference<>(Instant.MIN));
    }

    private MonotonicClock(Clock delegate, AtomicReference<Instant> last) {
        this.delegate = delegate;
        this.last = last;
    }

    @Override
    public ZoneId getZone() {
        return delegate.getZone();
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MonotonicClock(delegate.withZone(zone), last);
    }

    @Override
    public Instant instant() {
        final var candidate = delegate.instant();
        return last.accumulateAndGet(candidate, (previous, next) -> next.isAfter(previous) ? next : previous);
    }
}
