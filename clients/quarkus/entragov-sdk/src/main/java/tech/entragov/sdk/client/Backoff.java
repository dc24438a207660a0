package tech.entragov.sdk.client;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter: {@code min(max, base * 2^attempt) * uniform(0.5, 1.5)}.
 *
 * <p>Within one call the delays never shrink and never exceed {@code max}: each delay is
 * at least the previous one, so jitter spreads callers apart without reordering the wait
 * sequence of a single caller.
 */
public class Backoff {

    private final Duration base;
    private final Duration max;
    private final DoubleSupplier jitter;

    public Backoff(Duration base, Duration max) {
        this(base, max, () -> ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    }

    public Backoff(Duration base, Duration max, DoubleSupplier jitter) {
        this.base = base;
        this.max = max;
        this.jitter = jitter;
    }

    /**
     * @param attempt zero-based retry number within the current budget
     * @param previous the delay used before this one, {@link Duration#ZERO} for the first
     */
    public Duration delay(int attempt, Duration previous) {
        long maxMillis = max.toMillis();
        double exponential = base.toMillis() * Math.pow(2, Math.min(attempt, 30));
        double capped = Math.min(maxMillis, exponential);
        long jittered = Math.round(capped * jitter.getAsDouble());
        long millis = Math.max(jittered, previous.toMillis());
        return Duration.ofMillis(Math.min(millis, maxMillis));
    }
}
