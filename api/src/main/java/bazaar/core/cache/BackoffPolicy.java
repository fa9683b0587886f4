package bazaar.core.cache;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with multiplicative jitter.
 *
 * <p>The n-th consecutive failure waits {@code min(base * 2^(n-1), max)}, scaled by
 * a random factor in {@code [1 - jitter, 1 + jitter]}.
 */
public class BackoffPolicy {

    private final Duration base;
    private final Duration max;
    private final double jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, Duration max, double jitter) {
        this(base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param base   delay after the first failure, positive
     * @param max    cap before jitter, at least {@code base}
     * @param jitter spread as a fraction (0.0 to 0.5)
     * @param random source of values in {@code [0, 1)}
     */
    public BackoffPolicy(Duration base, Duration max, double jitter, DoubleSupplier random) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("Base backoff must be positive, got: " + base);
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("Max backoff " + max + " is shorter than base " + base);
        }
        if (jitter < 0.0 || jitter > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitter);
        }
        this.base = base;
        this.max = max;
        this.jitter = jitter;
        this.random = random;
    }

    /**
     * Delay before the next attempt.
     *
     * @param consecutiveFailures failures so far, at least 1
     * @return jittered delay
     */
    public Duration delayFor(int consecutiveFailures) {
        final int exponent = Math.max(0, Math.min(consecutiveFailures - 1, 30));
        final long capped = Math.min(base.toMillis() * (1L << exponent), max.toMillis());
        final double factor = 1.0 - jitter + random.getAsDouble() * 2 * jitter;
        return Duration.ofMillis(Math.round(capped * factor));
    }

    public Duration base() {
        return base;
    }

    public Duration max() {
        return max;
    }

    public double jitter() {
        return jitter;
    }
}
