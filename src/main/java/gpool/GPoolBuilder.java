package gpool;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public class GPoolBuilder {

    private static final long DEFAULT_IDLE_TIMEOUT_SECONDS = 10;
    private static final String DEFAULT_THREAD_NAME_PREFIX = "gpool-worker";

    private long idleTimeoutNanos = TimeUnit.SECONDS.toNanos(DEFAULT_IDLE_TIMEOUT_SECONDS);
    private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
    private boolean daemon = true;

    GPoolBuilder() {
    }

    public GPoolBuilder idleTimeout(long idleTimeout, TimeUnit unit) {
        checkArgument(idleTimeout > 0, "idleTimeout: %s (expected: > 0)", idleTimeout);
        this.idleTimeoutNanos = requireNonNull(unit, "unit").toNanos(idleTimeout);
        return this;
    }

    public GPoolBuilder idleTimeout(Duration idleTimeout) {
        requireNonNull(idleTimeout, "idleTimeout");
        checkArgument(!idleTimeout.isZero() &&
                        !idleTimeout.isNegative(),
                "idleTimeout: %s (expected: > 0)", idleTimeout);
        return idleTimeout(idleTimeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public GPoolBuilder threadNamePrefix(String threadNamePrefix) {
        requireNonNull(threadNamePrefix, "threadNamePrefix");
        checkArgument(!threadNamePrefix.isEmpty(), "threadNamePrefix: <empty> (expected: non-empty)");
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }

    /**
     * Sets whether workers are daemon threads. {@code true} by default.
     */
    public GPoolBuilder daemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    public GPool build() {
        return new GPool(idleTimeoutNanos, threadNamePrefix, daemon);
    }
}
