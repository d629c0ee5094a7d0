package com.planprobe.execution;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Wall-clock duration of one query run, fixed once the run completes.
 */
public record Timing(Duration elapsed) {

    public Timing {
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static Timing ofNanos(long nanos) {
        return new Timing(Duration.ofNanos(nanos));
    }

    public double toMillis() {
        return elapsed.toNanos() / 1_000_000.0;
    }

    /**
     * Milliseconds with three decimals, e.g. {@code 12.345 ms}.
     *
     * @return formatted duration
     */
    public String format() {
        return String.format(Locale.ROOT, "%.3f ms", toMillis());
    }

    @Override
    public String toString() {
        return format();
    }
}
