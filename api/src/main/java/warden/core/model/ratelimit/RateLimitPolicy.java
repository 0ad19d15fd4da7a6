package warden.core.model.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * A request budget over a sliding window.
 *
 * @param requests maximum requests allowed in any window-length interval
 * @param window the window length
 */
public record RateLimitPolicy(int requests, Duration window) {

    public RateLimitPolicy {
        Objects.requireNonNull(window, "window cannot be null");
        if (requests <= 0) {
            throw new IllegalArgumentException("requests must be positive: " + requests);
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }

    public static RateLimitPolicy of(int requests, Duration window) {
        return new RateLimitPolicy(requests, window);
    }

    public long windowMillis() {
        return window.toMillis();
    }

    /**
     * Window length in whole seconds, rounded up.
     */
    public long windowSeconds() {
        return (window.toMillis() + 999) / 1000;
    }
}
