package warden.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for brute-force account lockout.
 *
 * <p>Configuration prefix: {@code warden.lockout}
 */
@ConfigMapping(prefix = "warden.lockout")
public interface LockoutConfig {

    /**
     * Failures within {@link #attemptWindow()} that lock the account.
     *
     * @return maximum failed attempts (default: 5)
     */
    @WithDefault("5")
    int maxFailedAttempts();

    /**
     * Rolling window over which failures are counted.
     *
     * @return the attempt window (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration attemptWindow();

    /**
     * How long an account stays locked.
     *
     * @return the lockout duration (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration lockoutDuration();

    /**
     * Failures after which a CAPTCHA is required. Must not exceed
     * {@link #maxFailedAttempts()}.
     *
     * @return the CAPTCHA threshold (default: 3)
     */
    @WithDefault("3")
    int captchaThreshold();
}
