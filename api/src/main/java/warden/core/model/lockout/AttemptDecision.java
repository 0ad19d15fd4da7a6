package warden.core.model.lockout;

import java.util.Optional;

/**
 * Whether an authentication attempt may proceed to credential verification.
 *
 * @param allowed true when credentials may be checked
 * @param reason user-facing explanation when not allowed
 * @param requiresCaptcha whether the attempt must pass a CAPTCHA first
 */
public record AttemptDecision(boolean allowed, Optional<String> reason, boolean requiresCaptcha) {

    public static AttemptDecision allow(boolean requiresCaptcha) {
        return new AttemptDecision(true, Optional.empty(), requiresCaptcha);
    }

    public static AttemptDecision deny(String reason) {
        return new AttemptDecision(false, Optional.of(reason), true);
    }
}
