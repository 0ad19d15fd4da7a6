package warden.core.service.security;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.configuration.ConfigurationException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.AnomalyConfig;
import warden.core.model.auth.LoginContext;
import warden.core.model.security.AutoResponse;
import warden.core.model.security.SecurityEvent;
import warden.core.model.security.SecurityEventType;
import warden.core.model.security.Severity;
import warden.core.port.out.AuditLogReader;
import warden.core.service.security.detector.AccountCompromiseDetector;
import warden.core.service.security.detector.DataExfiltrationDetector;
import warden.core.service.security.detector.MassDataAccessDetector;
import warden.core.service.security.detector.SecondFactorFailureDetector;
import warden.core.service.security.detector.UnusualLoginPatternDetector;
import warden.core.service.security.detector.UnusualTimeDetector;

/**
 * Runs the anomaly and breach-pattern detectors for each kind of signal and
 * hands what they find to the {@link SecurityResponseExecutor}.
 *
 * <p>Detectors never fail the caller: an audit log that cannot be read yields
 * no event.
 */
@ApplicationScoped
public class AnomalyDetector {

    private static final Logger LOG = Logger.getLogger(AnomalyDetector.class);

    private final SecurityResponseExecutor executor;
    private final Clock clock;
    private final UnusualTimeDetector unusualTime;
    private final SecondFactorFailureDetector secondFactorFailures;
    private final UnusualLoginPatternDetector loginPatterns;
    private final MassDataAccessDetector massDataAccess;
    private final AccountCompromiseDetector accountCompromise;
    private final DataExfiltrationDetector dataExfiltration;

    @Inject
    public AnomalyDetector(AnomalyConfig config, AuditLogReader auditLog, SecurityResponseExecutor executor) {
        this(config, auditLog, executor, Clock.systemUTC());
    }

    public AnomalyDetector(
            AnomalyConfig config, AuditLogReader auditLog, SecurityResponseExecutor executor, Clock clock) {
        validate(config);
        this.executor = executor;
        this.clock = clock;
        this.unusualTime =
                new UnusualTimeDetector(config.zone(), config.unusualHoursStart(), config.unusualHoursEnd());
        this.secondFactorFailures = new SecondFactorFailureDetector(config.secondFactorFailureThreshold());
        this.loginPatterns = new UnusualLoginPatternDetector(
                auditLog,
                config.failedLoginThreshold(),
                config.failedLoginWindow(),
                config.loginOriginThreshold(),
                config.loginOriginWindow());
        this.massDataAccess = new MassDataAccessDetector(auditLog);
        this.accountCompromise = new AccountCompromiseDetector(
                auditLog,
                config.secondFactorDisabledWindow(),
                config.passwordChangeWindow(),
                config.postPasswordChangeViews(),
                config.postPasswordChangeWindow());
        this.dataExfiltration =
                new DataExfiltrationDetector(auditLog, config.exportThreshold(), config.exportWindow());
    }

    void onStart(@Observes StartupEvent event) {
        LOG.info("Anomaly detection ready");
    }

    /**
     * Run the off-hours and origin-spread rules for a successful login.
     */
    public Uni<List<SecurityEvent>> onLoginSucceeded(LoginContext context) {
        final var userId = requireUser(context.userId());
        final var offHours = unusualTime.detect(userId, context.timestamp(), context.networkOrigin());
        return loginPatterns
                .detectOriginSpread(userId, context.networkOrigin(), context.timestamp())
                .map(spread -> respond(offHours, spread));
    }

    /**
     * Run the failed-login burst rule for the origin of a failed login.
     */
    public Uni<List<SecurityEvent>> onLoginFailed(LoginContext context) {
        final var subject = context.userId() != null ? context.userId() : context.identity();
        return loginPatterns
                .detectFailedLoginBurst(subject, context.networkOrigin(), context.timestamp())
                .map(this::respond);
    }

    public List<SecurityEvent> onSecondFactorFailures(String userId, int failureCount) {
        return respond(secondFactorFailures.detect(requireUser(userId), failureCount, clock.instant()));
    }

    /**
     * Run the mass-access and account-compromise rules after a sensitive
     * record was viewed.
     *
     * @param userId the viewing user
     * @param resourceType the type of record viewed
     * @param window how far back to count views
     * @param threshold views within the window that trigger an alert
     */
    public Uni<List<SecurityEvent>> onSensitiveRecordAccess(
            String userId, String resourceType, Duration window, int threshold) {
        final var user = requireUser(userId);
        final var now = clock.instant();
        return massDataAccess
                .detect(user, resourceType, window, threshold, now)
                .flatMap(mass -> accountCompromise.detect(user, now).map(compromise -> respond(mass, compromise)));
    }

    public Uni<List<SecurityEvent>> onBulkExport(String userId) {
        return dataExfiltration.detect(requireUser(userId), clock.instant()).map(this::respond);
    }

    /**
     * Report a session that appears to be used by someone other than its owner.
     *
     * @param userId the session owner
     * @param evidence what led to the suspicion
     * @return the recorded event
     */
    public SecurityEvent reportSuspectedHijack(String userId, Map<String, Object> evidence) {
        final var builder = SecurityEvent.builder(
                        SecurityEventType.SUSPECTED_HIJACK, Severity.CRITICAL, AutoResponse.FORCE_LOGOUT)
                .userId(requireUser(userId))
                .timestamp(clock.instant());
        if (evidence != null) {
            evidence.forEach(builder::with);
        }
        final var event = builder.build();
        executor.execute(event);
        return event;
    }

    @SafeVarargs
    private List<SecurityEvent> respond(Optional<SecurityEvent>... detections) {
        final var events = new ArrayList<SecurityEvent>();
        for (var detection : detections) {
            detection.ifPresent(events::add);
        }
        executor.executeAll(events);
        return List.copyOf(events);
    }

    private static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be blank");
        }
        return userId;
    }

    static void validate(AnomalyConfig config) {
        requirePositive("second-factor-failure-threshold", config.secondFactorFailureThreshold());
        requirePositive("failed-login-threshold", config.failedLoginThreshold());
        requirePositive("login-origin-threshold", config.loginOriginThreshold());
        requirePositive("post-password-change-views", config.postPasswordChangeViews());
        requirePositive("export-threshold", config.exportThreshold());
        requirePositive("history.max-events-per-user", config.history().maxEventsPerUser());
        requirePositive("failed-login-window", config.failedLoginWindow());
        requirePositive("login-origin-window", config.loginOriginWindow());
        requirePositive("second-factor-disabled-window", config.secondFactorDisabledWindow());
        requirePositive("password-change-window", config.passwordChangeWindow());
        requirePositive("post-password-change-window", config.postPasswordChangeWindow());
        requirePositive("export-window", config.exportWindow());
        requirePositive("history.retention", config.history().retention());
        if (!isHour(config.unusualHoursStart()) || !isHour(config.unusualHoursEnd())) {
            throw new ConfigurationException("warden.anomaly unusual hours must be between 0 and 23");
        }
    }

    private static boolean isHour(int hour) {
        return hour >= 0 && hour <= 23;
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new ConfigurationException("warden.anomaly." + key + " must be positive");
        }
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ConfigurationException("warden.anomaly." + key + " must be positive");
        }
    }
}
