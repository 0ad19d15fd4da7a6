package warden.adapter.out.notification;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.NotificationConfig;
import warden.core.model.notification.Notification;
import warden.core.port.out.Metrics;
import warden.core.port.out.NotificationDispatcher;
import warden.spi.NotificationChannel;

/**
 * Delivers notifications to registered channels on a background thread.
 *
 * <p>Channels are discovered via {@link ServiceLoader} and invoked in priority
 * order (highest priority first). Pending notifications wait in a bounded
 * queue; when it is full, new notifications are dropped and counted.
 *
 * <p>When notifications are disabled, everything is dropped without counting.
 */
@ApplicationScoped
public class AsyncNotificationDispatcher implements NotificationDispatcher {

    private static final Logger LOG = Logger.getLogger(AsyncNotificationDispatcher.class);

    private final boolean enabled;
    private final Metrics metrics;
    private final List<NotificationChannel> channels;
    private final ThreadPoolExecutor executor;

    @Inject
    public AsyncNotificationDispatcher(NotificationConfig config, Metrics metrics) {
        this(config.enabled(), config.queueCapacity(), metrics, loadChannels());
    }

    public AsyncNotificationDispatcher(
            boolean enabled, int queueCapacity, Metrics metrics, List<NotificationChannel> channels) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.enabled = enabled;
        this.metrics = metrics;
        this.channels = channels.stream()
                .filter(NotificationChannel::isAvailable)
                .sorted(Comparator.comparingInt(NotificationChannel::priority).reversed())
                .toList();
        this.executor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    var thread = new Thread(r, "security-notification-dispatcher");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());

        if (!enabled) {
            LOG.debug("Security notifications are disabled");
        } else if (this.channels.isEmpty()) {
            LOG.warn("No notification channels found - notifications will not be delivered");
        } else {
            LOG.infof(
                    "Loaded %d notification channel(s): %s",
                    this.channels.size(),
                    this.channels.stream()
                            .map(c -> c.name() + "(priority=" + c.priority() + ")")
                            .toList());
        }
    }

    private static List<NotificationChannel> loadChannels() {
        return ServiceLoader.load(NotificationChannel.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
    }

    @Override
    public boolean dispatch(Notification notification) {
        if (!enabled || channels.isEmpty() || notification == null) {
            return false;
        }

        try {
            executor.execute(() -> deliver(notification));
            return true;
        } catch (RejectedExecutionException e) {
            LOG.warnf(
                    "Notification queue full, dropping %s for %s", notification.kind(), notification.recipient());
            metrics.recordNotificationDropped(notification.kind().name());
            return false;
        }
    }

    private void deliver(Notification notification) {
        for (var channel : channels) {
            try {
                channel.deliver(notification);
            } catch (Exception e) {
                LOG.warnf(
                        "Channel %s failed to deliver %s: %s", channel.name(), notification.kind(), e.getMessage());
            }
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warnf("Dropping %d undelivered notification(s) on shutdown", executor.getQueue().size());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        channels.forEach(channel -> {
            try {
                channel.close();
            } catch (Exception e) {
                LOG.warnf("Error closing channel %s: %s", channel.name(), e.getMessage());
            }
        });
    }

    /**
     * Channels receiving notifications, in delivery order.
     */
    public List<NotificationChannel> getChannels() {
        return channels;
    }

    int pending() {
        return executor.getQueue().size();
    }
}
