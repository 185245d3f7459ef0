package com.phillippitts.spoofstream.service.detection.watchdog;

import com.phillippitts.spoofstream.config.properties.ClassifierWatchdogProperties;
import com.phillippitts.spoofstream.service.detection.AudioClassifier;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event-driven watchdog that restarts the classifier after failures, within a bounded budget.
 *
 * Detection model:
 * - The detection path publishes {@link ClassifierFailureEvent} when a classifier call fails.
 * - Restart attempts are tracked in a sliding time window; each attempt is close + initialize.
 * - On exceeding the budget the classifier is marked DISABLED until the cooldown elapses.
 *
 * A failed startup initialization leaves the classifier DISABLED instead of failing boot,
 * so the server still accepts connections and answers with {@code error} messages; the
 * periodic probe keeps trying to bring it up.
 */
@Component
@ConditionalOnProperty(prefix = "classifier.watchdog", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ClassifierWatchdog {

    private static final Logger LOG = LogManager.getLogger(ClassifierWatchdog.class);

    public enum ClassifierState { HEALTHY, DEGRADED, DISABLED }

    private final AudioClassifier classifier;
    private final ClassifierWatchdogProperties props;
    private final ApplicationEventPublisher publisher;

    private final Deque<Instant> restartWindow = new ArrayDeque<>();
    private final ReentrantLock restartLock = new ReentrantLock();
    private volatile ClassifierState state = ClassifierState.HEALTHY;
    private volatile Instant disabledUntil;

    public ClassifierWatchdog(AudioClassifier classifier,
                              ClassifierWatchdogProperties props,
                              ApplicationEventPublisher publisher) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        LOG.info("Watchdog initialized for classifier={}", classifier.getName());
    }

    @PostConstruct
    public void initializeClassifier() {
        LOG.info("Initializing classifier {} at startup...", classifier.getName());
        try {
            classifier.initialize();
            LOG.info("Classifier {} initialized successfully", classifier.getName());
        } catch (Exception ex) {
            LOG.error("Failed to initialize classifier {} at startup: {}", classifier.getName(), ex.toString());
            state = ClassifierState.DISABLED;
        }
    }

    public ClassifierState getState() {
        return state;
    }

    /**
     * Checks whether the classifier may be used: not DISABLED and not in cooldown.
     */
    public boolean isClassifierEnabled() {
        if (state == ClassifierState.DISABLED) {
            Instant until = disabledUntil;
            return until != null && Instant.now().isAfter(until);
        }
        return true;
    }

    @EventListener
    public void onFailure(ClassifierFailureEvent event) {
        if (!classifier.getName().equals(event.classifier())) {
            LOG.warn("ClassifierFailureEvent for unknown classifier: {}", event.classifier());
            return;
        }
        LOG.warn("Classifier failure: classifier={}, msg={}", event.classifier(), event.message());
        if (isDisabledByCooldown()) {
            LOG.warn("Classifier {} currently disabled until {}", event.classifier(), disabledUntil);
            return;
        }
        state = ClassifierState.DEGRADED;
        attemptRestart();
    }

    @EventListener
    public void onRecovered(ClassifierRecoveredEvent event) {
        if (!classifier.getName().equals(event.classifier())) {
            return;
        }
        restartLock.lock();
        try {
            state = ClassifierState.HEALTHY;
            restartWindow.clear();
            disabledUntil = null;
        } finally {
            restartLock.unlock();
        }
        LOG.info("Classifier recovered: {}", event.classifier());
    }

    /**
     * Logs the current state and retries a classifier that is not ready (for example one
     * whose inference server was down at startup), unless a cooldown is in effect.
     */
    @Scheduled(fixedRateString = "${classifier.watchdog.probe-interval-ms:60000}")
    void probe() {
        boolean ready = classifier.isReady();
        LOG.info("Watchdog state: {}={} ready={}", classifier.getName(), state, ready);
        if (!ready && !isDisabledByCooldown()) {
            attemptRestart();
        }
    }

    private void attemptRestart() {
        if (!restartLock.tryLock()) {
            LOG.debug("Restart already in progress for {}", classifier.getName());
            return;
        }
        boolean restarted = false;
        try {
            if (isDisabledByCooldown()) {
                return;
            }
            pruneOld();
            if (restartWindow.size() >= props.getMaxRestartsPerWindow()) {
                disable();
                return;
            }
            restartWindow.addLast(Instant.now());
            restarted = tryRestart();
            if (!restarted) {
                state = ClassifierState.DEGRADED;
                LOG.warn("Classifier {} restart failed; remaining in DEGRADED state", classifier.getName());
            }
        } finally {
            restartLock.unlock();
        }
        if (restarted) {
            LOG.info("Classifier {} restarted successfully", classifier.getName());
            publisher.publishEvent(new ClassifierRecoveredEvent(classifier.getName(), Instant.now()));
        }
    }

    private boolean isDisabledByCooldown() {
        Instant until = disabledUntil;
        return until != null && Instant.now().isBefore(until);
    }

    private void disable() {
        state = ClassifierState.DISABLED;
        Instant until = Instant.now().plus(Duration.ofMinutes(props.getCooldownMinutes()));
        disabledUntil = until;
        LOG.error("Classifier {} disabled after {} restarts within {}m; cooldown until {}",
                classifier.getName(), restartWindow.size(), props.getWindowMinutes(), until);
    }

    private boolean tryRestart() {
        LOG.warn("Restarting classifier {}", classifier.getName());
        try {
            classifier.close();
        } catch (Exception ex) {
            LOG.debug("Error during classifier.close(): {}", ex.toString());
        }
        try {
            classifier.initialize();
            return true;
        } catch (Exception ex) {
            LOG.error("Classifier {} failed to initialize after restart: {}", classifier.getName(), ex.toString());
            return false;
        }
    }

    private void pruneOld() {
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(props.getWindowMinutes()));
        while (!restartWindow.isEmpty() && restartWindow.peekFirst().isBefore(cutoff)) {
            restartWindow.removeFirst();
        }
    }
}
