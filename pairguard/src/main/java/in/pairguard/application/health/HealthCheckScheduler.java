package in.pairguard.application.health;

import in.pairguard.application.port.output.WatchedConnection;
import in.pairguard.config.SupervisorConfig;
import in.pairguard.domain.health.HealthStatus;
import in.pairguard.domain.health.PairingAction;
import in.pairguard.domain.health.PairingDecision;
import in.pairguard.domain.health.PairingState;
import in.pairguard.domain.health.PairingStateMachine;
import in.pairguard.domain.health.SupervisorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic health supervisor for the watched connection.
 *
 * Features:
 * - Restores pairing bookkeeping from the state store on start
 * - Counts consecutive unhealthy checks and triggers recovery at the threshold
 * - Skips checks while waiting for the operator to pair or while cooling down
 * - Never runs two checks (or a check and a recovery) at the same time
 * - Administrative entry points that share the same guard as the periodic check
 *
 * Usage:
 * <pre>
 * HealthCheckScheduler supervisor = new HealthCheckScheduler(
 *     config, connection, stateRepository, orchestrator, events, Clock.systemUTC());
 *
 * supervisor.start();
 * HealthStatus status = supervisor.getStatus();
 * supervisor.close();
 * </pre>
 */
public class HealthCheckScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckScheduler.class);

    private final SupervisorConfig config;
    private final WatchedConnection connection;
    private final SupervisorStateRepository stateRepository;
    private final RecoveryOrchestrator orchestrator;
    private final SupervisorEvents events;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private final ReentrantLock checkLock = new ReentrantLock();

    private volatile SupervisorState state = SupervisorState.initial();
    private volatile boolean lastLive = false;
    private volatile boolean stateLoaded = false;
    private volatile boolean running = false;
    private volatile ScheduledFuture<?> checkTask;

    public HealthCheckScheduler(SupervisorConfig config,
                                WatchedConnection connection,
                                SupervisorStateRepository stateRepository,
                                RecoveryOrchestrator orchestrator,
                                SupervisorEvents events,
                                Clock clock) {
        this.config = config;
        this.connection = connection;
        this.stateRepository = stateRepository;
        this.orchestrator = orchestrator;
        this.events = events;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "HealthCheck-scheduler");
            t.setDaemon(true);
            return t;
        });

        log.info("[HealthCheck] Initialized (enabled={}, interval={}s, threshold={}, cooldown={}, maxPairingWait={}, target={})",
            config.enabled(), config.checkInterval().toSeconds(), config.failureThreshold(),
            PairingCodeFormatter.describeWindow(config.cooldown()),
            PairingCodeFormatter.describeWindow(config.maxPairingWait()),
            PairingCodeFormatter.maskTarget(config.notifyTarget()));
    }

    /**
     * Register a listener for supervisor signals.
     */
    public void addListener(SupervisorListener listener) {
        events.addListener(listener);
    }

    /**
     * Load persisted state and schedule periodic checks.
     * No-op when disabled or already running.
     */
    public synchronized void start() {
        if (!config.enabled()) {
            log.info("[HealthCheck] Health monitor is disabled");
            return;
        }
        if (running) {
            log.warn("[HealthCheck] Health monitor is already running");
            return;
        }

        try {
            checkLock.lock();
            try {
                loadState();
            } finally {
                checkLock.unlock();
            }

            checkTask = scheduler.scheduleAtFixedRate(this::scheduledCheck,
                config.initialDelay().toMillis(), config.checkInterval().toMillis(), TimeUnit.MILLISECONDS);
            running = true;

            log.info("[HealthCheck] Health monitor started (first check in {}ms, then every {}s)",
                config.initialDelay().toMillis(), config.checkInterval().toSeconds());
        } catch (Exception e) {
            log.error("[HealthCheck] Failed to start health monitor", e);
            events.onError(e);
        }
    }

    /**
     * Cancel future checks. A check already in progress runs to completion.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        if (checkTask != null) {
            checkTask.cancel(false);
            checkTask = null;
        }
        log.info("[HealthCheck] Health monitor stopped");
    }

    /**
     * Stop and release the scheduler thread, waiting briefly for an in-flight check.
     */
    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run one check now, waiting for any check in progress to finish first.
     *
     * @return status after the check
     */
    public HealthStatus forceCheck() {
        checkLock.lock();
        try {
            ensureStateLoaded();
            return runCheck();
        } catch (Exception e) {
            log.error("[HealthCheck] Forced health check failed", e);
            events.onError(e);
            return getStatus();
        } finally {
            checkLock.unlock();
        }
    }

    /**
     * Clear pairing bookkeeping and run a recovery attempt regardless of the threshold.
     *
     * @return outcome of the attempt, or null if it could not be started
     */
    public RecoveryResult forcePairing() {
        checkLock.lock();
        try {
            ensureStateLoaded();
            log.info("[HealthCheck] Force pairing requested, resetting state");

            adopt(state.withPairingState(PairingState.IDLE).withLastPairingRequestTime(null));
            return startRecovery();
        } catch (Exception e) {
            log.error("[HealthCheck] Forced pairing failed", e);
            events.onError(e);
            return null;
        } finally {
            checkLock.unlock();
        }
    }

    /**
     * Reset all counters and pairing state without running recovery.
     */
    public HealthStatus reset() {
        checkLock.lock();
        try {
            ensureStateLoaded();
            log.info("[HealthCheck] Resetting health monitor state");

            SupervisorState current = state;
            adopt(SupervisorState.initial()
                .withLastCheckTime(current.lastCheckTime())
                .withLastHealthyTime(current.lastHealthyTime()));
        } catch (Exception e) {
            log.error("[HealthCheck] Reset failed", e);
            events.onError(e);
        } finally {
            checkLock.unlock();
        }
        return getStatus();
    }

    /**
     * Snapshot of the last settled state. Never reads the connection or writes state.
     */
    public HealthStatus getStatus() {
        SupervisorState current = state;
        return new HealthStatus(
            lastLive,
            current.consecutiveFailures(),
            current.lastCheckTime(),
            current.lastHealthyTime(),
            current.pairingState(),
            current.lastPairingRequestTime(),
            PairingStateMachine.cooldownRemaining(current, clock.instant(), config).toMillis()
        );
    }

    /**
     * Entry point of the periodic task. Skips when another check holds the guard.
     */
    private void scheduledCheck() {
        if (!checkLock.tryLock()) {
            log.debug("[HealthCheck] Previous check still in progress, skipping this tick");
            return;
        }
        try {
            runCheck();
        } catch (Exception e) {
            // Escaping exceptions would cancel the periodic task
            log.error("[HealthCheck] Health check failed", e);
            events.onError(e);
        } finally {
            checkLock.unlock();
        }
    }

    /**
     * One check: liveness, decision, persistence, follow-up. Caller holds the guard.
     */
    private HealthStatus runCheck() {
        Instant now = clock.instant();
        boolean live = readLiveness();
        lastLive = live;

        SupervisorState previous = state;
        PairingDecision decision = PairingStateMachine.decide(previous, live, now, config);
        adopt(decision.nextState());

        SupervisorState next = decision.nextState();
        switch (decision.action()) {
            case SKIP:
                log.debug("[HealthCheck] Connection unhealthy, skipped ({}), pairingState={}, requestedAt={}",
                    decision.skipReason().code(), next.pairingState().code(), next.lastPairingRequestTime());
                events.onPairingSkipped(decision.skipReason());
                break;

            case TRIGGER_RECOVERY:
                log.warn("[HealthCheck] Connection unhealthy ({}/{} consecutive failures), triggering recovery",
                    next.consecutiveFailures(), config.failureThreshold());
                events.onUnhealthy(next.consecutiveFailures());
                RecoveryResult result = orchestrator.recover(next);
                state = result.state();
                break;

            case NONE:
            default:
                reportSettled(previous, next, live);
                break;
        }

        HealthStatus status = getStatus();
        events.onHealthCheck(status);
        return status;
    }

    private void reportSettled(SupervisorState previous, SupervisorState next, boolean live) {
        if (live) {
            if (previous.consecutiveFailures() > 0 || previous.pairingState() != PairingState.IDLE) {
                log.info("[HealthCheck] Connection recovered (previousFailures={}, previousPairingState={})",
                    previous.consecutiveFailures(), previous.pairingState().code());
            }
            events.onHealthy();
            return;
        }

        if (previous.pairingState() == PairingState.PAIRING_REQUESTED) {
            log.warn("[HealthCheck] Pairing wait of {} exceeded, resetting state to allow retry",
                PairingCodeFormatter.describeWindow(config.maxPairingWait()));
        } else if (previous.pairingState() == PairingState.COOLDOWN) {
            log.info("[HealthCheck] Cooldown period expired, state now idle");
        } else {
            log.warn("[HealthCheck] Connection unhealthy ({}/{} consecutive failures)",
                next.consecutiveFailures(), config.failureThreshold());
            events.onUnhealthy(next.consecutiveFailures());
        }
    }

    /**
     * Start a recovery from idle. Caller holds the guard.
     */
    private RecoveryResult startRecovery() {
        if (state.pairingState() != PairingState.IDLE) {
            log.warn("[HealthCheck] Recovery requested but not idle ({}), skipping", state.pairingState().code());
            return null;
        }

        adopt(state.enter(PairingState.PAIRING_REQUESTED, clock.instant()));
        RecoveryResult result = orchestrator.recover(state);
        state = result.state();
        return result;
    }

    private boolean readLiveness() {
        try {
            return connection.isReady();
        } catch (Exception e) {
            log.warn("[HealthCheck] Liveness read failed, treating as unhealthy: {}", e.getMessage());
            return false;
        }
    }

    private void adopt(SupervisorState next) {
        state = next;
        stateRepository.save(next);
    }

    private void loadState() {
        SupervisorState loaded = stateRepository.load();
        state = loaded
            .withLastCheckTime(state.lastCheckTime())
            .withLastHealthyTime(state.lastHealthyTime());
        stateLoaded = true;
    }

    private void ensureStateLoaded() {
        if (!stateLoaded) {
            loadState();
        }
    }
}
