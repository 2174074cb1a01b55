package org.promoharvest.pipeline.services;

import com.typesafe.config.Config;
import org.promoharvest.pipeline.api.resources.IMonitorable;
import org.promoharvest.pipeline.api.resources.IResource;
import org.promoharvest.pipeline.api.resources.OperationalError;
import org.promoharvest.pipeline.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for pipeline services. Runs {@link #run()} on a dedicated thread and manages the lifecycle.
 * <p>
 * Stopping is two-phase. {@link #stop()} first raises a stop request that {@link #run()} polls through
 * {@link #isStopRequested()}, and waits up to {@code shutdownGraceSeconds} (default 30) for the loop to
 * wind down on its own. Only then is the thread interrupted. This lets an in-flight fetch finish or time
 * out normally before buffered work is flushed.
 * <p>
 * <strong>Error handling for services:</strong>
 * <ul>
 *   <li>Per-item problems: {@code log.warn(...)} without the exception, plus
 *       {@link #recordError(String, String, String)}; keep running.</li>
 *   <li>Fatal problems: throw out of {@link #run()}; the service ends in {@link State#ERROR}.</li>
 *   <li>Interruption: log at DEBUG and let the loop exit.</li>
 * </ul>
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    protected final Map<String, List<IResource>> resources;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final Object pauseLock = new Object();
    private final long shutdownGraceMs;
    private volatile boolean stopRequested;
    private Thread serviceThread;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    protected int getMaxErrors() {
        return 1000;
    }

    /**
     * @param name      the service name
     * @param options   the service {@code options} block
     * @param resources resources keyed by port name
     */
    protected AbstractService(String name, Config options, Map<String, List<IResource>> resources) {
        this.serviceName = name;
        this.options = options;
        this.resources = resources;
        this.shutdownGraceMs = TimeUnit.SECONDS.toMillis(
            options.hasPath("shutdownGraceSeconds") ? options.getLong("shutdownGraceSeconds") : 30);
        if (shutdownGraceMs < 0) {
            throw new IllegalArgumentException("shutdownGraceSeconds must be >= 0");
        }
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        stopRequested = false;
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.start();
        logStarted();
    }

    protected void logStarted() {
        log.info("{} started", serviceName);
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s", serviceName, state));
        }
        requestStop();
        if (state == State.PAUSED) {
            synchronized (pauseLock) {
                pauseLock.notifyAll();
            }
        }
        if (serviceThread == null) {
            return;
        }
        try {
            serviceThread.join(shutdownGraceMs);
            if (serviceThread.isAlive()) {
                log.debug("{} still busy after {} ms grace, interrupting", serviceName, shutdownGraceMs);
                serviceThread.interrupt();
                serviceThread.join(5000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for service thread to stop", serviceName);
        }
        if (serviceThread.isAlive()) {
            log.error("{} thread did not stop in time, forcing ERROR state", serviceName);
            currentState.set(State.ERROR);
            return;
        }
        log.debug("{} stopped", serviceName);
    }

    /**
     * Asks the run loop to wind down without interrupting it. Safe to call from any thread,
     * including signal handlers.
     */
    public final void requestStop() {
        stopRequested = true;
    }

    protected final boolean isStopRequested() {
        return stopRequested || Thread.currentThread().isInterrupted();
    }

    /**
     * Waits for the service thread to finish on its own.
     *
     * @param timeoutMs maximum wait, {@code 0} waits forever
     * @return {@code true} if the thread has terminated
     * @throws InterruptedException if the caller is interrupted
     */
    public final boolean awaitTermination(long timeoutMs) throws InterruptedException {
        Thread thread = serviceThread;
        if (thread == null) {
            return true;
        }
        thread.join(timeoutMs);
        return !thread.isAlive();
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format("Cannot pause service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} paused", serviceName);
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("{} resumed", serviceName);
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public void restart() {
        stop();
        start();
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("{} interrupted, shutting down", serviceName);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}: {}", serviceName, e.getClass().getSimpleName(), e.getMessage());
            log.debug("Exception details:", e);
            recordError("SERVICE_FAILED", e.getClass().getSimpleName(), String.valueOf(e.getMessage()));
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated", serviceName);
        }
    }

    /**
     * The service's main loop. Must poll {@link #isStopRequested()} and {@link #checkPause()} between units of work.
     *
     * @throws InterruptedException if interrupted during a blocking call
     */
    protected abstract void run() throws InterruptedException;

    protected void checkPause() throws InterruptedException {
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED && !stopRequested) {
                log.debug("{} is paused, waiting", serviceName);
                pauseLock.wait();
            }
        }
    }

    protected <T extends IResource> T getRequiredResource(String portName, Class<T> expectedType) {
        List<IResource> resourceList = resources.get(portName);
        if (resourceList == null || resourceList.isEmpty()) {
            throw new IllegalStateException("Resource port '" + portName + "' is not configured, but exactly one resource is required.");
        }
        if (resourceList.size() > 1) {
            throw new IllegalStateException("Resource port '" + portName + "' has " + resourceList.size() + " resources, but exactly one is required.");
        }
        return cast(portName, resourceList.get(0), expectedType);
    }

    protected <T> Optional<T> getOptionalResource(String portName, Class<T> expectedType) {
        List<IResource> resourceList = resources.get(portName);
        if (resourceList == null || resourceList.isEmpty()) {
            return Optional.empty();
        }
        if (resourceList.size() > 1) {
            throw new IllegalStateException("Resource port '" + portName + "' has " + resourceList.size() + " resources, but at most one is allowed.");
        }
        return Optional.of(cast(portName, resourceList.get(0), expectedType));
    }

    private static <T> T cast(String portName, IResource resource, Class<T> expectedType) {
        if (!expectedType.isInstance(resource)) {
            throw new IllegalStateException("Resource at port '" + portName + "' is of type " + resource.getClass().getName()
                + ", but expected type is " + expectedType.getName());
        }
        return expectedType.cast(resource);
    }

    /**
     * Records a transient error. Use only when the service keeps running.
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) return false;
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for service-specific metrics. Overrides must call {@code super.addCustomMetrics(metrics)} first.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // no custom metrics by default
    }
}
