package org.promoharvest.pipeline.api.services;

import org.promoharvest.pipeline.api.resources.OperationalError;

import java.util.List;

/**
 * A long-running pipeline component with a start/stop/pause/resume lifecycle.
 * <p>
 * Services are constructed with {@code (String name, Config options, Map<String, List<IResource>> resources)}.
 */
public interface IService {

    /**
     * The operational state of a service.
     */
    enum State {
        /** Not running; either never started or finished. */
        STOPPED,
        /** Actively working. */
        RUNNING,
        /** Suspended; resumes where it left off. */
        PAUSED,
        /** Ended on a fatal error. */
        ERROR
    }

    /**
     * Starts the service on its own thread.
     *
     * @throws IllegalStateException if the service is not STOPPED
     */
    void start();

    /**
     * Stops the service and waits for its thread to finish.
     *
     * @throws IllegalStateException if the service is neither RUNNING nor PAUSED
     */
    void stop();

    void pause();

    void resume();

    State getCurrentState();

    /**
     * Stop followed by start.
     */
    void restart();

    List<OperationalError> getErrors();

    void clearErrors();
}
