package org.promoharvest.cli.commands;

import com.typesafe.config.ConfigFactory;
import org.promoharvest.cli.CommandLineInterface;
import org.promoharvest.cli.RunLock;
import org.promoharvest.pipeline.api.services.IService;
import org.promoharvest.pipeline.services.FetchOrchestrator;
import org.promoharvest.pipeline.services.PipelineState;
import org.promoharvest.pipeline.services.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs one ingestion pass over the backlog.
 * Exit codes: {@code 0} completed (with or without errors), {@code 2} stopped, {@code 1} failed or locked.
 */
@Command(
    name = "ingest",
    description = "Fetches every pending identity into batch files and merges them into the record log."
)
public class IngestCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_STOPPED = 2;

    /** How long the shutdown hook waits for the main thread to release the run lock once the orchestrator stopped. */
    static final Duration RELEASE_TIMEOUT = Duration.ofSeconds(10);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = "--force", description = "Take over the run lock left by a crashed run.")
    private boolean force;

    @Option(names = "--no-merge", description = "Leave batch files unmerged when the run completes.")
    private boolean noMerge;

    @Option(names = "--max-per-minute", description = "Override the request budget per minute.")
    private Integer maxPerMinute;

    @Option(names = "--workers", description = "Number of concurrent fetches.")
    private Integer workers;

    @Override
    public Integer call() throws Exception {
        final Map<String, Object> overrides = new HashMap<>();
        if (noMerge) {
            overrides.put("mergeOnCompletion", false);
        }
        if (maxPerMinute != null) {
            overrides.put("maxPerMinute", maxPerMinute);
        }
        if (workers != null) {
            overrides.put("maxConcurrentFetches", workers);
        }
        final FetchOrchestrator orchestrator = parent.createFactory()
            .service("ingest", FetchOrchestrator.class, ConfigFactory.parseMap(overrides));
        final PrintWriter out = spec.commandLine().getOut();
        final GracefulShutdown shutdown = new GracefulShutdown(orchestrator, RELEASE_TIMEOUT);

        try {
            try (RunLock lock = RunLock.acquire(orchestrator.getRecordLog(), force)) {
                final Thread hook = new Thread(shutdown, "promoharvest-shutdown");
                Runtime.getRuntime().addShutdownHook(hook);
                orchestrator.start();
                try {
                    orchestrator.awaitTermination(0);
                } finally {
                    removeHook(hook);
                }
            } catch (RunLock.LockHeldException e) {
                spec.commandLine().getErr().println(e.getMessage());
                return EXIT_FAILED;
            }

            final RunStatus status = orchestrator.getLastRunStatus();
            final PipelineState state = orchestrator.getPipelineState();
            if (state != null) {
                out.printf("%s: %d fetched, %d failed, %d empty, %d skipped, %d batches flushed%n",
                    status != null ? status.wireName() : "failed",
                    state.succeeded(), state.failed(), state.empty(), state.skipped(), state.batchesFlushed());
            }
            out.flush();
            return exitCode(status);
        } finally {
            shutdown.released();
        }
    }

    static int exitCode(final RunStatus status) {
        if (status == null) {
            return EXIT_FAILED;
        }
        switch (status) {
            case COMPLETED:
            case COMPLETED_WITH_ERRORS:
                return EXIT_OK;
            case STOPPED:
                return EXIT_STOPPED;
            default:
                return EXIT_FAILED;
        }
    }

    /**
     * Shutdown hook body. Stops the orchestrator, then holds the JVM until the main thread has released
     * the run lock and reported, since the JVM halts as soon as every hook has returned.
     */
    static final class GracefulShutdown implements Runnable {

        private final FetchOrchestrator orchestrator;
        private final Duration releaseTimeout;
        private final CountDownLatch released = new CountDownLatch(1);

        GracefulShutdown(final FetchOrchestrator orchestrator, final Duration releaseTimeout) {
            this.orchestrator = orchestrator;
            this.releaseTimeout = releaseTimeout;
        }

        @Override
        public void run() {
            stopGracefully();
            try {
                if (!released.await(releaseTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOGGER.warn("Run lock of {} not released within {} ms", orchestrator.getRecordLog(), releaseTimeout.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.debug("Interrupted while waiting for the run lock to be released");
            }
        }

        /**
         * Called by the main thread once the run lock is gone.
         */
        void released() {
            released.countDown();
        }

        private void stopGracefully() {
            final IService.State state = orchestrator.getCurrentState();
            if (state != IService.State.RUNNING && state != IService.State.PAUSED) {
                return;
            }
            LOGGER.info("Shutdown requested, finishing current fetch and flushing");
            try {
                orchestrator.stop();
            } catch (IllegalStateException e) {
                LOGGER.debug("Orchestrator finished before stop: {}", e.getMessage());
            }
        }
    }

    private static void removeHook(final Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOGGER.debug("JVM already shutting down, hook stays registered");
        }
    }
}
